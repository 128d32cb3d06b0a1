package com.gentoro.batchinfer.runner;

import com.gentoro.batchinfer.exception.ConfigException;
import com.gentoro.batchinfer.exception.ExceptionUtil;
import com.gentoro.batchinfer.extract.ResponseExtractor;
import com.gentoro.batchinfer.inference.InferenceClient;
import com.gentoro.batchinfer.model.Job;
import com.gentoro.batchinfer.model.ParsedAnswer;
import com.gentoro.batchinfer.model.Result;
import com.gentoro.batchinfer.prompt.PromptBuilder;
import com.gentoro.batchinfer.store.CompletionSet;
import com.gentoro.batchinfer.store.ResultStore;
import com.gentoro.batchinfer.stream.StreamState;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Runs every pending job through request, stream parsing, extraction and persistence on a bounded
 * worker pool.
 *
 * <ul>
 *   <li>At most {@code concurrency} jobs are in flight at once; each job is one task on a fixed
 *       pool of that many threads.
 *   <li>Jobs whose id is in the store's {@link CompletionSet} are skipped before anything is
 *       submitted, which is what makes a re-run resume instead of repeating work.
 *   <li>A failing job is logged and reported, contributes no result and never affects the others.
 *   <li>{@link #run(List)} returns only after every submitted job has finished.
 * </ul>
 */
public class JobRunner {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(JobRunner.class);

  private final InferenceClient client;
  private final ResultStore store;
  private final PromptBuilder prompts;
  private final ResponseExtractor extractor;
  private final int concurrency;
  private final ProgressReporter progress;

  public JobRunner(
      InferenceClient client,
      ResultStore store,
      PromptBuilder prompts,
      ResponseExtractor extractor,
      int concurrency,
      ProgressReporter progress) {
    if (concurrency < 1) {
      throw new ConfigException("Concurrency must be at least 1, got " + concurrency);
    }
    this.client = client;
    this.store = store;
    this.prompts = prompts;
    this.extractor = extractor;
    this.concurrency = concurrency;
    this.progress = progress == null ? ProgressReporter.NONE : progress;
  }

  public RunSummary run(List<Job> jobs) {
    CompletionSet completed = store.completed();
    List<Job> pending = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    int skipped = 0;
    int duplicates = 0;
    for (Job job : jobs) {
      if (completed.contains(job.id())) {
        skipped++;
      } else if (!seen.add(job.id())) {
        duplicates++;
        log.warn("Ignoring duplicate job id {}", job.id());
      } else {
        pending.add(job);
      }
    }
    if (skipped > 0) {
      log.info("Skipping {} jobs that already have results", skipped);
    }
    if (pending.isEmpty()) {
      log.info("All jobs have already been processed!");
      return new RunSummary(jobs.size(), skipped, duplicates, 0, List.of(), List.of());
    }

    log.info("Processing {} new jobs with {} workers...", pending.size(), concurrency);
    progress.runStarted(pending.size());

    List<Result> results = new ArrayList<>();
    List<RunSummary.JobFailure> failures = new ArrayList<>();
    ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(concurrency, pending.size()), workerThreads());
    CompletionService<Outcome> completion = new ExecutorCompletionService<>(executor);
    Map<Future<Outcome>, Job> submitted = new IdentityHashMap<>();
    try {
      for (Job job : pending) {
        submitted.put(completion.submit(() -> attempt(job)), job);
      }
      for (int i = 0; i < pending.size(); i++) {
        Future<Outcome> future = completion.take();
        Job job = submitted.remove(future);
        Outcome outcome = outcomeOf(future, job);
        if (outcome.result() != null) {
          results.add(outcome.result());
        } else {
          failures.add(
              new RunSummary.JobFailure(job.id(), ExceptionUtil.toErrorDetails(outcome.error())));
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Run interrupted; cancelling {} unfinished jobs", submitted.size());
      for (Map.Entry<Future<Outcome>, Job> entry : submitted.entrySet()) {
        entry.getKey().cancel(true);
        failures.add(
            new RunSummary.JobFailure(entry.getValue().id(), ExceptionUtil.toErrorDetails(e)));
      }
    } finally {
      shutdown(executor);
    }

    log.info(
        "Run complete: {} succeeded, {} failed, {} skipped",
        results.size(),
        failures.size(),
        skipped);
    return new RunSummary(jobs.size(), skipped, duplicates, pending.size(), results, failures);
  }

  /**
   * One unit of work. Never throws: every failure is turned into an {@link Outcome}. A job whose
   * worker was interrupted by a cancelled run persists nothing and reports nothing.
   */
  private Outcome attempt(Job job) {
    try {
      progress.jobStarted(job);
      StreamState stream = client.streamChat(job.id(), prompts.build(job));
      ParsedAnswer parsed = extractor.extract(stream.content());
      Result result =
          new Result(job.id(), job.question(), stream.reasoning(), stream.content(), parsed);
      if (Thread.currentThread().isInterrupted()) {
        // Cancelled while blocked on an uninterruptible read; the run already counted it as failed.
        log.debug("[{}] Run cancelled, discarding result", job.id());
        return Outcome.failure(new InterruptedException("Run cancelled before job " + job.id()));
      }
      store.put(result);
      progress.jobFinished(job, result);
      return Outcome.success(result);
    } catch (Exception e) {
      reportFailure(job, e);
      return Outcome.failure(e);
    }
  }

  private Outcome outcomeOf(Future<Outcome> future, Job job) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      // Errors (not Exceptions) escape attempt(); still confined to this job.
      Throwable cause = e.getCause() == null ? e : e.getCause();
      reportFailure(job, cause);
      return Outcome.failure(cause);
    }
  }

  private void reportFailure(Job job, Throwable error) {
    try {
      progress.jobFailed(job, error);
    } catch (RuntimeException e) {
      log.warn("[{}] Progress reporter failed: {}", job.id(), e.toString());
    }
  }

  private static void shutdown(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory workerThreads() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "inference-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  private record Outcome(Result result, Throwable error) {
    static Outcome success(Result result) {
      return new Outcome(result, null);
    }

    static Outcome failure(Throwable error) {
      return new Outcome(null, error);
    }
  }
}
