package com.gentoro.batchinfer.runner;

import com.gentoro.batchinfer.exception.ExceptionUtil;
import com.gentoro.batchinfer.model.Job;
import com.gentoro.batchinfer.model.Result;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/** Logs one line per job start and finish with a running {@code [done / total]} counter. */
public class LoggingProgressReporter implements ProgressReporter {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(LoggingProgressReporter.class);

  private final AtomicInteger completed = new AtomicInteger();
  private volatile int total;

  @Override
  public void runStarted(int pending) {
    total = pending;
    completed.set(0);
  }

  @Override
  public void jobStarted(Job job) {
    log.info("Starting job {}", job.id());
  }

  @Override
  public void jobFinished(Job job, Result result) {
    log.info(
        "[{} / {}] Finished job {} (answer: '{}')",
        completed.incrementAndGet(),
        total,
        job.id(),
        result.parsed().answer());
  }

  @Override
  public void jobFailed(Job job, Throwable error) {
    log.error(
        "[{} / {}] Job {} failed: {}",
        completed.incrementAndGet(),
        total,
        job.id(),
        ExceptionUtil.extractErrorMessage(error));
    log.debug("[{}] {}", job.id(), ExceptionUtil.formatCompactStackTrace(error));
  }
}
