package com.gentoro.batchinfer;

import com.gentoro.batchinfer.exception.StateException;
import com.gentoro.batchinfer.extract.ResponseExtractor;
import com.gentoro.batchinfer.http.OkHttpFactory;
import com.gentoro.batchinfer.inference.ChatCompletionsClient;
import com.gentoro.batchinfer.inference.InferenceClient;
import com.gentoro.batchinfer.model.Job;
import com.gentoro.batchinfer.prompt.PromptBuilder;
import com.gentoro.batchinfer.runner.JobRunner;
import com.gentoro.batchinfer.runner.LoggingProgressReporter;
import com.gentoro.batchinfer.runner.RunSummary;
import com.gentoro.batchinfer.source.JobSource;
import com.gentoro.batchinfer.source.JobSourceFactory;
import com.gentoro.batchinfer.store.FileResultStore;
import com.gentoro.batchinfer.stream.StreamParser;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires the components of one batch run together: configuration, result store, job source,
 * inference client and runner.
 *
 * <p>Call {@link #initialize()} first; any failure there is fatal for the run. {@link #run()} then
 * loads the jobs and processes whatever is still pending.
 */
public class BatchInference {

  private static final org.slf4j.Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(BatchInference.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private RunnerSettings settings;
  private FileResultStore resultStore;
  private OkHttpClient httpClient;
  private JobSource jobSource;
  private InferenceClient inferenceClient;
  private JobRunner jobRunner;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public BatchInference(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.batchinfer.logging.LoggingService.applyConfiguration(configuration());

    this.settings = RunnerSettings.from(configuration(), startupParameters);
    log.info("Starting with {}", settings);

    this.resultStore = new FileResultStore(settings.resultsDirectory());
    this.httpClient = OkHttpFactory.create(settings.requestTimeout());
    this.jobSource = JobSourceFactory.create(settings, httpClient);
    this.inferenceClient =
        new ChatCompletionsClient(
            httpClient,
            settings.baseUrl(),
            settings.model(),
            settings.temperature(),
            settings.apiKey(),
            new StreamParser());
    this.jobRunner =
        new JobRunner(
            inferenceClient,
            resultStore,
            new PromptBuilder(),
            new ResponseExtractor(),
            settings.numWorkers(),
            new LoggingProgressReporter());
  }

  /** Load all jobs from the configured source and process the ones without a result. */
  public RunSummary run() {
    if (jobRunner == null) {
      throw new StateException("BatchInference not initialized. Call initialize() first.");
    }
    log.info("Loading jobs from {}", jobSource.describe());
    List<Job> jobs = jobSource.load();
    log.info("Total jobs: {}", jobs.size());
    return jobRunner.run(jobs);
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      OkHttpFactory.shutdown(httpClient);
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("BatchInference not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public RunnerSettings settings() {
    return settings;
  }

  public FileResultStore resultStore() {
    return resultStore;
  }

  public JobSource jobSource() {
    return jobSource;
  }
}
