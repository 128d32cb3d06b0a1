package com.gentoro.batchinfer;

import com.gentoro.batchinfer.runner.RunSummary;

public class BatchInferenceApp {

  private static final org.slf4j.Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(BatchInferenceApp.class);

  public static void main(String[] args) {
    BatchInference app;
    try {
      app = new BatchInference(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
      return;
    }

    int exitCode = 0;
    try {
      RunSummary summary = app.run();
      log.info(
          "Done: {} jobs, {} already had results, {} processed ({} succeeded, {} failed)",
          summary.total(),
          summary.skipped(),
          summary.submitted(),
          summary.succeeded(),
          summary.failed());
    } catch (Exception e) {
      log.error("Run aborted", e);
      exitCode = 1;
    } finally {
      app.shutdown();
    }
    System.exit(exitCode);
  }
}
