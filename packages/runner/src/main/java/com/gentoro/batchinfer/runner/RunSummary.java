package com.gentoro.batchinfer.runner;

import com.gentoro.batchinfer.exception.ExceptionUtil.ErrorDetails;
import com.gentoro.batchinfer.model.Result;
import java.util.List;

/**
 * Outcome of {@link JobRunner#run(List)}.
 *
 * @param total jobs handed to the runner
 * @param skipped jobs whose id already had a persisted result
 * @param duplicates repeated ids within the input, dropped after their first occurrence
 * @param submitted jobs actually executed
 * @param results successful results, in completion order
 * @param failures one entry per failed job
 */
public record RunSummary(
    int total,
    int skipped,
    int duplicates,
    int submitted,
    List<Result> results,
    List<JobFailure> failures) {

  public RunSummary {
    results = List.copyOf(results);
    failures = List.copyOf(failures);
  }

  public int succeeded() {
    return results.size();
  }

  public int failed() {
    return failures.size();
  }

  /** A job that produced no result. */
  public record JobFailure(String jobId, ErrorDetails error) {}
}
