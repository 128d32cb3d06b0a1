package com.gentoro.batchinfer.source;

import com.gentoro.batchinfer.model.Job;
import java.util.List;

/** Supplies the jobs for a run. */
public interface JobSource {

  /**
   * Load every job. Called once, before any work starts.
   *
   * @throws com.gentoro.batchinfer.exception.JobSourceException if the dataset cannot be read
   */
  List<Job> load();

  /** Human-readable origin used in log lines. */
  String describe();
}
