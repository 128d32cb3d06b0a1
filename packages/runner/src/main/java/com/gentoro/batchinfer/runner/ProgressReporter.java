package com.gentoro.batchinfer.runner;

import com.gentoro.batchinfer.model.Job;
import com.gentoro.batchinfer.model.Result;

/** Observability hooks invoked by {@link JobRunner}. Called concurrently from worker threads. */
public interface ProgressReporter {

  void runStarted(int pending);

  void jobStarted(Job job);

  void jobFinished(Job job, Result result);

  void jobFailed(Job job, Throwable error);

  ProgressReporter NONE =
      new ProgressReporter() {
        @Override
        public void runStarted(int pending) {}

        @Override
        public void jobStarted(Job job) {}

        @Override
        public void jobFinished(Job job, Result result) {}

        @Override
        public void jobFailed(Job job, Throwable error) {}
      };
}
