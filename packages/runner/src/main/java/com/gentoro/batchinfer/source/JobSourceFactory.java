package com.gentoro.batchinfer.source;

import com.gentoro.batchinfer.RunnerSettings;
import okhttp3.OkHttpClient;

/** Chooses the job source for a run from its settings. */
public final class JobSourceFactory {
  private JobSourceFactory() {}

  /**
   * Test mode wins, then a local dataset file, then the Hugging Face dataset. Production sources
   * drop multimodal jobs unless {@code dataset.skip-images} is off.
   */
  public static JobSource create(RunnerSettings settings, OkHttpClient httpClient) {
    if (settings.testMode()) {
      return new TestJobSource();
    }
    JobSource source;
    if (settings.datasetFile() != null) {
      source = new JsonlJobSource(settings.datasetFile());
    } else {
      source =
          new HuggingFaceJobSource(
              httpClient,
              settings.datasetServerUrl(),
              settings.datasetName(),
              settings.datasetConfig(),
              settings.datasetSplit(),
              settings.datasetPageSize(),
              settings.datasetToken());
    }
    return settings.skipImages() ? new TextOnlyJobSource(source) : source;
  }
}
