package com.gentoro.batchinfer;

import com.gentoro.batchinfer.exception.ConfigException;
import com.gentoro.batchinfer.exception.ExceptionUtil;
import com.gentoro.batchinfer.source.HuggingFaceJobSource;
import java.nio.file.Path;
import java.time.Duration;
import okhttp3.HttpUrl;
import org.apache.commons.configuration2.Configuration;

/**
 * Resolved settings for one run. Command-line parameters win over {@code application.yaml}.
 *
 * <table>
 *   <caption>Sources</caption>
 *   <tr><th>Setting</th><th>CLI</th><th>Configuration key</th></tr>
 *   <tr><td>model</td><td>--model</td><td>inference.model</td></tr>
 *   <tr><td>temperature</td><td>--temperature</td><td>inference.temperature</td></tr>
 *   <tr><td>base URL</td><td>--http_url</td><td>inference.base-url</td></tr>
 *   <tr><td>request timeout</td><td>--timeout</td><td>inference.timeout-seconds</td></tr>
 *   <tr><td>API key</td><td></td><td>inference.api-key</td></tr>
 *   <tr><td>concurrency</td><td>--num_workers</td><td>runner.num-workers</td></tr>
 *   <tr><td>results directory</td><td>--results_dir</td><td>results.location</td></tr>
 *   <tr><td>test mode</td><td>--test_mode</td><td>dataset.test-mode</td></tr>
 *   <tr><td>dataset name</td><td>--dataset</td><td>dataset.name</td></tr>
 *   <tr><td>dataset config</td><td>--dataset_config</td><td>dataset.config</td></tr>
 *   <tr><td>dataset split</td><td>--split</td><td>dataset.split</td></tr>
 *   <tr><td>local dataset file</td><td>--dataset_file</td><td>dataset.file</td></tr>
 *   <tr><td>skip multimodal jobs</td><td></td><td>dataset.skip-images</td></tr>
 *   <tr><td>datasets-server URL</td><td></td><td>dataset.server-url</td></tr>
 *   <tr><td>datasets-server page size</td><td></td><td>dataset.page-size</td></tr>
 *   <tr><td>Hugging Face token</td><td></td><td>dataset.token</td></tr>
 * </table>
 */
public record RunnerSettings(
    String model,
    double temperature,
    HttpUrl baseUrl,
    Duration requestTimeout,
    String apiKey,
    int numWorkers,
    Path resultsDirectory,
    boolean testMode,
    String datasetName,
    String datasetConfig,
    String datasetSplit,
    Path datasetFile,
    boolean skipImages,
    HttpUrl datasetServerUrl,
    int datasetPageSize,
    String datasetToken) {

  public static final int DEFAULT_NUM_WORKERS = 10;
  public static final long DEFAULT_TIMEOUT_SECONDS = 300;

  public RunnerSettings {
    if (model == null || model.isBlank()) {
      throw new ConfigException("No model configured (--model or inference.model)");
    }
    if (numWorkers < 1) {
      throw new ConfigException("num_workers must be at least 1, got " + numWorkers);
    }
    if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new ConfigException("Request timeout must be positive");
    }
  }

  public static RunnerSettings from(Configuration config, StartupParameters params) {
    try {
      String model =
          pick(
              params.getParameter("model", String.class),
              config.getString("inference.model", null));
      double temperature =
          pick(
              params.getParameter("temperature", Double.class),
              config.getDouble("inference.temperature", 0.0));
      String baseUrl =
          pick(
              params.getParameter("http_url", String.class),
              config.getString("inference.base-url", "http://localhost:8000/v1"));
      long timeoutSeconds =
          pick(
              params.getParameter("timeout", Long.class),
              config.getLong("inference.timeout-seconds", DEFAULT_TIMEOUT_SECONDS));
      int numWorkers =
          pick(
              params.getParameter("num_workers", Integer.class),
              config.getInt("runner.num-workers", DEFAULT_NUM_WORKERS));
      String resultsDir =
          pick(
              params.getParameter("results_dir", String.class),
              config.getString("results.location", "results"));
      boolean testMode =
          pick(
              params.getParameter("test_mode", Boolean.class),
              config.getBoolean("dataset.test-mode", false));
      String datasetFile =
          pick(
              params.getParameter("dataset_file", String.class),
              config.getString("dataset.file", null));

      return new RunnerSettings(
          model,
          temperature,
          url("inference.base-url", baseUrl),
          Duration.ofSeconds(timeoutSeconds),
          config.getString("inference.api-key", null),
          numWorkers,
          Path.of(resultsDir),
          testMode,
          pick(
              params.getParameter("dataset", String.class),
              config.getString("dataset.name", null)),
          pick(
              params.getParameter("dataset_config", String.class),
              config.getString("dataset.config", "default")),
          pick(
              params.getParameter("split", String.class),
              config.getString("dataset.split", "test")),
          datasetFile == null || datasetFile.isBlank() ? null : Path.of(datasetFile),
          config.getBoolean("dataset.skip-images", true),
          url(
              "dataset.server-url",
              config.getString("dataset.server-url", "https://datasets-server.huggingface.co")),
          config.getInt("dataset.page-size", HuggingFaceJobSource.MAX_PAGE_SIZE),
          config.getString("dataset.token", null));
    } catch (RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new ConfigException("Invalid configuration: " + ex.getMessage(), ex));
    }
  }

  private static <T> T pick(T cliValue, T configValue) {
    return cliValue != null ? cliValue : configValue;
  }

  private static HttpUrl url(String key, String value) {
    HttpUrl url = value == null ? null : HttpUrl.parse(value.trim());
    if (url == null) {
      throw new ConfigException("Invalid URL for " + key + ": " + value);
    }
    return url;
  }

  // Leaves out the API key and dataset token.
  @Override
  public String toString() {
    return ("RunnerSettings[model=%s, temperature=%s, baseUrl=%s, timeout=%ss, numWorkers=%d,"
            + " results=%s]")
        .formatted(
            model, temperature, baseUrl, requestTimeout.toSeconds(), numWorkers, resultsDirectory);
  }
}
