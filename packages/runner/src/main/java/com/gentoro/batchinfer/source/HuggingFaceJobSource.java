package com.gentoro.batchinfer.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.batchinfer.exception.JobSourceException;
import com.gentoro.batchinfer.model.Job;
import com.gentoro.batchinfer.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * Pages through a Hugging Face dataset split using the datasets-server {@code /rows} endpoint.
 *
 * <p>Each page returns {@code {"rows": [{"row_idx": n, "row": {...}}], "num_rows_total": N}}.
 * Paging stops once {@code num_rows_total} rows were read or a page comes back empty.
 */
public class HuggingFaceJobSource implements JobSource {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(HuggingFaceJobSource.class);

  /** The datasets-server refuses pages larger than this. */
  public static final int MAX_PAGE_SIZE = 100;

  private final OkHttpClient httpClient;
  private final HttpUrl serverUrl;
  private final String dataset;
  private final String config;
  private final String split;
  private final int pageSize;
  private final String token;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public HuggingFaceJobSource(
      OkHttpClient httpClient,
      HttpUrl serverUrl,
      String dataset,
      String config,
      String split,
      int pageSize,
      String token) {
    if (dataset == null || dataset.isBlank()) {
      throw new JobSourceException("No dataset name configured");
    }
    this.httpClient = httpClient;
    this.serverUrl = serverUrl;
    this.dataset = dataset;
    this.config = config;
    this.split = split;
    this.pageSize = Math.max(1, Math.min(pageSize, MAX_PAGE_SIZE));
    this.token = token;
  }

  @Override
  public List<Job> load() {
    List<Job> jobs = new ArrayList<>();
    long offset = 0;
    long total = Long.MAX_VALUE;
    while (offset < total) {
      JsonNode page = fetchPage(offset);
      JsonNode rows = page.path("rows");
      total = page.path("num_rows_total").asLong(offset + rows.size());
      if (!rows.isArray() || rows.isEmpty()) {
        break;
      }
      for (JsonNode entry : rows) {
        long index = entry.path("row_idx").asLong(offset);
        jobs.add(JobRows.toJob(entry.path("row"), describe() + " row " + index));
      }
      offset += rows.size();
      log.debug("Fetched {}/{} rows from {}", offset, total, describe());
    }
    return jobs;
  }

  @Override
  public String describe() {
    return "dataset " + dataset + " (" + config + "/" + split + ")";
  }

  private JsonNode fetchPage(long offset) {
    HttpUrl url =
        serverUrl
            .newBuilder()
            .addPathSegment("rows")
            .addQueryParameter("dataset", dataset)
            .addQueryParameter("config", config)
            .addQueryParameter("split", split)
            .addQueryParameter("offset", Long.toString(offset))
            .addQueryParameter("length", Integer.toString(pageSize))
            .build();
    Request.Builder request = new Request.Builder().url(url).get();
    if (token != null && !token.isBlank()) {
      request.header("Authorization", "Bearer " + token);
    }
    try (Response response = httpClient.newCall(request.build()).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new JobSourceException(
            "HTTP %d reading %s at offset %d: %s"
                .formatted(response.code(), describe(), offset, text));
      }
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new JobSourceException(
          "Response from %s for %s at offset %d is not JSON"
              .formatted(url.host(), describe(), offset),
          e);
    } catch (IOException e) {
      throw new JobSourceException("Could not reach " + url.host() + " to read " + describe(), e);
    }
  }
}
