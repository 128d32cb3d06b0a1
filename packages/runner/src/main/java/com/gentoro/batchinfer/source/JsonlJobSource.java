package com.gentoro.batchinfer.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.batchinfer.exception.JobSourceException;
import com.gentoro.batchinfer.model.Job;
import com.gentoro.batchinfer.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads jobs from a local file: either a JSON array of rows, or one JSON object per line. Blank
 * lines are skipped; a malformed line fails the whole load with its line number.
 */
public class JsonlJobSource implements JobSource {
  private final Path file;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public JsonlJobSource(Path file) {
    this.file = file;
  }

  @Override
  public List<Job> load() {
    if (!Files.isRegularFile(file)) {
      throw new JobSourceException("Dataset file not found: " + file.toAbsolutePath());
    }
    try {
      return isJsonArray() ? readArray() : readLines();
    } catch (IOException e) {
      throw new JobSourceException("Could not read dataset file " + file, e);
    }
  }

  @Override
  public String describe() {
    return "file " + file;
  }

  private boolean isJsonArray() throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      int c;
      while ((c = reader.read()) != -1) {
        if (!Character.isWhitespace(c) && c != '\uFEFF') {
          return c == '[';
        }
      }
      return false;
    }
  }

  private List<Job> readArray() throws IOException {
    JsonNode root = mapper.readTree(file.toFile());
    List<Job> jobs = new ArrayList<>(root.size());
    for (int i = 0; i < root.size(); i++) {
      jobs.add(JobRows.toJob(root.get(i), file + "[" + i + "]"));
    }
    return jobs;
  }

  private List<Job> readLines() throws IOException {
    List<Job> jobs = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) continue;
        String origin = file + ":" + lineNumber;
        try {
          jobs.add(JobRows.toJob(mapper.readTree(line), origin));
        } catch (JsonProcessingException e) {
          throw new JobSourceException("Malformed JSON at " + origin, e);
        }
      }
    }
    return jobs;
  }
}
