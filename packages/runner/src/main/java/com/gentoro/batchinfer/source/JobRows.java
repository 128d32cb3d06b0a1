package com.gentoro.batchinfer.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.batchinfer.exception.JobSourceException;
import com.gentoro.batchinfer.model.AnswerType;
import com.gentoro.batchinfer.model.Job;

/** Maps dataset rows ({@code id}, {@code question}, {@code answer_type}, {@code image}) to jobs. */
final class JobRows {
  private JobRows() {}

  static Job toJob(JsonNode row, String origin) {
    if (row == null || !row.isObject()) {
      throw new JobSourceException("Expected a JSON object in " + origin);
    }
    String id = scalar(row.get("id"));
    if (id == null || id.isBlank()) {
      throw new JobSourceException("Row without an id in " + origin);
    }
    String question = scalar(row.get("question"));
    if (question == null) {
      throw new JobSourceException("Row " + id + " has no question in " + origin);
    }
    return new Job(
        id,
        question,
        AnswerType.fromWire(scalar(row.get("answer_type"))),
        image(row.get("image")));
  }

  private static String scalar(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }

  // Datasets-server renders images as objects ({"src": ...}); local files usually carry a string.
  private static String image(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isObject()) {
      JsonNode src = node.get("src");
      return src != null && src.isTextual() ? src.asText() : node.toString();
    }
    return scalar(node);
  }
}
