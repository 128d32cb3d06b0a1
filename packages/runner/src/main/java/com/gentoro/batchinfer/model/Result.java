package com.gentoro.batchinfer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** Persisted outcome of one job. */
public record Result(
    @JsonProperty("id") String id,
    @JsonProperty("question") String question,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("raw_response") String rawResponse,
    @JsonProperty("parsed") ParsedAnswer parsed) {

  public Result {
    Objects.requireNonNull(id, "id");
    reasoning = reasoning == null ? "" : reasoning;
    rawResponse = rawResponse == null ? "" : rawResponse;
    parsed = parsed == null ? ParsedAnswer.EMPTY : parsed;
  }
}
