package com.gentoro.batchinfer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Labelled fields pulled out of a model response.
 *
 * @param explanation text after {@code Explanation:}, empty when missing
 * @param answer text after {@code Exact Answer:} or {@code Answer:}, empty when missing
 * @param confidence percentage after {@code Confidence:}, {@code null} when missing
 */
public record ParsedAnswer(
    @JsonProperty("explanation") String explanation,
    @JsonProperty("answer") String answer,
    // Written as an explicit null when missing, never omitted.
    @JsonProperty("confidence") @JsonInclude(JsonInclude.Include.ALWAYS) Integer confidence) {
  public static final ParsedAnswer EMPTY = new ParsedAnswer("", "", null);

  public ParsedAnswer {
    explanation = explanation == null ? "" : explanation;
    answer = answer == null ? "" : answer;
  }

  public boolean hasConfidence() {
    return confidence != null;
  }
}
