package com.gentoro.batchinfer.model;

/** Selects the prompt template and answer label a job is asked for. */
public enum AnswerType {
  /** Free-form short answer, labelled {@code Exact Answer:}. */
  EXACT_MATCH("exact_match"),
  /** Answer choice, labelled {@code Answer:}. */
  MULTIPLE_CHOICE("multipleChoice");

  private final String wireValue;

  AnswerType(String wireValue) {
    this.wireValue = wireValue;
  }

  /** Anything other than {@code exact_match} is treated as multiple choice. */
  public static AnswerType fromWire(String value) {
    if (value != null && EXACT_MATCH.wireValue.equals(value.trim())) {
      return EXACT_MATCH;
    }
    return MULTIPLE_CHOICE;
  }
}
