package com.gentoro.batchinfer.model;

import java.util.Objects;

/**
 * A single unit of inference work as read from a job source.
 *
 * @param id unique identifier; also names the persisted result file
 * @param question question text inserted into the prompt template
 * @param answerType selects the prompt template
 * @param image image reference from the dataset, {@code null} or empty for text-only jobs
 */
public record Job(String id, String question, AnswerType answerType, String image) {
  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(question, "question");
    answerType = answerType == null ? AnswerType.MULTIPLE_CHOICE : answerType;
  }

  public Job(String id, String question, AnswerType answerType) {
    this(id, question, answerType, null);
  }

  public boolean hasImage() {
    return image != null && !image.isBlank();
  }
}
