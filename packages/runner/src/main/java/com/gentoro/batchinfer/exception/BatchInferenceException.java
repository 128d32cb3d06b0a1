package com.gentoro.batchinfer.exception;

/**
 * Base unchecked exception for the runner. Every subclass carries an {@link ErrorCode} so failures
 * can be grouped in run summaries and logs without inspecting the concrete type.
 */
public class BatchInferenceException extends RuntimeException {
  private final ErrorCode code;

  public BatchInferenceException(ErrorCode code, String message) {
    super(message);
    this.code = code == null ? ErrorCode.UNKNOWN : code;
  }

  public BatchInferenceException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? ErrorCode.UNKNOWN : code;
  }

  public ErrorCode getCode() {
    return code;
  }
}
