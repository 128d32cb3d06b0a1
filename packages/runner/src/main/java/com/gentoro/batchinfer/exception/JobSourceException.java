package com.gentoro.batchinfer.exception;

/** The configured dataset could not be reached or read. */
public class JobSourceException extends BatchInferenceException {
  public JobSourceException(String message) {
    super(ErrorCode.JOB_SOURCE_ERROR, message);
  }

  public JobSourceException(String message, Throwable cause) {
    super(ErrorCode.JOB_SOURCE_ERROR, message, cause);
  }
}
