package com.gentoro.batchinfer.exception;

/** Failures reading or writing persisted results. */
public class PersistenceException extends BatchInferenceException {
  public PersistenceException(String message) {
    super(ErrorCode.PERSISTENCE_ERROR, message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(ErrorCode.PERSISTENCE_ERROR, message, cause);
  }
}
