package com.gentoro.batchinfer.exception;

/** A component was used before it was initialized, or after it was shut down. */
public class StateException extends BatchInferenceException {
  public StateException(String message) {
    super(ErrorCode.STATE_ERROR, message);
  }
}
