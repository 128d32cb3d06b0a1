package com.gentoro.batchinfer.exception;

/**
 * Connection failures, timeouts and non-2xx responses from the inference endpoint. Confined to the
 * job that issued the request.
 */
public class TransportException extends BatchInferenceException {
  public TransportException(String message) {
    super(ErrorCode.TRANSPORT_ERROR, message);
  }

  public TransportException(String message, Throwable cause) {
    super(ErrorCode.TRANSPORT_ERROR, message, cause);
  }
}
