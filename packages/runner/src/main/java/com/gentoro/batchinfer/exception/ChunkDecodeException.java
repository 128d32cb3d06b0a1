package com.gentoro.batchinfer.exception;

/** A single streamed chunk that could not be decoded as a JSON object. */
public class ChunkDecodeException extends BatchInferenceException {
  public ChunkDecodeException(String message) {
    super(ErrorCode.CHUNK_DECODE_ERROR, message);
  }

  public ChunkDecodeException(String message, Throwable cause) {
    super(ErrorCode.CHUNK_DECODE_ERROR, message, cause);
  }
}
