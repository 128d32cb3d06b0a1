package com.gentoro.batchinfer.exception;

/** Stable error categories reported alongside {@link BatchInferenceException}. */
public enum ErrorCode {
  CONFIG_ERROR,
  TRANSPORT_ERROR,
  CHUNK_DECODE_ERROR,
  PERSISTENCE_ERROR,
  JOB_SOURCE_ERROR,
  STATE_ERROR,
  UNKNOWN
}
