package com.gentoro.batchinfer.exception;

/** Invalid or missing configuration. Always fatal at startup. */
public class ConfigException extends BatchInferenceException {
  public ConfigException(String message) {
    super(ErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ErrorCode.CONFIG_ERROR, message, cause);
  }
}
