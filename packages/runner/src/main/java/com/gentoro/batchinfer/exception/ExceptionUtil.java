package com.gentoro.batchinfer.exception;

import java.time.Instant;
import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Helpers for turning failures into log lines and per-job error records. */
public final class ExceptionUtil {
  private static final int DEFAULT_STACK_FRAMES = 10;

  private ExceptionUtil() {}

  /** Structured, log-friendly view of a failure. */
  public record ErrorDetails(String type, String message, ErrorCode code, Instant timestamp) {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * BatchInferenceException}, its code is preserved; otherwise the first coded cause in the chain
   * is used, falling back to {@link ErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t == null) {
      return new ErrorDetails("Unknown", "", ErrorCode.UNKNOWN, Instant.now());
    }
    ErrorCode code = ErrorCode.UNKNOWN;
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (current instanceof BatchInferenceException ex) {
        code = ex.getCode();
        break;
      }
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), extractErrorMessage(t), code, Instant.now());
  }

  /**
   * One-line stack summary for log lines, innermost frame first: {@code
   * com.gentoro.batchinfer.store.FileResultStore.put (FileResultStore.java:88) > ...}. At most
   * {@code maxFrames} frames are rendered; zero or less renders all of them.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] frames = t.getStackTrace();
    long limit = maxFrames <= 0 ? frames.length : maxFrames;
    return Arrays.stream(frames)
        .limit(limit)
        .map(ExceptionUtil::describeFrame)
        .collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_STACK_FRAMES);
  }

  private static String describeFrame(StackTraceElement frame) {
    String file = frame.getFileName() == null ? "Unknown Source" : frame.getFileName();
    String location = frame.getLineNumber() >= 0 ? file + ":" + frame.getLineNumber() : file;
    return frame.getClassName() + "." + frame.getMethodName() + " (" + location + ")";
  }

  /**
   * Extract a one-line, user-facing message from a throwable. The message of the outermost {@link
   * BatchInferenceException} in the cause chain wins; the root cause is appended when its message
   * is not already part of it (e.g. a socket timeout).
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }

    for (Throwable current = t; current != null; current = current.getCause()) {
      if (current instanceof BatchInferenceException && !isBlank(current.getMessage())) {
        String message = current.getMessage();
        if (root != current
            && !isBlank(root.getMessage())
            && !message.contains(root.getMessage())) {
          return message + " (caused by " + describe(root) + ")";
        }
        return message;
      }
      if (current.getCause() == current) break;
    }
    return describe(t);
  }

  private static String describe(Throwable t) {
    String className = t.getClass().getSimpleName();
    return isBlank(t.getMessage()) ? className : className + ": " + t.getMessage();
  }

  private static boolean isBlank(String s) {
    return s == null || s.trim().isEmpty();
  }

  public static BatchInferenceException rethrowIfUnchecked(
      Throwable t, Function<Throwable, BatchInferenceException> supplier) {
    return t instanceof BatchInferenceException coded ? coded : supplier.apply(t);
  }
}
