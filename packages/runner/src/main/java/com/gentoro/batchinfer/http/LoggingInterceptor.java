package com.gentoro.batchinfer.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * Logs outgoing requests and the status line of responses. Response bodies are never read here:
 * inference responses are streams and are consumed incrementally by the caller.
 */
public class LoggingInterceptor implements Interceptor {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final int MAX_LOGGED_BODY = 2_000;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    if (log.isTraceEnabled()) {
      log.trace(
          "Sending request {} {}\nBody:\n{}",
          request.method(),
          request.url(),
          bodyToString(request));
    } else {
      log.debug("Sending request {} {}", request.method(), request.url());
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "Received response headers for {} in {} ms, status {}",
        response.request().url(),
        elapsedMs(startTime),
        response.code());
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Buffer buffer = new Buffer();
      if (request.body() != null) request.body().writeTo(buffer);
      String body = buffer.readUtf8();
      return body.length() > MAX_LOGGED_BODY ? body.substring(0, MAX_LOGGED_BODY) + "..." : body;
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
