package com.gentoro.batchinfer.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Client shared by every worker. Connect, read and write timeouts all use {@code timeout}; the
   * read timeout applies between streamed chunks, not to the whole response.
   */
  public static OkHttpClient create(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Timeout must be positive");
    }
    return new OkHttpClient.Builder()
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .writeTimeout(timeout)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /** Release dispatcher threads and pooled connections. */
  public static void shutdown(OkHttpClient client) {
    if (client == null) return;
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
