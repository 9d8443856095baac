package com.gentoro.verifier.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

/** Outbound HTTP clients with shared timeouts and request tracing. */
public class OkHttpFactory {

  private OkHttpFactory() {}

  /**
   * @param callTimeout upper bound for a whole call including retries and reading the body
   */
  public static OkHttpClient create(Duration callTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(callTimeout)
        .callTimeout(callTimeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
