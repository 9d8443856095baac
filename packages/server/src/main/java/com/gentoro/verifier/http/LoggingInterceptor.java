package com.gentoro.verifier.http;

import java.io.IOException;
import okhttp3.*;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/**
 * Traces outbound requests: method, URL and timing at DEBUG, bodies at TRACE. Transport failures
 * are logged at WARN and rethrown unchanged.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(LoggingInterceptor.class);

  // request bodies may carry whole documents
  private static final int MAX_LOGGED_BODY = 4_096;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());
    if (log.isTraceEnabled()) {
      log.trace("Request body:\n{}", abbreviate(bodyToString(request)));
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
        "Received {} for {} in {} ms", response.code(), request.url(), elapsedMs(startTime));
    if (log.isTraceEnabled()) {
      String responseBody = "";
      try {
        responseBody = response.peekBody(MAX_LOGGED_BODY).string();
      } catch (IOException e) {
        log.trace("Could not read response body", e);
      }
      log.trace("Response body:\n{}", responseBody.isEmpty() ? "[empty]" : responseBody);
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String abbreviate(String body) {
    return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
