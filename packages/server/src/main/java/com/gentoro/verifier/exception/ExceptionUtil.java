package com.gentoro.verifier.exception;

import java.util.Map;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Error code, message and context of a throwable. Anything outside the service hierarchy is
   * reported as {@link VerifierErrorCode#UNKNOWN} with its cleaned message.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof VerifierException ex) {
      return new ErrorDetails(
          ex.getCode(), ex.getClass().getSimpleName(), extractErrorMessage(ex), ex.getContext());
    }
    return new ErrorDetails(
        VerifierErrorCode.UNKNOWN,
        t == null ? "" : t.getClass().getSimpleName(),
        extractErrorMessage(t),
        Map.of());
  }

  /**
   * Describe the cause chain of a throwable as {@code Type: message <- Type: message}, outermost
   * first. Used as the {@code error_details} of failed jobs.
   */
  public static String describeCauseChain(Throwable t) {
    if (t == null) return "";
    StringBuilder sb = new StringBuilder();
    Throwable current = t;
    int depth = 0;
    while (current != null && depth < 8) {
      if (depth > 0) sb.append(" <- ");
      sb.append(current.getClass().getSimpleName());
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        sb.append(": ").append(message.trim());
      }
      if (current.getCause() == current) break;
      current = current.getCause();
      depth++;
    }
    return sb.toString();
  }

  /**
   * Extract a user-facing message from a throwable, without any stack trace information. Service
   * exceptions expose their own message; anything else is prefixed with its type so that bare
   * JDK messages (e.g. a host name from an UnknownHostException) remain intelligible.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    String message = t.getMessage();
    if (t instanceof VerifierException) {
      return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
    String className = t.getClass().getSimpleName();
    if (message != null && !message.trim().isEmpty()) {
      return className + ": " + message.trim();
    }
    Throwable cause = t.getCause();
    if (cause != null && cause != t) {
      return extractErrorMessage(cause);
    }
    return className;
  }

  public static VerifierException rethrowIfUnchecked(
      Throwable t, Function<Throwable, VerifierException> supplier) {
    if (t instanceof VerifierException) {
      return (VerifierException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
