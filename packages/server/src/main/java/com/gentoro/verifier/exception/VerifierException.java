package com.gentoro.verifier.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Root of the service's unchecked exception hierarchy. */
public class VerifierException extends RuntimeException {
  private final VerifierErrorCode code;
  private final Map<String, Object> context;

  public VerifierException(VerifierErrorCode code, String message) {
    this(code, message, null, null);
  }

  public VerifierException(VerifierErrorCode code, String message, Throwable cause) {
    this(code, message, cause, null);
  }

  public VerifierException(
      VerifierErrorCode code, String message, Throwable cause, Map<String, Object> context) {
    super(message, cause);
    this.code = code == null ? VerifierErrorCode.UNKNOWN : code;
    this.context = context == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public VerifierErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }
}
