package com.gentoro.verifier.exception;

/** Caller input rejected before a job is created. */
public class ValidationException extends VerifierException {
  public ValidationException(String message) {
    super(VerifierErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(VerifierErrorCode.VALIDATION_ERROR, message, cause);
  }
}
