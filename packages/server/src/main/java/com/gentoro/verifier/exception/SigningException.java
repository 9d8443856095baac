package com.gentoro.verifier.exception;

/** Response signing failed. */
public class SigningException extends VerifierException {
  public SigningException(String message) {
    super(VerifierErrorCode.SIGNING_ERROR, message);
  }

  public SigningException(String message, Throwable cause) {
    super(VerifierErrorCode.SIGNING_ERROR, message, cause);
  }
}
