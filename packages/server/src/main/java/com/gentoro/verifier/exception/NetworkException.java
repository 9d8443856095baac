package com.gentoro.verifier.exception;

/** Listener or transport level failure. */
public class NetworkException extends VerifierException {
  public NetworkException(String message) {
    super(VerifierErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(VerifierErrorCode.NETWORK_ERROR, message, cause);
  }
}
