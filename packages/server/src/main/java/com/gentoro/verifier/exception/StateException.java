package com.gentoro.verifier.exception;

/** Illegal state transition or a component used outside its lifecycle. Treated as a defect. */
public class StateException extends VerifierException {
  public StateException(String message) {
    super(VerifierErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(VerifierErrorCode.STATE_ERROR, message, cause);
  }
}
