package com.gentoro.verifier.exception;

/** Contract call, log lookup or transaction submission failed. */
public class ChainException extends VerifierException {
  public ChainException(String message) {
    super(VerifierErrorCode.CHAIN_ERROR, message);
  }

  public ChainException(String message, Throwable cause) {
    super(VerifierErrorCode.CHAIN_ERROR, message, cause);
  }
}
