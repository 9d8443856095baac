package com.gentoro.verifier.exception;

/** Inference backend failed, timed out or returned an unusable reply. */
public class InferenceException extends VerifierException {
  public InferenceException(String message) {
    super(VerifierErrorCode.INFERENCE_ERROR, message);
  }

  public InferenceException(String message, Throwable cause) {
    super(VerifierErrorCode.INFERENCE_ERROR, message, cause);
  }
}
