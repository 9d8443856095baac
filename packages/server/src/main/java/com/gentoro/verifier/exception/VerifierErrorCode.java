package com.gentoro.verifier.exception;

/** Stable error categories surfaced in logs and API error payloads. */
public enum VerifierErrorCode {
  CONFIG_ERROR,
  VALIDATION_ERROR,
  NOT_FOUND,
  STATE_ERROR,
  INFERENCE_ERROR,
  CHAIN_ERROR,
  NETWORK_ERROR,
  SIGNING_ERROR,
  UNKNOWN
}
