package com.gentoro.verifier.exception;

/** Invalid or missing configuration. */
public class ConfigException extends VerifierException {
  public ConfigException(String message) {
    super(VerifierErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(VerifierErrorCode.CONFIG_ERROR, message, cause);
  }
}
