package com.gentoro.verifier.exception;

import java.util.Map;

/** Flattened view of a failure, used to pick the HTTP status and to log request errors. */
public record ErrorDetails(
    VerifierErrorCode code, String type, String message, Map<String, Object> context) {}
