package com.gentoro.verifier.exception;

import java.util.Map;

/** Raised when a status query names an identifier that was never issued. */
public class JobNotFoundException extends VerifierException {
  public JobNotFoundException(String jobId) {
    super(VerifierErrorCode.NOT_FOUND, "Job not found", null, Map.of("jobId", String.valueOf(jobId)));
  }
}
