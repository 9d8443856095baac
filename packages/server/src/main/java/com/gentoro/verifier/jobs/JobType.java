package com.gentoro.verifier.jobs;

import com.gentoro.verifier.pipeline.CrossValidationRequest;
import com.gentoro.verifier.pipeline.VerificationRequest;

/** Kind of background work and the request type its handler consumes. */
public enum JobType {
  VERIFICATION("verification", VerificationRequest.class),
  CROSS_VALIDATION("cross_validation", CrossValidationRequest.class);

  private final String wireName;
  private final Class<?> requestType;

  JobType(String wireName, Class<?> requestType) {
    this.wireName = wireName;
    this.requestType = requestType;
  }

  public String wireName() {
    return wireName;
  }

  public Class<?> requestType() {
    return requestType;
  }
}
