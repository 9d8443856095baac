package com.gentoro.verifier.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.verifier.chain.ChainJobDetails;

/**
 * Error fields of a failed job.
 *
 * @param message human-readable reason
 * @param details cause chain of the underlying failure, may be null
 * @param jobDetails on-chain job data already retrieved when the failure happened, may be null
 */
public record JobFailure(
    @JsonProperty("error") String message,
    @JsonProperty("error_details") String details,
    @JsonProperty("job_details") ChainJobDetails jobDetails) {

  public JobFailure {
    if (message == null || message.isBlank()) {
      message = "Unknown error";
    }
  }

  public static JobFailure of(String message) {
    return new JobFailure(message, null, null);
  }
}
