package com.gentoro.verifier.jobs;

import com.gentoro.verifier.chain.ChainJobDetails;

/**
 * Expected failure of one pipeline step. Stops the pipeline; the message and any job data already
 * gathered are recorded on the Failed job.
 */
public class JobStepException extends Exception {
  private final transient ChainJobDetails jobDetails;

  public JobStepException(String message) {
    this(message, null, null);
  }

  public JobStepException(String message, ChainJobDetails jobDetails) {
    this(message, jobDetails, null);
  }

  public JobStepException(String message, ChainJobDetails jobDetails, Throwable cause) {
    super(message, cause);
    this.jobDetails = jobDetails;
  }

  /** Partial context retrieved before the failure, or {@code null}. */
  public ChainJobDetails jobDetails() {
    return jobDetails;
  }
}
