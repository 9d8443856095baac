package com.gentoro.verifier.jobs;

import com.gentoro.verifier.exception.StateException;

/** Terminal outcome of a job: exactly one of {@code result} or {@code failure} is present. */
public record JobOutcome(JobResult result, JobFailure failure) {

  public JobOutcome {
    if ((result == null) == (failure == null)) {
      throw new StateException("A job outcome carries exactly one of result or failure");
    }
  }

  public static JobOutcome completed(JobResult result) {
    return new JobOutcome(result, null);
  }

  public static JobOutcome failed(JobFailure failure) {
    return new JobOutcome(null, failure);
  }

  public JobStatus status() {
    return result != null ? JobStatus.COMPLETED : JobStatus.FAILED;
  }
}
