package com.gentoro.verifier.jobs;

import java.time.Instant;

/** Context passed to a {@link JobHandler} for one execution. */
public final class JobContext {
  private final String jobId;
  private final JobType jobType;
  private final Instant startedAt;

  public JobContext(String jobId, JobType jobType, Instant startedAt) {
    this.jobId = jobId;
    this.jobType = jobType;
    this.startedAt = startedAt;
  }

  public String jobId() {
    return jobId;
  }

  public JobType jobType() {
    return jobType;
  }

  public Instant startedAt() {
    return startedAt;
  }
}
