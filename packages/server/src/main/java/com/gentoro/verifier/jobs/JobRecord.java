package com.gentoro.verifier.jobs;

import com.gentoro.verifier.exception.StateException;
import java.time.Instant;

/**
 * Immutable snapshot of a job. The store replaces a Processing snapshot with a terminal one in a
 * single reference swap, so readers see either the old or the new snapshot in full.
 */
public final class JobRecord {
  private final String id;
  private final JobType type;
  private final JobStatus status;
  private final Instant createdAt;
  private final Instant finishedAt;
  private final JobResult result;
  private final JobFailure failure;

  private JobRecord(
      String id,
      JobType type,
      JobStatus status,
      Instant createdAt,
      Instant finishedAt,
      JobResult result,
      JobFailure failure) {
    this.id = id;
    this.type = type;
    this.status = status;
    this.createdAt = createdAt;
    this.finishedAt = finishedAt;
    this.result = result;
    this.failure = failure;
  }

  static JobRecord processing(String id, JobType type, Instant createdAt) {
    return new JobRecord(id, type, JobStatus.PROCESSING, createdAt, null, null, null);
  }

  JobRecord terminate(JobOutcome outcome, Instant finishedAt) {
    if (status.isTerminal()) {
      throw new StateException(
          "Job %s is already %s and cannot be written again".formatted(id, status.wireName()));
    }
    return new JobRecord(
        id, type, outcome.status(), createdAt, finishedAt, outcome.result(), outcome.failure());
  }

  public String id() {
    return id;
  }

  public JobType type() {
    return type;
  }

  public JobStatus status() {
    return status;
  }

  public Instant createdAt() {
    return createdAt;
  }

  /** Time of the terminal write, {@code null} while processing. */
  public Instant finishedAt() {
    return finishedAt;
  }

  /** Present only when {@link #status()} is {@link JobStatus#COMPLETED}. */
  public JobResult result() {
    return result;
  }

  /** Present only when {@link #status()} is {@link JobStatus#FAILED}. */
  public JobFailure failure() {
    return failure;
  }
}
