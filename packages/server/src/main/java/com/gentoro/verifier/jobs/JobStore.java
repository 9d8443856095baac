package com.gentoro.verifier.jobs;

import java.util.Optional;

/**
 * Owner of all job records. Implementations must never expose a partially written record and must
 * reject a second terminal write for the same id.
 */
public interface JobStore {
  /**
   * Insert a new Processing record.
   *
   * @throws com.gentoro.verifier.exception.StateException if {@code id} already exists
   */
  void create(String id, JobType type);

  Optional<JobRecord> get(String id);

  /**
   * Replace a Processing record with its terminal outcome.
   *
   * @throws com.gentoro.verifier.exception.StateException if the record is unknown or already
   *     terminal
   */
  void setTerminal(String id, JobOutcome outcome);
}
