package com.gentoro.verifier.jobs;

import java.util.Locale;

/** Lifecycle state of a submitted job. Completed and Failed are terminal. */
public enum JobStatus {
  /** Accepted; the background pipeline has not yet written its outcome. */
  PROCESSING,
  /** Pipeline finished and the result fields are populated. */
  COMPLETED,
  /** Pipeline stopped at a failing step and the error fields are populated. */
  FAILED;

  public boolean isTerminal() {
    return this != PROCESSING;
  }

  /** Lower-case name used on the wire. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
