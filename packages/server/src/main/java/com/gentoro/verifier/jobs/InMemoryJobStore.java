package com.gentoro.verifier.jobs;

import com.gentoro.verifier.exception.StateException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link JobStore}. Records are immutable and swapped atomically per key, which gives
 * per-record mutual exclusion between the single writer and any number of readers.
 */
public final class InMemoryJobStore implements JobStore {
  private final Map<String, JobRecord> map = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryJobStore() {
    this(Clock.systemUTC());
  }

  public InMemoryJobStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void create(String id, JobType type) {
    JobRecord previous = map.putIfAbsent(id, JobRecord.processing(id, type, clock.instant()));
    if (previous != null) {
      throw new StateException("Duplicate job id: " + id);
    }
  }

  @Override
  public Optional<JobRecord> get(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(map.get(id));
  }

  @Override
  public void setTerminal(String id, JobOutcome outcome) {
    map.compute(
        id,
        (key, current) -> {
          if (current == null) {
            throw new StateException("Cannot complete unknown job: " + key);
          }
          return current.terminate(outcome, clock.instant());
        });
  }

  public int size() {
    return map.size();
  }
}
