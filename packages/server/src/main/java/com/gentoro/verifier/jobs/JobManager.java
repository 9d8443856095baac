package com.gentoro.verifier.jobs;

import com.gentoro.verifier.exception.ExceptionUtil;
import com.gentoro.verifier.exception.StateException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Asynchronous job manager. Each submission creates a Processing record and schedules exactly one
 * background run of the handler registered for its type; that run performs exactly one terminal
 * write, whatever the handler does.
 */
public final class JobManager implements AutoCloseable {
  private static final Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(JobManager.class);

  static final String MDC_JOB_ID = "jobId";

  private final JobStore store;
  private final ExecutorService executor;
  private final Clock clock;
  private final Map<JobType, JobHandler<?>> handlers = new EnumMap<>(JobType.class);

  public JobManager(JobStore store, int workerThreads) {
    this(store, newWorkerPool(workerThreads), Clock.systemUTC());
  }

  public JobManager(JobStore store, ExecutorService executor, Clock clock) {
    this.store = store;
    this.executor = executor;
    this.clock = clock;
  }

  private static ExecutorService newWorkerPool(int workerThreads) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        Math.max(1, workerThreads),
        r -> {
          Thread t = new Thread(r, "verification-jobs-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  public synchronized <Q> void register(JobType type, JobHandler<Q> handler) {
    handlers.put(type, handler);
  }

  public synchronized boolean supports(JobType type) {
    return handlers.containsKey(type);
  }

  /**
   * Create a Processing record and schedule its pipeline.
   *
   * @return the new job identifier
   * @throws StateException if no handler is registered for {@code type} or the executor refuses
   *     the work
   */
  public String submit(JobType type, Object request) {
    JobHandler<?> handler;
    synchronized (this) {
      handler = handlers.get(type);
    }
    if (handler == null) {
      throw new StateException("No handler registered for type: " + type);
    }
    if (!type.requestType().isInstance(request)) {
      throw new StateException(
          "Job type %s expects %s".formatted(type, type.requestType().getSimpleName()));
    }

    if (executor.isShutdown()) {
      throw new StateException("Job executor is not accepting work");
    }

    String id = UUID.randomUUID().toString();
    store.create(id, type);
    try {
      executor.submit(() -> run(id, type, handler, request));
    } catch (RejectedExecutionException e) {
      // saturated pool or a shutdown racing the check above; the record must not stay Processing
      store.setTerminal(id, JobOutcome.failed(JobFailure.of("Job executor is not accepting work")));
      throw new StateException("Job executor is not accepting work", e);
    }
    log.debug("Submitted {} job {}", type.wireName(), id);
    return id;
  }

  public Optional<JobRecord> find(String id) {
    return store.get(id);
  }

  @SuppressWarnings("unchecked")
  private void run(String id, JobType type, JobHandler<?> handler, Object request) {
    MDC.put(MDC_JOB_ID, id);
    long start = System.currentTimeMillis();
    JobOutcome outcome;
    try {
      JobContext ctx = new JobContext(id, type, clock.instant());
      JobResult result = ((JobHandler<Object>) handler).execute(ctx, request);
      if (result == null) {
        throw new StateException("Handler for " + type + " returned no result");
      }
      outcome = JobOutcome.completed(result);
    } catch (JobStepException e) {
      log.warn("Job {} failed: {}", id, e.getMessage());
      outcome =
          JobOutcome.failed(
              new JobFailure(
                  e.getMessage(),
                  e.getCause() == null ? null : ExceptionUtil.describeCauseChain(e.getCause()),
                  e.jobDetails()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Job {} interrupted", id);
      outcome = JobOutcome.failed(new JobFailure("Interrupted", null, null));
    } catch (Exception e) {
      log.error("Job {} failed unexpectedly", id, e);
      outcome =
          JobOutcome.failed(
              new JobFailure(
                  ExceptionUtil.extractErrorMessage(e), ExceptionUtil.describeCauseChain(e), null));
    }

    try {
      store.setTerminal(id, outcome);
      log.info(
          "Job {} {} in {} ms",
          id,
          outcome.status().wireName(),
          System.currentTimeMillis() - start);
    } catch (RuntimeException e) {
      log.error("Could not record terminal state for job {}", id, e);
    } finally {
      MDC.remove(MDC_JOB_ID);
    }
  }

  /** Stop accepting work and wait briefly for running pipelines. */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Job executor did not drain within 5 seconds, interrupting workers");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
