package com.gentoro.verifier.inference;

import com.gentoro.verifier.exception.ExceptionUtil;
import com.gentoro.verifier.exception.InferenceException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.MDC;

/**
 * Base {@link InferenceClient} that enforces the per-call timeout around the provider specific
 * {@link #runInference(String, String)}.
 */
public abstract class AbstractInferenceClient implements InferenceClient {
  private static final org.slf4j.Logger log =
      com.gentoro.verifier.logging.LoggingService.getLogger(AbstractInferenceClient.class);

  protected final String model;
  protected final Duration timeout;

  protected AbstractInferenceClient(String model, Duration timeout) {
    this.model = model;
    this.timeout = timeout;
  }

  @Override
  public String model() {
    return model;
  }

  @Override
  public final String chat(String systemInstruction, String userContent) {
    log.trace(
        "chat() called with: provider = [{}], model = [{}], user content length = [{}]",
        provider(),
        model,
        userContent == null ? 0 : userContent.length());

    long start = System.currentTimeMillis();
    final var mdc = MDC.getCopyOfContextMap();
    ExecutorService executor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "inference-" + provider());
              t.setDaemon(true);
              return t;
            });
    try {
      Future<String> future =
          executor.submit(
              () -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                  return runInference(systemInstruction, userContent);
                } finally {
                  MDC.clear();
                }
              });
      try {
        String reply = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (reply == null) {
          throw new InferenceException("No content returned from " + provider() + " inference.");
        }
        return reply;
      } catch (TimeoutException e) {
        future.cancel(true);
        String errorMsg =
            "Inference timed out after %d seconds".formatted(timeout.toSeconds());
        log.error(errorMsg);
        throw new InferenceException(errorMsg, e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        throw ExceptionUtil.rethrowIfUnchecked(
            cause,
            ex ->
                new InferenceException(
                    "Inference failed: " + ExceptionUtil.extractErrorMessage(ex), ex));
      } catch (InterruptedException e) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        throw new InferenceException("Inference interrupted", e);
      }
    } finally {
      executor.shutdownNow();
      log.debug("{} inference took {} ms", provider(), System.currentTimeMillis() - start);
    }
  }

  /** Execute one provider call. Runs on a worker thread; may be interrupted on timeout. */
  protected abstract String runInference(String systemInstruction, String userContent)
      throws Exception;
}
