package com.copytrading.infra.resilience.retry;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs read-only or idempotent operations under a {@link RetryPolicy}. Never use it for order
 * placement: a retried submit can fill twice.
 */
public class RetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
  private static final String RETRY_COUNTER = "copytrading.retry.attempts";
  private static final String EXHAUSTED_COUNTER = "copytrading.retry.exhausted";

  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public RetryExecutor(RetryPolicy retryPolicy, MeterRegistry meterRegistry) {
    this(retryPolicy, duration -> Thread.sleep(duration.toMillis()), meterRegistry);
  }

  public RetryExecutor(RetryPolicy retryPolicy, Sleeper sleeper, MeterRegistry meterRegistry) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(String operationName, Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (RuntimeException ex) {
        if (!retryPolicy.shouldRetry(attempt, ex)) {
          if (retryPolicy.isRetryable(ex)) {
            meterRegistry.counter(EXHAUSTED_COUNTER, "operation", operationName).increment();
            log.warn(
                "Retries exhausted operation={} attempts={} error={}",
                operationName,
                attempt,
                ex.getMessage());
          }
          throw ex;
        }
        Duration wait = retryPolicy.backoffForAttempt(attempt);
        meterRegistry.counter(RETRY_COUNTER, "operation", operationName).increment();
        log.debug(
            "Retrying operation={} attempt={} backoff_ms={} error={}",
            operationName,
            attempt,
            wait.toMillis(),
            ex.getMessage());
        sleep(wait, operationName);
        attempt++;
      }
    }
  }

  public void run(String operationName, Runnable action) {
    execute(
        operationName,
        () -> {
          action.run();
          return null;
        });
  }

  private void sleep(Duration duration, String operationName) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during retry backoff of " + operationName, interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
