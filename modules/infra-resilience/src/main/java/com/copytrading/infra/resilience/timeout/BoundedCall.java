package com.copytrading.infra.resilience.timeout;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a blocking call on a worker pool and gives up after a per-call timeout. The caller
 * observes either the value, the call's own runtime exception, or {@link CallTimeoutException}.
 * A call that times out is cancelled with interruption, so its worker is handed back to the pool
 * as soon as the call honours the interrupt.
 */
public class BoundedCall {
  private final ExecutorService executor;

  public BoundedCall(ExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
  }

  public <T> T call(String operationName, Duration timeout, Supplier<T> supplier) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    Objects.requireNonNull(supplier, "supplier must not be null");
    Callable<T> task = supplier::get;
    Future<T> future = executor.submit(task);
    try {
      return future.get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new CallTimeoutException(operationName, timeout, ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for " + operationName, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(operationName + " failed", cause);
    } catch (CancellationException ex) {
      throw new CallTimeoutException(operationName, timeout, ex);
    }
  }
}
