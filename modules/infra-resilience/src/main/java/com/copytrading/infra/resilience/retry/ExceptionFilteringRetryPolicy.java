package com.copytrading.infra.resilience.retry;

import com.copytrading.infra.resilience.errors.ErrorClassifier;
import com.copytrading.infra.resilience.errors.TransientIoException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Restricts a delegate policy to a set of exception types, matched against the whole cause chain.
 * With an empty type list the decision falls back to {@link ErrorClassifier}: only transient I/O
 * failures are retried.
 */
public class ExceptionFilteringRetryPolicy implements RetryPolicy {
  private final RetryPolicy delegate;
  private final List<Class<? extends Throwable>> retryableExceptions;

  public ExceptionFilteringRetryPolicy(
      RetryPolicy delegate, List<Class<? extends Throwable>> retryableExceptions) {
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    this.retryableExceptions =
        List.copyOf(
            Objects.requireNonNull(retryableExceptions, "retryableExceptions must not be null"));
  }

  public static ExceptionFilteringRetryPolicy transientOnly(RetryPolicy delegate) {
    return new ExceptionFilteringRetryPolicy(delegate, List.of(TransientIoException.class));
  }

  @Override
  public boolean shouldRetry(int attempt, Exception exception) {
    return isRetryable(exception) && delegate.shouldRetry(attempt, exception);
  }

  @Override
  public Duration backoffForAttempt(int attempt) {
    return delegate.backoffForAttempt(attempt);
  }

  @Override
  public boolean isRetryable(Exception exception) {
    if (retryableExceptions.isEmpty()) {
      return ErrorClassifier.classify(exception).isRetryable();
    }

    Throwable candidate = exception;
    while (candidate != null) {
      for (Class<? extends Throwable> retryableType : retryableExceptions) {
        if (retryableType.isAssignableFrom(candidate.getClass())) {
          return true;
        }
      }
      candidate = candidate.getCause();
    }
    return false;
  }
}
