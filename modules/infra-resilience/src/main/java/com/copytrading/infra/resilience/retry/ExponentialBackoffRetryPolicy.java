package com.copytrading.infra.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempt {@code n} waits {@code initialBackoff * multiplier^(n-1)}, never more than {@code
 * maxBackoff}. A zero initial backoff retries immediately.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final long initialMillis;
  private final long capMillis;
  private final double multiplier;

  public ExponentialBackoffRetryPolicy(
      int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
    Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("backoff durations must not be negative");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    this.maxAttempts = maxAttempts;
    this.initialMillis = initialBackoff.toMillis();
    this.capMillis = Math.max(initialMillis, maxBackoff.toMillis());
    this.multiplier = multiplier;
  }

  @Override
  public boolean shouldRetry(int attempt, Exception exception) {
    return attempt < maxAttempts;
  }

  @Override
  public Duration backoffForAttempt(int attempt) {
    double delay = initialMillis;
    for (int step = 1; step < attempt && delay < capMillis; step++) {
      delay *= multiplier;
    }
    return Duration.ofMillis((long) Math.min(capMillis, delay));
  }
}
