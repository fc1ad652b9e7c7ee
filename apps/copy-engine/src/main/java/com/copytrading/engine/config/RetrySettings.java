package com.copytrading.engine.config;

import com.copytrading.infra.resilience.retry.ExceptionFilteringRetryPolicy;
import com.copytrading.infra.resilience.retry.ExponentialBackoffRetryPolicy;
import com.copytrading.infra.resilience.retry.RetryPolicy;
import java.time.Duration;

/** Bound retry block shared by the breaker persistence and the exchange read paths. */
public class RetrySettings {
  private int maxAttempts = 3;
  private Duration initialBackoff = Duration.ofMillis(50);
  private Duration maxBackoff = Duration.ofMillis(500);
  private double multiplier = 2.0d;

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public void setMultiplier(double multiplier) {
    this.multiplier = multiplier;
  }

  public RetryPolicy toTransientOnlyPolicy() {
    return ExceptionFilteringRetryPolicy.transientOnly(
        new ExponentialBackoffRetryPolicy(maxAttempts, initialBackoff, maxBackoff, multiplier));
  }
}
