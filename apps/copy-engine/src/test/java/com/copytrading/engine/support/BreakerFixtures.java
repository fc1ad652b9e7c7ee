package com.copytrading.engine.support;

import com.copytrading.engine.breaker.CircuitBreaker;
import com.copytrading.engine.breaker.CircuitBreakerProperties;
import com.copytrading.engine.breaker.CircuitBreakerStateStore;
import com.copytrading.engine.notification.NotificationDispatcher;
import com.copytrading.infra.resilience.retry.ExceptionFilteringRetryPolicy;
import com.copytrading.infra.resilience.retry.ExponentialBackoffRetryPolicy;
import com.copytrading.infra.resilience.retry.RetryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

public final class BreakerFixtures {
  private BreakerFixtures() {}

  public static CircuitBreakerProperties properties(String maxDailyLoss) {
    CircuitBreakerProperties properties = new CircuitBreakerProperties();
    properties.setMaxDailyLoss(new BigDecimal(maxDailyLoss));
    properties.setCooldown(Duration.ofHours(1));
    return properties;
  }

  public static RetryExecutor noSleepRetry(MeterRegistry meterRegistry) {
    return new RetryExecutor(
        ExceptionFilteringRetryPolicy.transientOnly(
            new ExponentialBackoffRetryPolicy(3, Duration.ZERO, Duration.ZERO, 2.0d)),
        duration -> {},
        meterRegistry);
  }

  public static CircuitBreaker breaker(
      CircuitBreakerProperties properties,
      CircuitBreakerStateStore store,
      RecordingNotificationSink sink,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new CircuitBreaker(
        properties,
        store,
        noSleepRetry(meterRegistry),
        new NotificationDispatcher(sink, meterRegistry),
        meterRegistry,
        clock);
  }
}
