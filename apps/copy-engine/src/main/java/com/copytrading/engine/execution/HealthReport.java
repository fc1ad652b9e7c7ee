package com.copytrading.engine.execution;

import com.copytrading.engine.breaker.CircuitBreakerStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one health probe. {@code healthy} is false only when the exchange balance could not be
 * read; an active breaker or a crowded position table only add warnings.
 */
public record HealthReport(
    boolean healthy,
    BigDecimal balance,
    CircuitBreakerStatus breaker,
    int openPositions,
    List<String> warnings,
    Instant checkedAt) {
  public HealthReport {
    Objects.requireNonNull(breaker, "breaker must not be null");
    Objects.requireNonNull(checkedAt, "checkedAt must not be null");
    warnings = List.copyOf(warnings);
    if (healthy && balance == null) {
      throw new IllegalArgumentException("a healthy report requires a balance");
    }
  }
}
