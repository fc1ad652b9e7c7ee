package com.copytrading.engine.breaker;

import com.copytrading.domain.risk.CircuitBreakerState;
import com.copytrading.domain.risk.RecoveryEta;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/** Read-only view of the breaker for dashboards and operator commands. */
public record CircuitBreakerStatus(
    boolean active,
    String reason,
    Instant activatedAt,
    Instant cooldownUntil,
    Duration remainingCooldown,
    String recoveryEta,
    BigDecimal dailyLoss,
    BigDecimal maxDailyLoss,
    int consecutiveLosses,
    int consecutiveLossThreshold,
    LocalDate lastResetDate,
    int totalTrades,
    int failedTrades,
    BigDecimal failureRatePercent) {

  static CircuitBreakerStatus of(CircuitBreakerState state, Instant now) {
    Duration remaining = state.remainingCooldown(now);
    String eta = state.active() ? RecoveryEta.format(remaining) : RecoveryEta.NOT_APPLICABLE;
    BigDecimal failureRate =
        state.totalTrades() == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(state.failedTrades())
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(state.totalTrades()), 2, RoundingMode.HALF_UP);
    return new CircuitBreakerStatus(
        state.active(),
        state.reason(),
        state.activatedAt(),
        state.cooldownUntil(),
        remaining,
        eta,
        state.dailyLoss(),
        state.maxDailyLoss(),
        state.consecutiveLosses(),
        state.consecutiveLossThreshold(),
        state.lastResetDate(),
        state.totalTrades(),
        state.failedTrades(),
        failureRate);
  }
}
