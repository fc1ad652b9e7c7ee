package com.copytrading.domain.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the trading circuit breaker. Every mutation returns a new value; the owner swaps the
 * reference under its lock and persists the result.
 */
public record CircuitBreakerState(
    boolean active,
    String reason,
    Instant activatedAt,
    Instant cooldownUntil,
    BigDecimal dailyLoss,
    BigDecimal maxDailyLoss,
    int consecutiveLosses,
    int consecutiveLossThreshold,
    LocalDate lastResetDate,
    int totalTrades,
    int failedTrades) {
  public static final int DEFAULT_CONSECUTIVE_LOSS_THRESHOLD = 5;

  public CircuitBreakerState {
    Objects.requireNonNull(dailyLoss, "dailyLoss must not be null");
    Objects.requireNonNull(maxDailyLoss, "maxDailyLoss must not be null");
    Objects.requireNonNull(lastResetDate, "lastResetDate must not be null");
    if (dailyLoss.signum() < 0) {
      throw new RiskDomainException("dailyLoss must be >= 0");
    }
    if (maxDailyLoss.signum() <= 0) {
      throw new RiskDomainException("maxDailyLoss must be > 0");
    }
    if (consecutiveLosses < 0) {
      throw new RiskDomainException("consecutiveLosses must be >= 0");
    }
    if (consecutiveLossThreshold < 1) {
      throw new RiskDomainException("consecutiveLossThreshold must be >= 1");
    }
    if (totalTrades < 0 || failedTrades < 0 || failedTrades > totalTrades) {
      throw new RiskDomainException("trade counters must satisfy 0 <= failedTrades <= totalTrades");
    }
    if (active && (reason == null || reason.isBlank() || activatedAt == null)) {
      throw new RiskDomainException("an active breaker requires a reason and activatedAt");
    }
    if (active && cooldownUntil == null) {
      throw new RiskDomainException("an active breaker requires cooldownUntil");
    }
    if (!active && (activatedAt != null || cooldownUntil != null)) {
      throw new RiskDomainException("an inactive breaker must not carry activation timestamps");
    }
  }

  public static CircuitBreakerState initial(
      BigDecimal maxDailyLoss, int consecutiveLossThreshold, LocalDate today) {
    return new CircuitBreakerState(
        false,
        null,
        null,
        null,
        BigDecimal.ZERO,
        maxDailyLoss,
        0,
        consecutiveLossThreshold,
        today,
        0,
        0);
  }

  public CircuitBreakerState withLimits(BigDecimal nextMaxDailyLoss, int nextThreshold) {
    return new CircuitBreakerState(
        active,
        reason,
        activatedAt,
        cooldownUntil,
        dailyLoss,
        nextMaxDailyLoss,
        consecutiveLosses,
        nextThreshold,
        lastResetDate,
        totalTrades,
        failedTrades);
  }

  /** Starts a new trading day: losses and streak are zeroed, activation is left untouched. */
  public CircuitBreakerState rolledOverTo(LocalDate today) {
    Objects.requireNonNull(today, "today must not be null");
    if (today.equals(lastResetDate)) {
      return this;
    }
    return new CircuitBreakerState(
        active,
        reason,
        activatedAt,
        cooldownUntil,
        BigDecimal.ZERO,
        maxDailyLoss,
        0,
        consecutiveLossThreshold,
        today,
        totalTrades,
        failedTrades);
  }

  public CircuitBreakerState withLoss(BigDecimal amount) {
    Objects.requireNonNull(amount, "amount must not be null");
    return new CircuitBreakerState(
        active,
        reason,
        activatedAt,
        cooldownUntil,
        dailyLoss.add(amount.abs()),
        maxDailyLoss,
        consecutiveLosses + 1,
        consecutiveLossThreshold,
        lastResetDate,
        totalTrades,
        failedTrades);
  }

  public CircuitBreakerState withProfit() {
    if (consecutiveLosses == 0) {
      return this;
    }
    return new CircuitBreakerState(
        active,
        reason,
        activatedAt,
        cooldownUntil,
        dailyLoss,
        maxDailyLoss,
        0,
        consecutiveLossThreshold,
        lastResetDate,
        totalTrades,
        failedTrades);
  }

  public CircuitBreakerState withTradeResult(boolean success) {
    return new CircuitBreakerState(
        active,
        reason,
        activatedAt,
        cooldownUntil,
        dailyLoss,
        maxDailyLoss,
        consecutiveLosses,
        consecutiveLossThreshold,
        lastResetDate,
        totalTrades + 1,
        success ? failedTrades : failedTrades + 1);
  }

  public CircuitBreakerState activated(String nextReason, Instant now, Duration cooldown) {
    Objects.requireNonNull(now, "now must not be null");
    Objects.requireNonNull(cooldown, "cooldown must not be null");
    return new CircuitBreakerState(
        true,
        nextReason,
        now,
        now.plus(cooldown),
        dailyLoss,
        maxDailyLoss,
        consecutiveLosses,
        consecutiveLossThreshold,
        lastResetDate,
        totalTrades,
        failedTrades);
  }

  /** Clears the activation only; counters and the reset date survive a manual reset. */
  public CircuitBreakerState cleared() {
    if (!active) {
      return this;
    }
    return new CircuitBreakerState(
        false,
        null,
        null,
        null,
        dailyLoss,
        maxDailyLoss,
        consecutiveLosses,
        consecutiveLossThreshold,
        lastResetDate,
        totalTrades,
        failedTrades);
  }

  public Optional<ActivationRule> triggeredRule() {
    if (dailyLoss.compareTo(maxDailyLoss) >= 0) {
      return Optional.of(ActivationRule.DAILY_LOSS);
    }
    if (consecutiveLosses >= consecutiveLossThreshold) {
      return Optional.of(ActivationRule.CONSECUTIVE_LOSSES);
    }
    return Optional.empty();
  }

  public String reasonFor(ActivationRule rule) {
    if (rule == ActivationRule.DAILY_LOSS) {
      return "Daily loss limit reached (" + money(dailyLoss) + " / " + money(maxDailyLoss) + ")";
    }
    if (rule == ActivationRule.CONSECUTIVE_LOSSES) {
      return consecutiveLosses + " consecutive losses detected";
    }
    return "Manual activation";
  }

  public boolean isCooldownElapsed(Instant now) {
    return active && cooldownUntil != null && !now.isBefore(cooldownUntil);
  }

  public Duration remainingCooldown(Instant now) {
    if (!active || cooldownUntil == null || !now.isBefore(cooldownUntil)) {
      return Duration.ZERO;
    }
    return Duration.between(now, cooldownUntil);
  }

  private static String money(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
