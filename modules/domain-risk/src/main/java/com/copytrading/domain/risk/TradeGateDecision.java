package com.copytrading.domain.risk;

import java.time.Duration;
import java.util.Objects;

public record TradeGateDecision(
    boolean allowed, boolean degraded, String reason, String recoveryEta, Duration remaining) {
  private static final TradeGateDecision ALLOWED =
      new TradeGateDecision(true, false, null, null, Duration.ZERO);

  public TradeGateDecision {
    Objects.requireNonNull(remaining, "remaining must not be null");
    if (!allowed && (reason == null || reason.isBlank())) {
      throw new RiskDomainException("a blocked decision requires a reason");
    }
  }

  public static TradeGateDecision allow() {
    return ALLOWED;
  }

  /** Allowed because the gate itself failed; trading stays available on internal faults. */
  public static TradeGateDecision failOpen(String error) {
    return new TradeGateDecision(true, true, "gate check failed: " + error, null, Duration.ZERO);
  }

  public static TradeGateDecision blocked(String reason, Duration remaining) {
    return new TradeGateDecision(false, false, reason, RecoveryEta.format(remaining), remaining);
  }
}
