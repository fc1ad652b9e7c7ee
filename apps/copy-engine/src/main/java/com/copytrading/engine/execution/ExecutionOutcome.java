package com.copytrading.engine.execution;

import com.copytrading.domain.positions.PositionId;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Result of one copy attempt. {@code recoveryEta} is only set when the circuit breaker blocked the
 * trade; position fields are only set for {@link ExecutionStatus#SUBMITTED}.
 */
public record ExecutionOutcome(
    String tradeId,
    ExecutionStatus status,
    OutcomeReason reason,
    String message,
    String recoveryEta,
    PositionId positionId,
    String orderId,
    BigDecimal size,
    BigDecimal entryPrice) {
  public ExecutionOutcome {
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(reason, "reason must not be null");
    if (status == ExecutionStatus.SUBMITTED && (positionId == null || orderId == null)) {
      throw new IllegalArgumentException("a submitted outcome requires positionId and orderId");
    }
  }

  public static ExecutionOutcome submitted(
      String tradeId, PositionId positionId, String orderId, BigDecimal size, BigDecimal entryPrice) {
    return new ExecutionOutcome(
        tradeId,
        ExecutionStatus.SUBMITTED,
        OutcomeReason.NONE,
        "order submitted",
        null,
        positionId,
        orderId,
        size,
        entryPrice);
  }

  public static ExecutionOutcome skipped(String tradeId, OutcomeReason reason, String message) {
    return new ExecutionOutcome(
        tradeId, ExecutionStatus.SKIPPED, reason, message, null, null, null, null, null);
  }

  public static ExecutionOutcome blocked(String tradeId, String message, String recoveryEta) {
    return new ExecutionOutcome(
        tradeId,
        ExecutionStatus.SKIPPED,
        OutcomeReason.CIRCUIT_BREAKER_ACTIVE,
        message,
        recoveryEta,
        null,
        null,
        null,
        null);
  }

  public static ExecutionOutcome failed(String tradeId, OutcomeReason reason, String message) {
    return new ExecutionOutcome(
        tradeId, ExecutionStatus.FAILED, reason, message, null, null, null, null, null);
  }
}
