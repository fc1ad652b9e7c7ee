package com.copytrading.engine.execution;

import com.copytrading.domain.positions.ExitReason;
import com.copytrading.domain.positions.PositionId;
import java.math.BigDecimal;
import java.util.Objects;

public record CloseOutcome(
    PositionId positionId,
    CloseStatus status,
    ExitReason reason,
    String orderId,
    BigDecimal exitPrice,
    BigDecimal realizedPnl,
    String message) {
  public CloseOutcome {
    Objects.requireNonNull(positionId, "positionId must not be null");
    Objects.requireNonNull(status, "status must not be null");
  }

  static CloseOutcome closed(
      PositionId positionId,
      ExitReason reason,
      String orderId,
      BigDecimal exitPrice,
      BigDecimal realizedPnl) {
    return new CloseOutcome(
        positionId, CloseStatus.CLOSED, reason, orderId, exitPrice, realizedPnl, "position closed");
  }

  static CloseOutcome notFound(PositionId positionId, ExitReason reason) {
    return new CloseOutcome(
        positionId, CloseStatus.NOT_FOUND, reason, null, null, null, "no open position");
  }

  static CloseOutcome conditionCleared(PositionId positionId, ExitReason reason) {
    return new CloseOutcome(
        positionId,
        CloseStatus.CONDITION_CLEARED,
        reason,
        null,
        null,
        null,
        "exit condition no longer holds");
  }

  static CloseOutcome failed(PositionId positionId, ExitReason reason, String message) {
    return new CloseOutcome(positionId, CloseStatus.FAILED, reason, null, null, null, message);
  }

  public boolean isClosed() {
    return status == CloseStatus.CLOSED;
  }
}
