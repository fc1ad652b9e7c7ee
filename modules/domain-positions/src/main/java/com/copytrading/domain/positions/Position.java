package com.copytrading.domain.positions;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record Position(
    PositionId id,
    String tradeId,
    BigDecimal size,
    BigDecimal entryPrice,
    BigDecimal stopLossPrice,
    BigDecimal takeProfitPrice,
    PositionStatus status,
    String orderId,
    Instant openedAt,
    Instant updatedAt) {
  public Position {
    Objects.requireNonNull(id, "id must not be null");
    requireNonBlank(tradeId, "tradeId");
    requirePositive(size, "size");
    requirePositive(entryPrice, "entryPrice");
    Objects.requireNonNull(stopLossPrice, "stopLossPrice must not be null");
    Objects.requireNonNull(takeProfitPrice, "takeProfitPrice must not be null");
    Objects.requireNonNull(status, "status must not be null");
    if (status != PositionStatus.PENDING) {
      requireNonBlank(orderId, "orderId");
    }
    Objects.requireNonNull(openedAt, "openedAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public static Position pending(
      PositionId id,
      String tradeId,
      BigDecimal size,
      BigDecimal entryPrice,
      ExitLevels levels,
      Instant now) {
    Objects.requireNonNull(levels, "levels must not be null");
    Objects.requireNonNull(now, "now must not be null");
    return new Position(
        id,
        tradeId,
        size,
        entryPrice,
        levels.stopLossPrice(),
        levels.takeProfitPrice(),
        PositionStatus.PENDING,
        null,
        now,
        now);
  }

  /** Records the exchange acknowledgement of the entry order. */
  public Position opened(String nextOrderId, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    PositionStateMachine.validateTransition(status, PositionStatus.OPEN);
    return new Position(
        id,
        tradeId,
        size,
        entryPrice,
        stopLossPrice,
        takeProfitPrice,
        PositionStatus.OPEN,
        nextOrderId,
        openedAt,
        now);
  }

  public Position transitionTo(PositionStatus toStatus, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    PositionStateMachine.validateTransition(status, toStatus);
    return new Position(
        id,
        tradeId,
        size,
        entryPrice,
        stopLossPrice,
        takeProfitPrice,
        toStatus,
        orderId,
        openedAt,
        now);
  }

  public String marketId() {
    return id.marketId();
  }

  public TradeSide side() {
    return id.side();
  }

  /** Profit (positive) or loss (negative) of closing the whole position at {@code exitPrice}. */
  public BigDecimal realizedPnl(BigDecimal exitPrice) {
    Objects.requireNonNull(exitPrice, "exitPrice must not be null");
    BigDecimal perUnit =
        side() == TradeSide.BUY ? exitPrice.subtract(entryPrice) : entryPrice.subtract(exitPrice);
    return perUnit.multiply(size);
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new PositionDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new PositionDomainException(fieldName + " must not be blank");
    }
  }
}
