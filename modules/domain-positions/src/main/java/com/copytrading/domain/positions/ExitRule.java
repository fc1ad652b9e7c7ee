package com.copytrading.domain.positions;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** Decides whether an open position should be closed at the observed price. */
public final class ExitRule {
  private final Duration maxHoldingTime;

  public ExitRule(Duration maxHoldingTime) {
    this.maxHoldingTime = Objects.requireNonNull(maxHoldingTime, "maxHoldingTime must not be null");
  }

  public Optional<ExitReason> evaluate(Position position, BigDecimal currentPrice, Instant now) {
    if (position.status() != PositionStatus.OPEN || currentPrice == null) {
      return Optional.empty();
    }
    if (position.side() == TradeSide.BUY) {
      if (currentPrice.compareTo(position.stopLossPrice()) <= 0) {
        return Optional.of(ExitReason.STOP_LOSS);
      }
      if (currentPrice.compareTo(position.takeProfitPrice()) >= 0) {
        return Optional.of(ExitReason.TAKE_PROFIT);
      }
    } else {
      if (currentPrice.compareTo(position.stopLossPrice()) >= 0) {
        return Optional.of(ExitReason.STOP_LOSS);
      }
      if (currentPrice.compareTo(position.takeProfitPrice()) <= 0) {
        return Optional.of(ExitReason.TAKE_PROFIT);
      }
    }
    if (!maxHoldingTime.isZero()
        && Duration.between(position.openedAt(), now).compareTo(maxHoldingTime) > 0) {
      return Optional.of(ExitReason.TIME_EXIT);
    }
    return Optional.empty();
  }
}
