package com.copytrading.domain.positions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

public record ExitLevels(BigDecimal stopLossPrice, BigDecimal takeProfitPrice) {
  private static final int PRICE_SCALE = 6;

  public ExitLevels {
    Objects.requireNonNull(stopLossPrice, "stopLossPrice must not be null");
    Objects.requireNonNull(takeProfitPrice, "takeProfitPrice must not be null");
  }

  /**
   * Derives stop-loss and take-profit prices from an entry price. Long positions stop below the
   * entry and take profit above it; short positions mirror that.
   */
  public static ExitLevels around(
      TradeSide side,
      BigDecimal entryPrice,
      BigDecimal stopLossFraction,
      BigDecimal takeProfitFraction) {
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(entryPrice, "entryPrice must not be null");
    BigDecimal stopOffset = entryPrice.multiply(stopLossFraction);
    BigDecimal takeOffset = entryPrice.multiply(takeProfitFraction);
    if (side == TradeSide.BUY) {
      return new ExitLevels(
          scaled(entryPrice.subtract(stopOffset)), scaled(entryPrice.add(takeOffset)));
    }
    return new ExitLevels(
        scaled(entryPrice.add(stopOffset)), scaled(entryPrice.subtract(takeOffset)));
  }

  private static BigDecimal scaled(BigDecimal price) {
    return price.max(BigDecimal.ZERO).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
  }
}
