package com.copytrading.domain.positions;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Risk-budget position sizing in decimal arithmetic.
 *
 * <p>{@code priceRisk = max(|entry - stop|, currentPrice * floor)} keeps the division bounded when
 * the stop sits on top of the entry. The raw size is capped by a fraction of the copied trade's
 * amount, then clamped into {@code [minSize, maxSize]} and rounded down to four decimals.
 */
public final class PositionSizer {
  public static final int SIZE_SCALE = 4;

  private final SizingLimits limits;

  public PositionSizer(SizingLimits limits) {
    this.limits = Objects.requireNonNull(limits, "limits must not be null");
  }

  public SizingDecision size(
      BigDecimal balance,
      BigDecimal entryPrice,
      BigDecimal stopLossPrice,
      BigDecimal currentPrice,
      BigDecimal signalAmount) {
    Objects.requireNonNull(balance, "balance must not be null");
    Objects.requireNonNull(entryPrice, "entryPrice must not be null");
    Objects.requireNonNull(stopLossPrice, "stopLossPrice must not be null");
    Objects.requireNonNull(currentPrice, "currentPrice must not be null");
    Objects.requireNonNull(signalAmount, "signalAmount must not be null");

    BigDecimal riskBudget = balance.max(BigDecimal.ZERO).multiply(limits.riskBudgetFraction());
    BigDecimal stopDistance = entryPrice.subtract(stopLossPrice).abs();
    BigDecimal floor = currentPrice.abs().multiply(limits.priceRiskFloor());
    BigDecimal priceRisk = stopDistance.max(floor);

    BigDecimal raw;
    if (priceRisk.signum() == 0) {
      raw = limits.minSize();
    } else {
      raw = riskBudget.divide(priceRisk, MathContext.DECIMAL64);
    }
    if (limits.copyRatio().signum() > 0) {
      raw = raw.min(signalAmount.multiply(limits.copyRatio()));
    }

    BigDecimal clamped = raw.max(limits.minSize()).min(limits.maxSize());
    BigDecimal size = clamped.setScale(SIZE_SCALE, RoundingMode.DOWN);
    if (size.signum() <= 0) {
      size = limits.minSize();
    }
    return new SizingDecision(size, riskBudget, priceRisk, raw);
  }
}
