package com.copytrading.domain.positions;

import java.math.BigDecimal;
import java.util.Objects;

public record SizingLimits(
    BigDecimal minSize,
    BigDecimal maxSize,
    BigDecimal riskBudgetFraction,
    BigDecimal priceRiskFloor,
    BigDecimal copyRatio) {
  public SizingLimits {
    Objects.requireNonNull(minSize, "minSize must not be null");
    Objects.requireNonNull(maxSize, "maxSize must not be null");
    Objects.requireNonNull(riskBudgetFraction, "riskBudgetFraction must not be null");
    Objects.requireNonNull(priceRiskFloor, "priceRiskFloor must not be null");
    Objects.requireNonNull(copyRatio, "copyRatio must not be null");
    if (minSize.signum() <= 0 || maxSize.compareTo(minSize) < 0) {
      throw new PositionDomainException("size bounds must satisfy 0 < minSize <= maxSize");
    }
    if (riskBudgetFraction.signum() <= 0 || priceRiskFloor.signum() <= 0) {
      throw new PositionDomainException("riskBudgetFraction and priceRiskFloor must be > 0");
    }
    if (copyRatio.signum() < 0) {
      throw new PositionDomainException("copyRatio must be >= 0");
    }
  }
}
