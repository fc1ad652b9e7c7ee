package com.copytrading.integration.exchange;

import java.math.BigDecimal;
import java.util.Objects;

public record OrderResult(String orderId, BigDecimal filledPrice, OrderResultStatus status) {
  public OrderResult {
    Objects.requireNonNull(status, "status must not be null");
  }

  public boolean isAccepted() {
    return status.isAccepted() && orderId != null && !orderId.isBlank();
  }

  public BigDecimal filledPriceOr(BigDecimal fallback) {
    if (filledPrice == null || filledPrice.signum() <= 0) {
      return fallback;
    }
    return filledPrice;
  }
}
