package com.copytrading.domain.positions;

import java.util.Objects;

/** One position per market and side; a second signal for the same pair targets the same id. */
public record PositionId(String marketId, TradeSide side) {
  public PositionId {
    if (marketId == null || marketId.isBlank()) {
      throw new PositionDomainException("marketId must not be blank");
    }
    Objects.requireNonNull(side, "side must not be null");
  }

  public String key() {
    return marketId + "_" + side;
  }

  @Override
  public String toString() {
    return key();
  }
}
