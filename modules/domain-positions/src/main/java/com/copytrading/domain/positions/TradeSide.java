package com.copytrading.domain.positions;

public enum TradeSide {
  BUY,
  SELL;

  public TradeSide opposite() {
    return this == BUY ? SELL : BUY;
  }
}
