package com.copytrading.integration.exchange;

import com.copytrading.infra.resilience.errors.TransientIoException;

public class PriceUnavailableException extends TransientIoException {
  private final String marketId;

  public PriceUnavailableException(String marketId, String message) {
    super("Price unavailable for market " + marketId + ": " + message);
    this.marketId = marketId;
  }

  public PriceUnavailableException(String marketId, String message, Throwable cause) {
    super("Price unavailable for market " + marketId + ": " + message, cause);
    this.marketId = marketId;
  }

  public String marketId() {
    return marketId;
  }
}
