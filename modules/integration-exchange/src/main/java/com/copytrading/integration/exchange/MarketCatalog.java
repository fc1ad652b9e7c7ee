package com.copytrading.integration.exchange;

@FunctionalInterface
public interface MarketCatalog {
  boolean isKnownMarket(String marketId);
}
