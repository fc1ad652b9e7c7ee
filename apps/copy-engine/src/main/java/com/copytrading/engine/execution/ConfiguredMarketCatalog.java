package com.copytrading.engine.execution;

import com.copytrading.integration.exchange.MarketCatalog;
import java.util.Collection;
import java.util.Set;

/** Allow-list from configuration. An empty list accepts every non-blank market id. */
public class ConfiguredMarketCatalog implements MarketCatalog {
  private final Set<String> allowedMarkets;

  public ConfiguredMarketCatalog(Collection<String> allowedMarkets) {
    this.allowedMarkets = allowedMarkets == null ? Set.of() : Set.copyOf(allowedMarkets);
  }

  @Override
  public boolean isKnownMarket(String marketId) {
    if (marketId == null || marketId.isBlank()) {
      return false;
    }
    return allowedMarkets.isEmpty() || allowedMarkets.contains(marketId);
  }
}
