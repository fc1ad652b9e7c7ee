package com.copytrading.engine.execution;

import com.copytrading.integration.exchange.MarketCatalog;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Collects every reason a signal cannot be copied; an empty list means it is acceptable. */
public class TradeSignalValidator {
  private static final Logger log = LoggerFactory.getLogger(TradeSignalValidator.class);
  private static final Duration STALE_AFTER = Duration.ofMinutes(5);

  private final MarketCatalog marketCatalog;
  private final BigDecimal minPrice;
  private final BigDecimal maxPrice;
  private final BigDecimal minConfidence;
  private final Clock clock;

  public TradeSignalValidator(
      MarketCatalog marketCatalog,
      BigDecimal minPrice,
      BigDecimal maxPrice,
      BigDecimal minConfidence,
      Clock clock) {
    this.marketCatalog = Objects.requireNonNull(marketCatalog, "marketCatalog must not be null");
    this.minPrice = Objects.requireNonNull(minPrice, "minPrice must not be null");
    this.maxPrice = Objects.requireNonNull(maxPrice, "maxPrice must not be null");
    this.minConfidence = Objects.requireNonNull(minConfidence, "minConfidence must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    if (minPrice.compareTo(maxPrice) > 0) {
      throw new IllegalArgumentException("minPrice must be <= maxPrice");
    }
  }

  public List<String> validate(TradeSignal signal) {
    List<String> violations = new ArrayList<>();
    if (signal == null) {
      violations.add("signal is missing");
      return violations;
    }
    if (signal.tradeId() == null || signal.tradeId().isBlank()) {
      violations.add("trade id is missing");
    }
    if (signal.marketId() == null || signal.marketId().isBlank()) {
      violations.add("market id is missing");
    } else if (!marketCatalog.isKnownMarket(signal.marketId())) {
      violations.add("unknown market " + signal.marketId());
    }
    if (signal.side() == null) {
      violations.add("side is missing");
    }
    if (signal.amount() == null || signal.amount().signum() <= 0) {
      violations.add("amount must be > 0");
    }
    if (signal.price() == null) {
      violations.add("price is missing");
    } else if (signal.price().compareTo(minPrice) < 0 || signal.price().compareTo(maxPrice) > 0) {
      violations.add(
          "price "
              + signal.price().toPlainString()
              + " outside ["
              + minPrice.toPlainString()
              + ", "
              + maxPrice.toPlainString()
              + "]");
    }
    if (signal.confidence() != null && signal.confidence().compareTo(minConfidence) < 0) {
      violations.add(
          "confidence "
              + signal.confidence().toPlainString()
              + " below minimum "
              + minConfidence.toPlainString());
    }
    warnIfStale(signal);
    return violations;
  }

  private void warnIfStale(TradeSignal signal) {
    if (signal.observedAt() == null) {
      return;
    }
    Duration age = Duration.between(signal.observedAt(), Instant.now(clock));
    if (age.compareTo(STALE_AFTER) > 0) {
      log.warn(
          "Copying stale trade signal trade_id={} age_seconds={}",
          signal.tradeId(),
          age.getSeconds());
    }
  }
}
