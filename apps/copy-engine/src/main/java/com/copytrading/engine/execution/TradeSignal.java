package com.copytrading.engine.execution;

import com.copytrading.domain.positions.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A trade observed on a followed wallet. Fields are nullable on purpose: the signal comes from an
 * external feed and is checked by {@link TradeSignalValidator} before anything acts on it.
 */
public record TradeSignal(
    String tradeId,
    String marketId,
    TradeSide side,
    BigDecimal amount,
    BigDecimal price,
    BigDecimal confidence,
    Instant observedAt) {

  String tradeIdOrUnknown() {
    return tradeId == null || tradeId.isBlank() ? "unknown" : tradeId;
  }
}
