package com.copytrading.domain.positions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PositionTest {
  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  @Test
  void shouldOpenPendingPositionWithOrderId() {
    Position pending = pending(TradeSide.BUY, "0.50");

    Position open = pending.opened("ord-1", NOW.plusSeconds(1));

    assertEquals(PositionStatus.OPEN, open.status());
    assertEquals("ord-1", open.orderId());
    assertEquals(NOW, open.openedAt());
    assertEquals(NOW.plusSeconds(1), open.updatedAt());
  }

  @Test
  void shouldComputeLongAndShortPnl() {
    Position longPosition = pending(TradeSide.BUY, "0.50").opened("ord-1", NOW);
    Position shortPosition = pending(TradeSide.SELL, "0.50").opened("ord-2", NOW);

    assertEquals(0, new BigDecimal("1.00").compareTo(longPosition.realizedPnl(new BigDecimal("0.60"))));
    assertEquals(0, new BigDecimal("-1.00").compareTo(shortPosition.realizedPnl(new BigDecimal("0.60"))));
  }

  @Test
  void shouldDeriveExitLevelsBySide() {
    ExitLevels longLevels =
        ExitLevels.around(
            TradeSide.BUY, new BigDecimal("0.50"), new BigDecimal("0.10"), new BigDecimal("0.20"));
    ExitLevels shortLevels =
        ExitLevels.around(
            TradeSide.SELL, new BigDecimal("0.50"), new BigDecimal("0.10"), new BigDecimal("0.20"));

    assertEquals(0, new BigDecimal("0.45").compareTo(longLevels.stopLossPrice()));
    assertEquals(0, new BigDecimal("0.60").compareTo(longLevels.takeProfitPrice()));
    assertEquals(0, new BigDecimal("0.55").compareTo(shortLevels.stopLossPrice()));
    assertEquals(0, new BigDecimal("0.40").compareTo(shortLevels.takeProfitPrice()));
  }

  @Test
  void shouldRejectNonPositiveSize() {
    assertThrows(
        PositionDomainException.class,
        () ->
            Position.pending(
                new PositionId("mkt-1", TradeSide.BUY),
                "trade-1",
                BigDecimal.ZERO,
                new BigDecimal("0.50"),
                new ExitLevels(new BigDecimal("0.45"), new BigDecimal("0.60")),
                NOW));
  }

  @Test
  void shouldRequireOrderIdOnceOpen() {
    assertThrows(PositionDomainException.class, () -> pending(TradeSide.BUY, "0.50").opened(" ", NOW));
  }

  private static Position pending(TradeSide side, String entry) {
    BigDecimal entryPrice = new BigDecimal(entry);
    return Position.pending(
        new PositionId("mkt-1", side),
        "trade-1",
        new BigDecimal("10"),
        entryPrice,
        ExitLevels.around(side, entryPrice, new BigDecimal("0.10"), new BigDecimal("0.20")),
        NOW);
  }
}
