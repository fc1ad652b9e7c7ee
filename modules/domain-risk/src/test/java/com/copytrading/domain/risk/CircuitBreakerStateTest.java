package com.copytrading.domain.risk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CircuitBreakerStateTest {
  private static final LocalDate TODAY = LocalDate.parse("2026-03-02");
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  @Test
  void shouldAccumulateAbsoluteLossesAndStreak() {
    CircuitBreakerState state =
        CircuitBreakerState.initial(new BigDecimal("100"), 5, TODAY)
            .withLoss(new BigDecimal("-12.50"))
            .withLoss(new BigDecimal("7.25"));

    assertEquals(0, new BigDecimal("19.75").compareTo(state.dailyLoss()));
    assertEquals(2, state.consecutiveLosses());
  }

  @Test
  void shouldResetStreakOnProfitButKeepDailyLoss() {
    CircuitBreakerState state =
        CircuitBreakerState.initial(new BigDecimal("100"), 5, TODAY)
            .withLoss(new BigDecimal("10"))
            .withLoss(new BigDecimal("10"))
            .withProfit();

    assertEquals(0, state.consecutiveLosses());
    assertEquals(0, new BigDecimal("20").compareTo(state.dailyLoss()));
  }

  @Test
  void shouldPreferDailyLossRuleWhenBothTrigger() {
    CircuitBreakerState state = CircuitBreakerState.initial(new BigDecimal("3"), 3, TODAY);
    for (int i = 0; i < 3; i++) {
      state = state.withLoss(BigDecimal.ONE);
    }

    assertEquals(Optional.of(ActivationRule.DAILY_LOSS), state.triggeredRule());
    assertEquals("Daily loss limit reached (3.00 / 3.00)", state.reasonFor(ActivationRule.DAILY_LOSS));
  }

  @Test
  void shouldReportConsecutiveLossRule() {
    CircuitBreakerState state = CircuitBreakerState.initial(new BigDecimal("1000"), 2, TODAY);
    state = state.withLoss(BigDecimal.ONE).withLoss(BigDecimal.ONE);

    assertEquals(Optional.of(ActivationRule.CONSECUTIVE_LOSSES), state.triggeredRule());
    assertTrue(state.reasonFor(ActivationRule.CONSECUTIVE_LOSSES).contains("consecutive losses"));
  }

  @Test
  void shouldSetCooldownOnActivationAndClearOnlyActivationOnReset() {
    CircuitBreakerState active =
        CircuitBreakerState.initial(new BigDecimal("100"), 5, TODAY)
            .withLoss(new BigDecimal("75"))
            .activated("test", NOW, Duration.ofHours(1));

    assertTrue(active.active());
    assertEquals(Instant.parse("2026-03-02T11:00:00Z"), active.cooldownUntil());

    CircuitBreakerState cleared = active.cleared();
    assertFalse(cleared.active());
    assertNull(cleared.reason());
    assertNull(cleared.activatedAt());
    assertNull(cleared.cooldownUntil());
    assertEquals(0, new BigDecimal("75").compareTo(cleared.dailyLoss()));
    assertEquals(TODAY, cleared.lastResetDate());
  }

  @Test
  void shouldRollOverCountersWithoutTouchingActivation() {
    CircuitBreakerState active =
        CircuitBreakerState.initial(new BigDecimal("100"), 5, TODAY)
            .withLoss(new BigDecimal("120"))
            .activated("limit", NOW, Duration.ofHours(1));

    CircuitBreakerState nextDay = active.rolledOverTo(TODAY.plusDays(1));

    assertTrue(nextDay.active());
    assertEquals(BigDecimal.ZERO, nextDay.dailyLoss());
    assertEquals(0, nextDay.consecutiveLosses());
    assertEquals(TODAY.plusDays(1), nextDay.lastResetDate());
    assertSame(active, active.rolledOverTo(TODAY));
  }

  @Test
  void shouldComputeRemainingCooldown() {
    CircuitBreakerState active =
        CircuitBreakerState.initial(new BigDecimal("100"), 5, TODAY)
            .activated("test", NOW, Duration.ofMinutes(30));

    assertEquals(Duration.ofMinutes(20), active.remainingCooldown(NOW.plus(Duration.ofMinutes(10))));
    assertFalse(active.isCooldownElapsed(NOW.plus(Duration.ofMinutes(29))));
    assertTrue(active.isCooldownElapsed(NOW.plus(Duration.ofMinutes(30))));
    assertEquals(Duration.ZERO, active.remainingCooldown(NOW.plus(Duration.ofHours(2))));
  }

  @Test
  void shouldRejectActiveStateWithoutReason() {
    assertThrows(
        RiskDomainException.class,
        () ->
            new CircuitBreakerState(
                true, null, NOW, null, BigDecimal.ZERO, BigDecimal.TEN, 0, 5, TODAY, 0, 0));
  }

  @Test
  void shouldRejectActiveStateWithoutCooldownEnd() {
    assertThrows(
        RiskDomainException.class,
        () ->
            new CircuitBreakerState(
                true, "halt", NOW, null, BigDecimal.ZERO, BigDecimal.TEN, 0, 5, TODAY, 0, 0));
  }

  @Test
  void shouldRejectNegativeDailyLoss() {
    assertThrows(
        RiskDomainException.class,
        () ->
            new CircuitBreakerState(
                false, null, null, null, new BigDecimal("-1"), BigDecimal.TEN, 0, 5, TODAY, 0, 0));
  }

  @Test
  void shouldCountTradeResultsSeparatelyFromStreak() {
    CircuitBreakerState state =
        CircuitBreakerState.initial(new BigDecimal("100"), 5, TODAY)
            .withTradeResult(false)
            .withTradeResult(false)
            .withTradeResult(true);

    assertEquals(3, state.totalTrades());
    assertEquals(2, state.failedTrades());
    assertEquals(0, state.consecutiveLosses());
  }
}
