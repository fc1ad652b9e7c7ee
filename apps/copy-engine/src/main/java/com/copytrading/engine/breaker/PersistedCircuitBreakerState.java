package com.copytrading.engine.breaker;

import com.copytrading.domain.risk.CircuitBreakerState;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * On-disk shape of the breaker snapshot. Money is kept as decimal strings, timestamps as ISO-8601
 * UTC and the reset day as {@code yyyy-MM-dd}. Unknown fields are ignored so older builds can read
 * newer files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record PersistedCircuitBreakerState(
    @JsonProperty("active") boolean active,
    @JsonProperty("reason") String reason,
    @JsonProperty("activated_at") String activatedAt,
    @JsonProperty("cooldown_until") String cooldownUntil,
    @JsonProperty("daily_loss") String dailyLoss,
    @JsonProperty("max_daily_loss") String maxDailyLoss,
    @JsonProperty("consecutive_losses") Integer consecutiveLosses,
    @JsonProperty("consecutive_loss_threshold") Integer consecutiveLossThreshold,
    @JsonProperty("last_reset_date") String lastResetDate,
    @JsonProperty("total_trades") Integer totalTrades,
    @JsonProperty("failed_trades") Integer failedTrades) {

  static PersistedCircuitBreakerState from(CircuitBreakerState state) {
    return new PersistedCircuitBreakerState(
        state.active(),
        state.reason(),
        state.activatedAt() == null ? null : state.activatedAt().toString(),
        state.cooldownUntil() == null ? null : state.cooldownUntil().toString(),
        state.dailyLoss().toPlainString(),
        state.maxDailyLoss().toPlainString(),
        state.consecutiveLosses(),
        state.consecutiveLossThreshold(),
        state.lastResetDate().toString(),
        state.totalTrades(),
        state.failedTrades());
  }

  CircuitBreakerState toDomain() {
    return new CircuitBreakerState(
        active,
        reason,
        instantOrNull(activatedAt),
        instantOrNull(cooldownUntil),
        new BigDecimal(required(dailyLoss, "daily_loss")),
        new BigDecimal(required(maxDailyLoss, "max_daily_loss")),
        consecutiveLosses == null ? 0 : consecutiveLosses,
        consecutiveLossThreshold == null
            ? CircuitBreakerState.DEFAULT_CONSECUTIVE_LOSS_THRESHOLD
            : consecutiveLossThreshold,
        LocalDate.parse(required(lastResetDate, "last_reset_date")),
        totalTrades == null ? 0 : totalTrades,
        failedTrades == null ? 0 : failedTrades);
  }

  private static String required(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new StateCorruptionException("Persisted breaker state is missing " + field);
    }
    return value;
  }

  private static Instant instantOrNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    if (value.endsWith("Z")) {
      return Instant.parse(value);
    }
    return OffsetDateTime.parse(value).toInstant();
  }
}
