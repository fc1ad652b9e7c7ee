package com.copytrading.engine.breaker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.copytrading.domain.risk.CircuitBreakerState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileCircuitBreakerStateStoreTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @TempDir Path tempDir;

  @Test
  void shouldReturnEmptyWhenNoFileExists() {
    JsonFileCircuitBreakerStateStore store = storeAt(tempDir.resolve("state.json"));

    assertTrue(store.load().isEmpty());
  }

  @Test
  void shouldRoundTripEveryField() {
    JsonFileCircuitBreakerStateStore store = storeAt(tempDir.resolve("nested/state.json"));
    CircuitBreakerState state =
        new CircuitBreakerState(
            true,
            "Daily loss limit reached (110.00 / 100.00)",
            Instant.parse("2026-03-02T10:15:30.123Z"),
            Instant.parse("2026-03-02T11:15:30.123Z"),
            new BigDecimal("110.25"),
            new BigDecimal("100"),
            3,
            5,
            LocalDate.of(2026, 3, 2),
            12,
            4);

    store.save(state);

    assertEquals(Optional.of(state), store.load());
  }

  @Test
  void shouldWriteSnakeCaseFieldsWithDecimalStrings() throws IOException {
    Path file = tempDir.resolve("state.json");
    JsonFileCircuitBreakerStateStore store = storeAt(file);

    store.save(CircuitBreakerState.initial(new BigDecimal("100.50"), 5, LocalDate.of(2026, 3, 2)));

    JsonNode json = objectMapper.readTree(file.toFile());
    assertFalse(json.get("active").asBoolean());
    assertTrue(json.get("daily_loss").isTextual());
    assertEquals("100.50", json.get("max_daily_loss").asText());
    assertEquals("2026-03-02", json.get("last_reset_date").asText());
    assertEquals(5, json.get("consecutive_loss_threshold").asInt());
    assertTrue(json.get("activated_at").isNull());
  }

  @Test
  void shouldLeaveNoTempFilesBehindAfterRepeatedSaves() throws IOException {
    Path file = tempDir.resolve("state.json");
    JsonFileCircuitBreakerStateStore store = storeAt(file);
    CircuitBreakerState state =
        CircuitBreakerState.initial(new BigDecimal("100"), 5, LocalDate.of(2026, 3, 2));

    store.save(state);
    store.save(state.withLoss(BigDecimal.TEN));
    store.save(
        state.activated("Manual activation", Instant.parse("2026-03-02T10:00:00Z"), Duration.ZERO));

    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(List.of(file), files.toList());
    }
    assertTrue(store.load().orElseThrow().active());
  }

  @Test
  void shouldFillDefaultsForFieldsWrittenByOlderVersions() throws IOException {
    Path file = tempDir.resolve("state.json");
    Files.writeString(
        file,
        """
        {
          "active": false,
          "reason": null,
          "activated_at": null,
          "cooldown_until": null,
          "daily_loss": 12.5,
          "max_daily_loss": "100",
          "consecutive_losses": 2,
          "last_reset_date": "2026-03-02",
          "notes": "ignored"
        }
        """,
        StandardCharsets.UTF_8);

    CircuitBreakerState state = storeAt(file).load().orElseThrow();

    assertEquals(0, new BigDecimal("12.5").compareTo(state.dailyLoss()));
    assertEquals(
        CircuitBreakerState.DEFAULT_CONSECUTIVE_LOSS_THRESHOLD, state.consecutiveLossThreshold());
    assertEquals(0, state.totalTrades());
  }

  @Test
  void shouldRejectTruncatedFile() throws IOException {
    Path file = tempDir.resolve("state.json");
    Files.writeString(file, "{\"active\": true, \"daily_lo", StandardCharsets.UTF_8);

    assertThrows(StateCorruptionException.class, () -> storeAt(file).load());
  }

  @Test
  void shouldRejectFileWithInvalidValues() throws IOException {
    Path file = tempDir.resolve("state.json");
    Files.writeString(
        file,
        """
        {"active": false, "daily_loss": "-3", "max_daily_loss": "100", "last_reset_date": "2026-03-02"}
        """,
        StandardCharsets.UTF_8);

    assertThrows(StateCorruptionException.class, () -> storeAt(file).load());
  }

  @Test
  void shouldRejectActiveStateWithoutCooldownEnd() throws IOException {
    Path file = tempDir.resolve("state.json");
    Files.writeString(
        file,
        """
        {
          "active": true,
          "reason": "Manual activation",
          "activated_at": "2026-03-02T10:00:00Z",
          "cooldown_until": null,
          "daily_loss": "0",
          "max_daily_loss": "100",
          "last_reset_date": "2026-03-02"
        }
        """,
        StandardCharsets.UTF_8);

    assertThrows(StateCorruptionException.class, () -> storeAt(file).load());
  }

  @Test
  void shouldRejectFileMissingRequiredFields() throws IOException {
    Path file = tempDir.resolve("state.json");
    Files.writeString(file, "{\"active\": false}", StandardCharsets.UTF_8);

    assertThrows(StateCorruptionException.class, () -> storeAt(file).load());
  }

  private JsonFileCircuitBreakerStateStore storeAt(Path file) {
    return new JsonFileCircuitBreakerStateStore(file, objectMapper);
  }
}
