package com.copytrading.engine.breaker;

import com.copytrading.domain.risk.CircuitBreakerState;
import com.copytrading.domain.risk.RiskDomainException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the breaker snapshot in a single JSON document. Writes go to a sibling temp file that is
 * flushed to disk and then renamed over the target, so a crash leaves either the old or the new
 * document.
 */
public class JsonFileCircuitBreakerStateStore implements CircuitBreakerStateStore {
  private static final Logger log = LoggerFactory.getLogger(JsonFileCircuitBreakerStateStore.class);

  private final Path stateFile;
  private final ObjectMapper objectMapper;

  public JsonFileCircuitBreakerStateStore(Path stateFile, ObjectMapper objectMapper) {
    this.stateFile =
        Objects.requireNonNull(stateFile, "stateFile must not be null").toAbsolutePath();
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  @Override
  public Optional<CircuitBreakerState> load() {
    if (!Files.exists(stateFile)) {
      return Optional.empty();
    }
    byte[] content;
    try {
      content = Files.readAllBytes(stateFile);
    } catch (IOException ex) {
      throw new StateCorruptionException("Cannot read breaker state file " + stateFile, ex);
    }
    try {
      PersistedCircuitBreakerState persisted =
          objectMapper.readValue(content, PersistedCircuitBreakerState.class);
      if (persisted == null) {
        throw new StateCorruptionException("Breaker state file is empty: " + stateFile);
      }
      return Optional.of(persisted.toDomain());
    } catch (IOException ex) {
      throw new StateCorruptionException("Breaker state file is not valid JSON: " + stateFile, ex);
    } catch (DateTimeParseException | NumberFormatException | RiskDomainException ex) {
      throw new StateCorruptionException(
          "Breaker state file holds invalid values: " + stateFile + " (" + ex.getMessage() + ")",
          ex);
    }
  }

  @Override
  public void save(CircuitBreakerState state) {
    Objects.requireNonNull(state, "state must not be null");
    byte[] content = encode(state);
    Path directory = stateFile.getParent();
    Path tempFile = null;
    try {
      Files.createDirectories(directory);
      tempFile = Files.createTempFile(directory, stateFile.getFileName().toString(), ".tmp");
      writeAndForce(tempFile, content);
      moveIntoPlace(tempFile);
      tempFile = null;
    } catch (IOException ex) {
      throw new StateStoreException("Failed to write breaker state file " + stateFile, ex);
    } finally {
      if (tempFile != null) {
        deleteQuietly(tempFile);
      }
    }
  }

  private byte[] encode(CircuitBreakerState state) {
    try {
      return objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValueAsBytes(PersistedCircuitBreakerState.from(state));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode breaker state", ex);
    }
  }

  private static void writeAndForce(Path target, byte[] content) throws IOException {
    try (FileChannel channel =
        FileChannel.open(
            target, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
      ByteBuffer buffer = ByteBuffer.wrap(content);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
  }

  private void moveIntoPlace(Path tempFile) throws IOException {
    try {
      Files.move(
          tempFile,
          stateFile,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", stateFile);
      Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Failed to delete temp breaker state file path={} error={}", file, ex.getMessage());
    }
  }
}
