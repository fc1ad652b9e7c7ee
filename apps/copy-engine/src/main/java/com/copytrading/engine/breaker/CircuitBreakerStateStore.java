package com.copytrading.engine.breaker;

import com.copytrading.domain.risk.CircuitBreakerState;
import java.util.Optional;

public interface CircuitBreakerStateStore {
  /**
   * Returns the last saved snapshot, or empty when nothing was saved yet.
   *
   * @throws StateCorruptionException when a snapshot exists but cannot be decoded
   */
  Optional<CircuitBreakerState> load();

  /**
   * Replaces the saved snapshot atomically: a reader sees either the old or the new document.
   *
   * @throws StateStoreException when the write fails
   */
  void save(CircuitBreakerState state);
}
