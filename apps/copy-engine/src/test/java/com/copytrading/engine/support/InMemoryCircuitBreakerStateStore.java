package com.copytrading.engine.support;

import com.copytrading.domain.risk.CircuitBreakerState;
import com.copytrading.engine.breaker.CircuitBreakerStateStore;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryCircuitBreakerStateStore implements CircuitBreakerStateStore {
  private final AtomicReference<CircuitBreakerState> saved = new AtomicReference<>();
  private final AtomicInteger saves = new AtomicInteger();

  public InMemoryCircuitBreakerStateStore() {}

  public InMemoryCircuitBreakerStateStore(CircuitBreakerState initial) {
    saved.set(initial);
  }

  @Override
  public Optional<CircuitBreakerState> load() {
    return Optional.ofNullable(saved.get());
  }

  @Override
  public void save(CircuitBreakerState state) {
    saved.set(state);
    saves.incrementAndGet();
  }

  public CircuitBreakerState saved() {
    return saved.get();
  }

  public int saveCount() {
    return saves.get();
  }
}
