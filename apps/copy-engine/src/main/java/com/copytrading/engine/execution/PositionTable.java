package com.copytrading.engine.execution;

import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionId;
import com.copytrading.domain.positions.PositionStatus;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Live positions keyed by market and side, with one lock per key. Writes are only accepted from
 * inside {@link #withLock}; reads are lock-free snapshots.
 *
 * <p>A lock entry lives exactly as long as its position: when the guarded block leaves no position
 * behind, the entry is dropped before the lock is released. A thread that was queued on a dropped
 * lock notices the swap and retries with the current one.
 */
public class PositionTable {
  private final ConcurrentHashMap<PositionId, Position> positions = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<PositionId, ReentrantLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(PositionId id, Supplier<T> action) {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(action, "action must not be null");
    ReentrantLock lock = acquire(id);
    try {
      return action.get();
    } finally {
      if (lock.getHoldCount() == 1 && !positions.containsKey(id)) {
        locks.remove(id, lock);
      }
      lock.unlock();
    }
  }

  public Optional<Position> find(PositionId id) {
    return Optional.ofNullable(positions.get(id));
  }

  public boolean contains(PositionId id) {
    return positions.containsKey(id);
  }

  public List<Position> snapshot() {
    return List.copyOf(positions.values());
  }

  public int openCount() {
    int count = 0;
    for (Position position : positions.values()) {
      if (position.status() != PositionStatus.CLOSED) {
        count++;
      }
    }
    return count;
  }

  int lockCount() {
    return locks.size();
  }

  void put(Position position) {
    Objects.requireNonNull(position, "position must not be null");
    requireHeld(position.id());
    positions.put(position.id(), position);
  }

  void remove(PositionId id) {
    requireHeld(id);
    positions.remove(id);
  }

  private ReentrantLock acquire(PositionId id) {
    while (true) {
      ReentrantLock lock = locks.computeIfAbsent(id, ignored -> new ReentrantLock());
      lock.lock();
      if (locks.get(id) == lock) {
        return lock;
      }
      lock.unlock();
    }
  }

  private void requireHeld(PositionId id) {
    ReentrantLock lock = locks.get(id);
    if (lock == null || !lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("position " + id + " must be modified under its lock");
    }
  }
}
