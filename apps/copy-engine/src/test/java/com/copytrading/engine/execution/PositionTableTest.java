package com.copytrading.engine.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.copytrading.domain.positions.ExitLevels;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionId;
import com.copytrading.domain.positions.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class PositionTableTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
  private static final PositionId ID = new PositionId("m-1", TradeSide.BUY);

  private final PositionTable table = new PositionTable();

  @Test
  void shouldRejectWritesOutsideTheLock() {
    assertThrows(IllegalStateException.class, () -> table.put(openPosition(ID)));
    assertThrows(IllegalStateException.class, () -> table.remove(ID));
  }

  @Test
  void shouldKeepLockWhilePositionExistsAndDropItWithThePosition() {
    table.withLock(
        ID,
        () -> {
          table.put(openPosition(ID));
          return null;
        });
    assertEquals(1, table.lockCount());
    assertTrue(table.find(ID).isPresent());

    table.withLock(
        ID,
        () -> {
          table.remove(ID);
          return null;
        });

    assertEquals(0, table.lockCount());
    assertTrue(table.snapshot().isEmpty());
  }

  @Test
  void shouldNotLeaveLocksBehindForReadOnlyBlocks() {
    table.withLock(ID, () -> table.find(ID).isPresent());

    assertEquals(0, table.lockCount());
  }

  @Test
  void shouldReleaseTheLockWhenTheBlockThrows() throws Exception {
    assertThrows(
        IllegalStateException.class,
        () ->
            table.withLock(
                ID,
                () -> {
                  throw new IllegalStateException("exchange down");
                }));

    assertEquals(0, table.lockCount());
    assertTrue(table.snapshot().isEmpty());

    ExecutorService other = Executors.newSingleThreadExecutor();
    try {
      Future<Boolean> stored =
          other.submit(
              () ->
                  table.withLock(
                      ID,
                      () -> {
                        table.put(openPosition(ID));
                        return table.contains(ID);
                      }));
      assertTrue(stored.get(2, TimeUnit.SECONDS));
    } finally {
      other.shutdownNow();
    }
    assertEquals(1, table.lockCount());
  }

  @Test
  void shouldSerializeBlocksForTheSamePosition() throws Exception {
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 64; i++) {
        boolean open = i % 2 == 0;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return table.withLock(
                      ID,
                      () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        if (open && table.find(ID).isEmpty()) {
                          table.put(openPosition(ID));
                        } else if (!open) {
                          table.remove(ID);
                        }
                        inside.decrementAndGet();
                        return null;
                      });
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, maxInside.get());
    assertEquals(table.contains(ID) ? 1 : 0, table.lockCount());
  }

  private static Position openPosition(PositionId id) {
    return Position.pending(
            id,
            "t-1",
            new BigDecimal("5"),
            new BigDecimal("0.50"),
            new ExitLevels(new BigDecimal("0.45"), new BigDecimal("0.60")),
            NOW)
        .opened("ord-1", NOW);
  }
}
