package com.copytrading.infra.resilience.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.copytrading.infra.resilience.errors.TransientIoException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {
  @Test
  void shouldRetryTransientFailuresWithBackoff() {
    List<Duration> waits = new ArrayList<>();
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    RetryExecutor executor = new RetryExecutor(transientPolicy(3), waits::add, registry);

    AtomicInteger attempts = new AtomicInteger();
    String actual =
        executor.execute(
            "price_fetch",
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new TransientIoException("rate limited");
              }
              return "0.55";
            });

    assertEquals("0.55", actual);
    assertEquals(3, attempts.get());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), waits);
    assertEquals(
        2.0d,
        registry.get("copytrading.retry.attempts").tag("operation", "price_fetch").counter().count());
  }

  @Test
  void shouldNotRetryNonTransientFailures() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    RetryExecutor executor = new RetryExecutor(transientPolicy(3), duration -> {}, registry);

    AtomicInteger attempts = new AtomicInteger();
    assertThrows(
        IllegalStateException.class,
        () ->
            executor.execute(
                "order_submit",
                () -> {
                  attempts.incrementAndGet();
                  throw new IllegalStateException("rejected");
                }));

    assertEquals(1, attempts.get());
    assertEquals(0, registry.find("copytrading.retry.attempts").meters().size());
    assertEquals(0, registry.find("copytrading.retry.exhausted").meters().size());
  }

  @Test
  void shouldCountExhaustionAndRethrowLastFailure() {
    List<Duration> waits = new ArrayList<>();
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    RetryExecutor executor = new RetryExecutor(transientPolicy(2), waits::add, registry);

    AtomicInteger attempts = new AtomicInteger();
    TransientIoException thrown =
        assertThrows(
            TransientIoException.class,
            () ->
                executor.run(
                    "state_persist",
                    () -> {
                      throw new TransientIoException("disk full #" + attempts.incrementAndGet());
                    }));

    assertEquals("disk full #2", thrown.getMessage());
    assertEquals(List.of(Duration.ofMillis(100)), waits);
    assertEquals(
        1.0d,
        registry
            .get("copytrading.retry.exhausted")
            .tag("operation", "state_persist")
            .counter()
            .count());
  }

  @Test
  void shouldSleepOnTheCallingThreadByDefault() {
    RetryExecutor executor =
        new RetryExecutor(
            ExceptionFilteringRetryPolicy.transientOnly(
                new ExponentialBackoffRetryPolicy(
                    2, Duration.ofMillis(30), Duration.ofMillis(30), 2.0d)),
            new SimpleMeterRegistry());

    AtomicInteger attempts = new AtomicInteger();
    long startedAt = System.nanoTime();
    String actual =
        executor.execute(
            "balance_fetch",
            () -> {
              if (attempts.incrementAndGet() == 1) {
                throw new TransientIoException("connection reset");
              }
              return "1000";
            });

    assertEquals("1000", actual);
    assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).toMillis() >= 30L);
  }

  private static RetryPolicy transientPolicy(int maxAttempts) {
    return ExceptionFilteringRetryPolicy.transientOnly(
        new ExponentialBackoffRetryPolicy(
            maxAttempts, Duration.ofMillis(100), Duration.ofMillis(1000), 2.0d));
  }
}
