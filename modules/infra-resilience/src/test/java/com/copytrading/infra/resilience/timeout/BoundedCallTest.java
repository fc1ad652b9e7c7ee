package com.copytrading.infra.resilience.timeout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BoundedCallTest {
  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final BoundedCall boundedCall = new BoundedCall(executor);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldReturnValueWithinTimeout() {
    assertEquals("ok", boundedCall.call("quick", Duration.ofSeconds(2), () -> "ok"));
  }

  @Test
  void shouldRethrowCallFailureUnchanged() {
    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class,
            () ->
                boundedCall.call(
                    "failing",
                    Duration.ofSeconds(2),
                    () -> {
                      throw new IllegalStateException("exchange down");
                    }));

    assertEquals("exchange down", thrown.getMessage());
  }

  @Test
  void shouldTimeOutSlowCall() {
    CountDownLatch never = new CountDownLatch(1);

    CallTimeoutException thrown =
        assertThrows(
            CallTimeoutException.class,
            () ->
                boundedCall.call(
                    "slow_price",
                    Duration.ofMillis(50),
                    () -> {
                      try {
                        never.await();
                      } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                      }
                      return "late";
                    }));

    assertEquals("slow_price did not complete within 50ms", thrown.getMessage());
  }

  @Test
  void shouldInterruptTheWorkerOfATimedOutCall() throws InterruptedException {
    ExecutorService singleWorker = Executors.newFixedThreadPool(1);
    BoundedCall bounded = new BoundedCall(singleWorker);
    CountDownLatch interrupted = new CountDownLatch(1);
    try {
      assertThrows(
          CallTimeoutException.class,
          () ->
              bounded.call(
                  "hung_balance",
                  Duration.ofMillis(50),
                  () -> {
                    try {
                      Thread.sleep(5_000L);
                    } catch (InterruptedException ex) {
                      interrupted.countDown();
                      Thread.currentThread().interrupt();
                    }
                    return "late";
                  }));

      assertTrue(interrupted.await(2, TimeUnit.SECONDS));
      assertEquals("next", bounded.call("next_read", Duration.ofSeconds(2), () -> "next"));
    } finally {
      singleWorker.shutdownNow();
    }
  }
}
