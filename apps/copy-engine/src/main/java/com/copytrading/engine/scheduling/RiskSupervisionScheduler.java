package com.copytrading.engine.scheduling;

import com.copytrading.engine.breaker.CircuitBreaker;
import com.copytrading.engine.execution.TradeExecutionCoordinator;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Timer side of the risk core: breaker housekeeping, exit supervision of open positions and the
 * periodic health probe.
 */
@Component
@ConditionalOnProperty(
    prefix = "copytrading.scheduling",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RiskSupervisionScheduler {
  private static final Logger log = LoggerFactory.getLogger(RiskSupervisionScheduler.class);

  private final CircuitBreaker circuitBreaker;
  private final TradeExecutionCoordinator coordinator;
  private final AtomicBoolean supervisionInProgress = new AtomicBoolean(false);

  public RiskSupervisionScheduler(
      CircuitBreaker circuitBreaker, TradeExecutionCoordinator coordinator) {
    this.circuitBreaker = circuitBreaker;
    this.coordinator = coordinator;
  }

  @Scheduled(fixedDelayString = "${copytrading.breaker.check-interval-ms:60000}")
  public void runBreakerCheck() {
    circuitBreaker.periodicCheck();
  }

  @Scheduled(fixedDelayString = "${copytrading.execution.supervision-interval-ms:30000}")
  public void runPositionSupervision() {
    if (!supervisionInProgress.compareAndSet(false, true)) {
      log.info("Skipping position supervision because the previous pass is still running");
      return;
    }
    try {
      coordinator.managePositions();
    } catch (RuntimeException ex) {
      log.error("Position supervision pass failed", ex);
    } finally {
      supervisionInProgress.set(false);
    }
  }

  @Scheduled(fixedDelayString = "${copytrading.execution.health-check-interval-ms:60000}")
  public void runHealthCheck() {
    try {
      coordinator.healthCheck();
    } catch (RuntimeException ex) {
      log.error("Health check pass failed", ex);
    }
  }
}
