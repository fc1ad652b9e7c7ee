package com.copytrading.engine.breaker;

import com.copytrading.domain.risk.ActivationRule;
import com.copytrading.domain.risk.CircuitBreakerState;
import com.copytrading.domain.risk.RecoveryEta;
import com.copytrading.domain.risk.TradeGateDecision;
import com.copytrading.engine.notification.NotificationDispatcher;
import com.copytrading.engine.notification.NotificationEvent;
import com.copytrading.engine.notification.NotificationType;
import com.copytrading.infra.resilience.errors.ErrorClassifier;
import com.copytrading.infra.resilience.retry.RetryExecutor;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trading halt switch. All mutations run under one lock, replace the immutable snapshot and persist
 * it before the lock is released. Notifications go out after the lock is dropped.
 *
 * <p>The gate fails open: if evaluating the breaker itself throws, trading is allowed and the
 * decision is flagged as degraded.
 */
public class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);
  private static final String CHECKS_COUNTER = "copytrading.breaker.checks";
  private static final String ACTIVATIONS_COUNTER = "copytrading.breaker.activations";
  private static final String PERSIST_FAILURES_COUNTER = "copytrading.breaker.persist.failures";
  private static final String ACTIVE_GAUGE = "copytrading.breaker.active";
  private static final String PERSIST_OPERATION = "breaker_state_persist";
  private static final String BLOCKED_PREFIX = "Circuit breaker: ";
  private static final String MANUAL_REASON = "Manual activation";

  private final ReentrantLock lock = new ReentrantLock();
  private final CircuitBreakerStateStore stateStore;
  private final RetryExecutor persistRetryExecutor;
  private final NotificationDispatcher notifications;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Duration cooldown;
  private final boolean alertOnActivation;
  private volatile CircuitBreakerState state;

  public CircuitBreaker(
      CircuitBreakerProperties properties,
      CircuitBreakerStateStore stateStore,
      RetryExecutor persistRetryExecutor,
      NotificationDispatcher notifications,
      MeterRegistry meterRegistry,
      Clock clock) {
    Objects.requireNonNull(properties, "properties must not be null");
    this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
    this.persistRetryExecutor =
        Objects.requireNonNull(persistRetryExecutor, "persistRetryExecutor must not be null");
    this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.cooldown = Objects.requireNonNull(properties.getCooldown(), "cooldown must not be null");
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException("copytrading.breaker.cooldown must not be negative");
    }
    this.alertOnActivation = properties.isAlertOnActivation();
    this.state = loadInitialState(properties);
    Gauge.builder(ACTIVE_GAUGE, this, breaker -> breaker.state.active() ? 1.0d : 0.0d)
        .register(meterRegistry);
  }

  /**
   * Gate consulted before every trade. Runs the day rollover and cooldown recovery first, so a
   * caller never sees an expired activation.
   */
  public TradeGateDecision checkTradeAllowed(String tradeId) {
    List<NotificationEvent> events = new ArrayList<>();
    TradeGateDecision decision;
    try {
      lock.lock();
      try {
        Instant now = clock.instant();
        CircuitBreakerState current = refresh(state, now, events);
        if (!current.active()) {
          decision = TradeGateDecision.allow();
        } else {
          decision =
              TradeGateDecision.blocked(
                  BLOCKED_PREFIX + current.reason(), current.remainingCooldown(now));
          log.warn(
              "Trade blocked by circuit breaker trade_id={} reason=\"{}\" eta=\"{}\"",
              tradeId,
              current.reason(),
              decision.recoveryEta());
        }
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException ex) {
      meterRegistry.counter(CHECKS_COUNTER, "outcome", "fail_open").increment();
      log.error(
          "Circuit breaker check failed, allowing trade trade_id={} category={}",
          tradeId,
          ErrorClassifier.classify(ex).metricTag(),
          ex);
      return TradeGateDecision.failOpen(ErrorClassifier.describe(ex));
    }
    meterRegistry
        .counter(CHECKS_COUNTER, "outcome", decision.allowed() ? "allowed" : "blocked")
        .increment();
    events.forEach(notifications::dispatch);
    return decision;
  }

  /** Adds a realized loss; the sign of {@code amount} is ignored. */
  public void recordLoss(BigDecimal amount) {
    if (amount == null) {
      log.warn("Ignoring loss without an amount");
      return;
    }
    List<NotificationEvent> events = new ArrayList<>();
    try {
      lock.lock();
      try {
        Instant now = clock.instant();
        CircuitBreakerState next = state.rolledOverTo(today(now)).withLoss(amount);
        if (!next.active()) {
          Optional<ActivationRule> rule = next.triggeredRule();
          if (rule.isPresent()) {
            next = activate(next, rule.get(), next.reasonFor(rule.get()), now, events);
          }
        }
        replace(next);
        log.info(
            "Loss recorded amount={} daily_loss={} max_daily_loss={} consecutive_losses={}",
            amount.abs().toPlainString(),
            next.dailyLoss().toPlainString(),
            next.maxDailyLoss().toPlainString(),
            next.consecutiveLosses());
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException ex) {
      log.error("Failed to record loss amount={}", amount, ex);
    }
    events.forEach(notifications::dispatch);
  }

  /** A profitable (or break-even) close ends the loss streak; the daily total is untouched. */
  public void recordProfit(BigDecimal amount) {
    try {
      lock.lock();
      try {
        CircuitBreakerState next = state.rolledOverTo(today(clock.instant())).withProfit();
        replace(next);
        log.info(
            "Profit recorded amount={} consecutive_losses={}",
            amount == null ? "n/a" : amount.toPlainString(),
            next.consecutiveLosses());
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException ex) {
      log.error("Failed to record profit amount={}", amount, ex);
    }
  }

  /** Execution telemetry only; the counters never trip the breaker. */
  public void recordTradeResult(boolean success, String tradeId) {
    try {
      lock.lock();
      try {
        CircuitBreakerState next =
            state.rolledOverTo(today(clock.instant())).withTradeResult(success);
        replace(next);
        if (!success) {
          log.debug(
              "Trade failure recorded trade_id={} failed_trades={} total_trades={}",
              tradeId,
              next.failedTrades(),
              next.totalTrades());
        }
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException ex) {
      log.error("Failed to record trade result trade_id={} success={}", tradeId, success, ex);
    }
  }

  /** Manual halt. Re-activating an active breaker keeps the original reason and cooldown. */
  public void activate(String reason) {
    String effectiveReason = reason == null || reason.isBlank() ? MANUAL_REASON : reason;
    List<NotificationEvent> events = new ArrayList<>();
    try {
      lock.lock();
      try {
        CircuitBreakerState current = state;
        if (current.active()) {
          log.info(
              "Circuit breaker already active reason=\"{}\" requested=\"{}\"",
              current.reason(),
              effectiveReason);
          return;
        }
        replace(
            activate(current, ActivationRule.MANUAL, effectiveReason, clock.instant(), events));
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException ex) {
      log.error("Failed to activate circuit breaker reason=\"{}\"", effectiveReason, ex);
    }
    events.forEach(notifications::dispatch);
  }

  /** Operator override: clears the activation, keeps the daily counters. */
  public void reset() {
    NotificationEvent event = null;
    try {
      lock.lock();
      try {
        CircuitBreakerState current = state;
        if (!current.active()) {
          log.info("Circuit breaker reset requested while inactive");
          return;
        }
        replace(current.cleared());
        log.info("Circuit breaker manually reset previous_reason=\"{}\"", current.reason());
        event =
            new NotificationEvent(
                NotificationType.CIRCUIT_BREAKER_RESET,
                "Circuit breaker manually reset",
                Map.of("previous_reason", current.reason()),
                clock.instant());
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException ex) {
      log.error("Failed to reset circuit breaker", ex);
    }
    notifications.dispatch(event);
  }

  /** Timer hook: day rollover and cooldown recovery without a trade in flight. */
  public void periodicCheck() {
    List<NotificationEvent> events = new ArrayList<>();
    try {
      lock.lock();
      try {
        refresh(state, clock.instant(), events);
      } finally {
        lock.unlock();
      }
    } catch (RuntimeException ex) {
      log.error("Circuit breaker periodic check failed", ex);
    }
    events.forEach(notifications::dispatch);
  }

  public CircuitBreakerState state() {
    return state;
  }

  public CircuitBreakerStatus status() {
    return CircuitBreakerStatus.of(state, clock.instant());
  }

  public boolean isActive() {
    return state.active();
  }

  public BigDecimal dailyLoss() {
    return state.dailyLoss();
  }

  public int consecutiveLosses() {
    return state.consecutiveLosses();
  }

  private CircuitBreakerState refresh(
      CircuitBreakerState current, Instant now, List<NotificationEvent> events) {
    CircuitBreakerState next = current.rolledOverTo(today(now));
    if (next != current) {
      log.info(
          "Daily risk counters reset previous_date={} date={} previous_daily_loss={}",
          current.lastResetDate(),
          next.lastResetDate(),
          current.dailyLoss().toPlainString());
    }
    if (next.isCooldownElapsed(now)) {
      log.info(
          "Circuit breaker recovered after cooldown reason=\"{}\" activated_at={}",
          next.reason(),
          next.activatedAt());
      events.add(
          new NotificationEvent(
              NotificationType.CIRCUIT_BREAKER_RECOVERED,
              "Circuit breaker deactivated after cooldown, trading resumed",
              Map.of("previous_reason", next.reason()),
              now));
      next = next.cleared();
    }
    if (next != current) {
      replace(next);
    }
    return next;
  }

  private CircuitBreakerState activate(
      CircuitBreakerState current,
      ActivationRule rule,
      String reason,
      Instant now,
      List<NotificationEvent> events) {
    CircuitBreakerState activated = current.activated(reason, now, cooldown);
    meterRegistry.counter(ACTIVATIONS_COUNTER, "rule", rule.metricTag()).increment();
    String eta = RecoveryEta.format(activated.remainingCooldown(now));
    log.warn(
        "Circuit breaker activated rule={} reason=\"{}\" cooldown_until={} daily_loss={} consecutive_losses={}",
        rule.metricTag(),
        reason,
        activated.cooldownUntil(),
        activated.dailyLoss().toPlainString(),
        activated.consecutiveLosses());
    if (alertOnActivation) {
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put("rule", rule.metricTag());
      attributes.put("reason", reason);
      attributes.put("daily_loss", activated.dailyLoss().toPlainString());
      attributes.put("max_daily_loss", activated.maxDailyLoss().toPlainString());
      attributes.put("consecutive_losses", Integer.toString(activated.consecutiveLosses()));
      attributes.put("cooldown_until", String.valueOf(activated.cooldownUntil()));
      attributes.put("recovery_eta", eta);
      events.add(
          new NotificationEvent(
              NotificationType.CIRCUIT_BREAKER_ACTIVATED,
              "Circuit breaker activated: " + reason + " (trading resumes in " + eta + ")",
              attributes,
              now));
    }
    return activated;
  }

  /** Must be called with the lock held. A failed write keeps the in-memory state authoritative. */
  private void replace(CircuitBreakerState next) {
    state = next;
    try {
      persistRetryExecutor.run(PERSIST_OPERATION, () -> stateStore.save(next));
    } catch (RuntimeException ex) {
      meterRegistry.counter(PERSIST_FAILURES_COUNTER).increment();
      log.error(
          "Failed to persist circuit breaker state active={} category={} error={}",
          next.active(),
          ErrorClassifier.classify(ex).metricTag(),
          ErrorClassifier.describe(ex),
          ex);
    }
  }

  private CircuitBreakerState loadInitialState(CircuitBreakerProperties properties) {
    Instant now = clock.instant();
    CircuitBreakerState defaults =
        CircuitBreakerState.initial(
            properties.getMaxDailyLoss(), properties.getConsecutiveLossThreshold(), today(now));
    CircuitBreakerState loaded;
    try {
      loaded = stateStore.load().orElse(null);
    } catch (StateCorruptionException ex) {
      log.error(
          "Circuit breaker state unreadable, starting from defaults error={}", ex.getMessage(), ex);
      loaded = null;
    } catch (RuntimeException ex) {
      log.error(
          "Circuit breaker state could not be loaded, starting from defaults category={}",
          ErrorClassifier.classify(ex).metricTag(),
          ex);
      loaded = null;
    }
    if (loaded == null) {
      log.info(
          "Circuit breaker initialised max_daily_loss={} consecutive_loss_threshold={} cooldown={}",
          defaults.maxDailyLoss().toPlainString(),
          defaults.consecutiveLossThreshold(),
          cooldown);
      lock.lock();
      try {
        replace(defaults);
      } finally {
        lock.unlock();
      }
      return defaults;
    }
    CircuitBreakerState configured =
        loaded
            .withLimits(properties.getMaxDailyLoss(), properties.getConsecutiveLossThreshold())
            .rolledOverTo(today(now));
    log.info(
        "Circuit breaker state loaded active={} reason=\"{}\" daily_loss={} consecutive_losses={} last_reset_date={}",
        configured.active(),
        configured.reason(),
        configured.dailyLoss().toPlainString(),
        configured.consecutiveLosses(),
        configured.lastResetDate());
    if (!configured.equals(loaded)) {
      lock.lock();
      try {
        replace(configured);
      } finally {
        lock.unlock();
      }
    }
    return configured;
  }

  private static LocalDate today(Instant now) {
    return LocalDate.ofInstant(now, ZoneOffset.UTC);
  }
}
