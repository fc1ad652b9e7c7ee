package com.copytrading.engine.execution;

import com.copytrading.domain.positions.ExitLevels;
import com.copytrading.domain.positions.ExitReason;
import com.copytrading.domain.positions.ExitRule;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionId;
import com.copytrading.domain.positions.PositionSizer;
import com.copytrading.domain.positions.PositionStatus;
import com.copytrading.domain.positions.SizingDecision;
import com.copytrading.domain.risk.TradeGateDecision;
import com.copytrading.engine.breaker.CircuitBreaker;
import com.copytrading.engine.breaker.CircuitBreakerStatus;
import com.copytrading.engine.notification.NotificationDispatcher;
import com.copytrading.engine.notification.NotificationEvent;
import com.copytrading.engine.notification.NotificationType;
import com.copytrading.infra.resilience.errors.ErrorCategory;
import com.copytrading.infra.resilience.errors.ErrorClassifier;
import com.copytrading.infra.resilience.retry.RetryExecutor;
import com.copytrading.infra.resilience.timeout.BoundedCall;
import com.copytrading.integration.exchange.ExchangeUnavailableException;
import com.copytrading.integration.exchange.MarketCatalog;
import com.copytrading.integration.exchange.OrderException;
import com.copytrading.integration.exchange.OrderExecutionClient;
import com.copytrading.integration.exchange.OrderResult;
import com.copytrading.integration.exchange.PriceUnavailableException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns trade signals into positions and closes positions whose exit condition fires.
 *
 * <p>Every entry and close of a position runs under that position's lock in {@link PositionTable},
 * so at most one order per position is in flight. Price and balance reads are bounded by a timeout
 * and retried on transient failures; order placement is never retried.
 */
public class TradeExecutionCoordinator {
  private static final Logger log = LoggerFactory.getLogger(TradeExecutionCoordinator.class);
  private static final String SIGNALS_COUNTER = "copytrading.execution.signals";
  private static final String CLOSED_COUNTER = "copytrading.positions.closed";
  private static final String OPEN_GAUGE = "copytrading.positions.open";
  private static final String PRICE_FETCH = "price_fetch";
  private static final String BALANCE_FETCH = "balance_fetch";
  private static final BigDecimal CROWDED_FACTOR = new BigDecimal("1.5");

  private final CircuitBreaker circuitBreaker;
  private final OrderExecutionClient client;
  private final PositionTable positions;
  private final TradeSignalValidator validator;
  private final PositionSizer sizer;
  private final ExitRule exitRule;
  private final CopyTradingProperties properties;
  private final RetryExecutor readRetryExecutor;
  private final BoundedCall boundedCall;
  private final NotificationDispatcher notifications;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final AtomicLong signalsReceived = new AtomicLong();
  private final AtomicLong submitted = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong positionsClosed = new AtomicLong();

  public TradeExecutionCoordinator(
      CircuitBreaker circuitBreaker,
      OrderExecutionClient client,
      MarketCatalog marketCatalog,
      PositionTable positions,
      CopyTradingProperties properties,
      RetryExecutor readRetryExecutor,
      BoundedCall boundedCall,
      NotificationDispatcher notifications,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.positions = Objects.requireNonNull(positions, "positions must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.readRetryExecutor =
        Objects.requireNonNull(readRetryExecutor, "readRetryExecutor must not be null");
    this.boundedCall = Objects.requireNonNull(boundedCall, "boundedCall must not be null");
    this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.validator =
        new TradeSignalValidator(
            marketCatalog,
            properties.getMinPrice(),
            properties.getMaxPrice(),
            properties.getMinConfidence(),
            clock);
    this.sizer = new PositionSizer(properties.toSizingLimits());
    this.exitRule = new ExitRule(properties.getMaxHoldingTime());
    Gauge.builder(OPEN_GAUGE, positions, PositionTable::openCount).register(meterRegistry);
  }

  /** Never throws: every failure is folded into the returned outcome. */
  public ExecutionOutcome executeCopyTrade(TradeSignal signal) {
    signalsReceived.incrementAndGet();
    String tradeId = signal == null ? "unknown" : signal.tradeIdOrUnknown();
    ExecutionOutcome outcome;
    try {
      outcome = execute(signal, tradeId);
    } catch (RuntimeException ex) {
      ErrorCategory category = ErrorClassifier.classify(ex);
      log.error(
          "Copy trade execution failed trade_id={} category={}",
          tradeId,
          category.metricTag(),
          ex);
      outcome =
          ExecutionOutcome.failed(
              tradeId, OutcomeReason.INTERNAL_ERROR, ErrorClassifier.describe(ex));
    }
    record(outcome);
    return outcome;
  }

  /**
   * One supervision pass over open positions. Prices are fetched once per market; a position
   * without a price is left alone until the next pass.
   */
  public SupervisionReport managePositions() {
    List<Position> open =
        positions.snapshot().stream().filter(p -> p.status() == PositionStatus.OPEN).toList();
    if (open.isEmpty()) {
      return SupervisionReport.EMPTY;
    }
    Map<String, Optional<BigDecimal>> prices = new LinkedHashMap<>();
    for (Position position : open) {
      prices.computeIfAbsent(position.marketId(), this::tryReadPrice);
    }

    int unpriced = 0;
    int closed = 0;
    int closeFailed = 0;
    for (Position position : open) {
      Optional<BigDecimal> price = prices.get(position.marketId());
      if (price.isEmpty()) {
        unpriced++;
        continue;
      }
      try {
        Optional<ExitReason> exit = exitRule.evaluate(position, price.get(), clock.instant());
        if (exit.isEmpty()) {
          continue;
        }
        CloseOutcome outcome = closeIfTriggered(position.id(), exit.get(), price.get());
        if (outcome.isClosed()) {
          closed++;
        } else if (outcome.status() == CloseStatus.FAILED) {
          closeFailed++;
        }
      } catch (RuntimeException ex) {
        closeFailed++;
        log.error("Position supervision failed position={}", position.id(), ex);
      }
    }
    SupervisionReport report = new SupervisionReport(open.size(), unpriced, closed, closeFailed);
    log.debug(
        "Position supervision pass evaluated={} unpriced={} closed={} close_failed={}",
        report.evaluated(),
        report.unpriced(),
        report.closed(),
        report.closeFailed());
    return report;
  }

  /** Closes a position at the current market price. Closing an absent position is a no-op. */
  public CloseOutcome closePosition(PositionId id, ExitReason reason) {
    Objects.requireNonNull(id, "id must not be null");
    ExitReason effectiveReason = reason == null ? ExitReason.MANUAL : reason;
    try {
      if (!positions.contains(id)) {
        return CloseOutcome.notFound(id, effectiveReason);
      }
      Optional<BigDecimal> price = tryReadPrice(id.marketId());
      if (price.isEmpty()) {
        return countClose(
            CloseOutcome.failed(id, effectiveReason, "price unavailable for " + id.marketId()));
      }
      return positions.withLock(
          id,
          () -> {
            Optional<Position> current = positions.find(id);
            if (current.isEmpty() || current.get().status() != PositionStatus.OPEN) {
              return CloseOutcome.notFound(id, effectiveReason);
            }
            return close(current.get(), effectiveReason, price.get());
          });
    } catch (RuntimeException ex) {
      log.error("Manual close failed position={}", id, ex);
      return countClose(CloseOutcome.failed(id, effectiveReason, ErrorClassifier.describe(ex)));
    }
  }

  public List<Position> openPositions() {
    return positions.snapshot();
  }

  public ExecutionStatistics statistics() {
    return new ExecutionStatistics(
        signalsReceived.get(),
        submitted.get(),
        skipped.get(),
        failed.get(),
        positionsClosed.get(),
        positions.openCount());
  }

  /**
   * Reads the balance the same way trade entry does and reports breaker and position pressure.
   * An unreadable balance yields an unhealthy report rather than an exception.
   */
  public HealthReport healthCheck() {
    List<String> warnings = new ArrayList<>();
    BigDecimal balance = null;
    try {
      balance = readBalance();
    } catch (RuntimeException ex) {
      warnings.add("balance unavailable: " + ErrorClassifier.describe(ex));
    }

    CircuitBreakerStatus breakerStatus = circuitBreaker.status();
    if (breakerStatus.active()) {
      warnings.add("circuit breaker active, recovery in " + breakerStatus.recoveryEta());
    }
    int open = positions.openCount();
    BigDecimal crowdedAt =
        BigDecimal.valueOf(properties.getMaxConcurrentPositions()).multiply(CROWDED_FACTOR);
    if (BigDecimal.valueOf(open).compareTo(crowdedAt) > 0) {
      warnings.add(
          "too many open positions ("
              + open
              + " > "
              + crowdedAt.stripTrailingZeros().toPlainString()
              + ")");
    }

    HealthReport report =
        new HealthReport(
            balance != null, balance, breakerStatus, open, warnings, clock.instant());
    if (!report.healthy()) {
      log.error("Health check failed warnings=\"{}\"", String.join("; ", warnings));
    } else if (!warnings.isEmpty()) {
      log.warn(
          "Health check passed with warnings balance={} open_positions={} warnings=\"{}\"",
          balance.toPlainString(),
          open,
          String.join("; ", warnings));
    } else {
      log.info(
          "Health check passed balance={} open_positions={} daily_loss={}",
          balance.toPlainString(),
          open,
          breakerStatus.dailyLoss().toPlainString());
    }
    return report;
  }

  private ExecutionOutcome execute(TradeSignal signal, String tradeId) {
    TradeGateDecision gate = circuitBreaker.checkTradeAllowed(tradeId);
    if (!gate.allowed()) {
      return ExecutionOutcome.blocked(tradeId, gate.reason(), gate.recoveryEta());
    }
    if (gate.degraded()) {
      log.warn("Circuit breaker degraded, continuing trade_id={} reason={}", tradeId, gate.reason());
    }

    List<String> violations = validator.validate(signal);
    if (!violations.isEmpty()) {
      String message = String.join("; ", violations);
      log.warn("Trade signal rejected trade_id={} violations=\"{}\"", tradeId, message);
      return ExecutionOutcome.skipped(tradeId, OutcomeReason.VALIDATION_ERROR, message);
    }

    PositionId id = new PositionId(signal.marketId(), signal.side());
    if (positions.contains(id)) {
      return ExecutionOutcome.skipped(
          tradeId, OutcomeReason.POSITION_ALREADY_OPEN, "position " + id + " already open");
    }
    if (positions.openCount() >= properties.getMaxConcurrentPositions()) {
      return ExecutionOutcome.skipped(
          tradeId,
          OutcomeReason.MAX_POSITIONS_REACHED,
          "max concurrent positions reached (" + properties.getMaxConcurrentPositions() + ")");
    }

    BigDecimal balance;
    try {
      balance = readBalance();
    } catch (RuntimeException ex) {
      if (!ErrorClassifier.classify(ex).isRetryable()) {
        throw ex;
      }
      log.warn("Balance unavailable trade_id={} error={}", tradeId, ErrorClassifier.describe(ex));
      return ExecutionOutcome.failed(
          tradeId, OutcomeReason.BALANCE_UNAVAILABLE, ErrorClassifier.describe(ex));
    }
    BigDecimal currentPrice = tryReadPrice(signal.marketId()).orElse(signal.price());
    ExitLevels levels =
        ExitLevels.around(
            signal.side(),
            signal.price(),
            properties.getStopLossFraction(),
            properties.getTakeProfitFraction());
    SizingDecision sizing =
        sizer.size(balance, signal.price(), levels.stopLossPrice(), currentPrice, signal.amount());
    log.debug(
        "Position sized trade_id={} size={} risk_budget={} price_risk={} unclamped={}",
        tradeId,
        sizing.size().toPlainString(),
        sizing.riskBudget().toPlainString(),
        sizing.priceRisk().toPlainString(),
        sizing.unclampedSize().toPlainString());

    return positions.withLock(id, () -> openUnderLock(id, signal, tradeId, sizing.size()));
  }

  private ExecutionOutcome openUnderLock(
      PositionId id, TradeSignal signal, String tradeId, BigDecimal size) {
    if (positions.contains(id)) {
      return ExecutionOutcome.skipped(
          tradeId, OutcomeReason.POSITION_ALREADY_OPEN, "position " + id + " already open");
    }
    OrderResult result;
    try {
      result = client.placeOrder(signal.marketId(), signal.side(), size, signal.price());
    } catch (OrderException ex) {
      log.warn(
          "Entry order rejected trade_id={} position={} code={} error={}",
          tradeId,
          id,
          ex.code(),
          ex.getMessage());
      return ExecutionOutcome.failed(tradeId, OutcomeReason.ORDER_REJECTED, ex.getMessage());
    }
    if (result == null || !result.isAccepted()) {
      String status = result == null ? "no result" : "status=" + result.status();
      log.warn("Entry order not accepted trade_id={} position={} {}", tradeId, id, status);
      return ExecutionOutcome.failed(tradeId, OutcomeReason.ORDER_REJECTED, status);
    }

    Instant now = clock.instant();
    BigDecimal entryPrice = result.filledPriceOr(signal.price());
    ExitLevels levels =
        ExitLevels.around(
            signal.side(),
            entryPrice,
            properties.getStopLossFraction(),
            properties.getTakeProfitFraction());
    Position position =
        Position.pending(id, tradeId, size, entryPrice, levels, now).opened(result.orderId(), now);
    positions.put(position);
    log.info(
        "Position opened trade_id={} position={} order_id={} size={} entry={} stop_loss={} take_profit={}",
        tradeId,
        id,
        result.orderId(),
        size.toPlainString(),
        entryPrice.toPlainString(),
        position.stopLossPrice().toPlainString(),
        position.takeProfitPrice().toPlainString());
    return ExecutionOutcome.submitted(tradeId, id, result.orderId(), size, entryPrice);
  }

  private CloseOutcome closeIfTriggered(PositionId id, ExitReason trigger, BigDecimal price) {
    return positions.withLock(
        id,
        () -> {
          Optional<Position> current = positions.find(id);
          if (current.isEmpty() || current.get().status() != PositionStatus.OPEN) {
            return CloseOutcome.notFound(id, trigger);
          }
          Optional<ExitReason> confirmed = exitRule.evaluate(current.get(), price, clock.instant());
          if (confirmed.isEmpty()) {
            return CloseOutcome.conditionCleared(id, trigger);
          }
          return close(current.get(), confirmed.get(), price);
        });
  }

  /** Runs under the position lock. A failed close order returns the position to OPEN. */
  private CloseOutcome close(Position position, ExitReason reason, BigDecimal price) {
    PositionId id = position.id();
    Position closing = position.transitionTo(PositionStatus.CLOSING, clock.instant());
    positions.put(closing);

    OrderResult result;
    try {
      result = client.placeOrder(id.marketId(), id.side().opposite(), position.size(), price);
    } catch (RuntimeException ex) {
      positions.put(closing.transitionTo(PositionStatus.OPEN, clock.instant()));
      circuitBreaker.recordTradeResult(false, position.tradeId());
      log.warn(
          "Close order failed position={} reason={} category={} error={}",
          id,
          reason.metricTag(),
          ErrorClassifier.classify(ex).metricTag(),
          ErrorClassifier.describe(ex));
      return countClose(CloseOutcome.failed(id, reason, ErrorClassifier.describe(ex)));
    }
    if (result == null || !result.isAccepted()) {
      positions.put(closing.transitionTo(PositionStatus.OPEN, clock.instant()));
      circuitBreaker.recordTradeResult(false, position.tradeId());
      String status = result == null ? "no result" : "status=" + result.status();
      log.warn("Close order not accepted position={} {}", id, status);
      return countClose(CloseOutcome.failed(id, reason, status));
    }

    BigDecimal exitPrice = result.filledPriceOr(price);
    BigDecimal pnl = position.realizedPnl(exitPrice);
    circuitBreaker.recordTradeResult(true, position.tradeId());
    if (pnl.signum() < 0) {
      circuitBreaker.recordLoss(pnl.negate());
    } else {
      circuitBreaker.recordProfit(pnl);
    }
    Position closed = closing.transitionTo(PositionStatus.CLOSED, clock.instant());
    positions.remove(id);
    positionsClosed.incrementAndGet();
    log.info(
        "Position closed position={} reason={} order_id={} entry={} exit={} pnl={} closed_at={}",
        id,
        reason.metricTag(),
        result.orderId(),
        closed.entryPrice().toPlainString(),
        exitPrice.toPlainString(),
        pnl.toPlainString(),
        closed.updatedAt());
    notifications.dispatch(
        new NotificationEvent(
            NotificationType.POSITION_CLOSED,
            "Position " + id + " closed (" + reason.metricTag() + ")",
            Map.of(
                "position", id.key(),
                "reason", reason.metricTag(),
                "exit_price", exitPrice.toPlainString(),
                "pnl", pnl.toPlainString()),
            clock.instant()));
    return countClose(CloseOutcome.closed(id, reason, result.orderId(), exitPrice, pnl));
  }

  private CloseOutcome countClose(CloseOutcome outcome) {
    meterRegistry
        .counter(
            CLOSED_COUNTER,
            "reason",
            outcome.reason() == null ? "none" : outcome.reason().metricTag(),
            "result",
            outcome.status().metricTag())
        .increment();
    return outcome;
  }

  private void record(ExecutionOutcome outcome) {
    meterRegistry
        .counter(
            SIGNALS_COUNTER,
            "outcome",
            outcome.status().metricTag(),
            "reason",
            outcome.reason().metricTag())
        .increment();
    if (outcome.status() == ExecutionStatus.SUBMITTED) {
      submitted.incrementAndGet();
      circuitBreaker.recordTradeResult(true, outcome.tradeId());
      notifications.dispatch(
          new NotificationEvent(
              NotificationType.TRADE_EXECUTED,
              "Copied trade " + outcome.tradeId() + " on " + outcome.positionId(),
              Map.of(
                  "trade_id", outcome.tradeId(),
                  "position", outcome.positionId().key(),
                  "order_id", outcome.orderId(),
                  "size", outcome.size().toPlainString(),
                  "entry_price", outcome.entryPrice().toPlainString()),
              clock.instant()));
    } else if (outcome.status() == ExecutionStatus.FAILED) {
      failed.incrementAndGet();
      circuitBreaker.recordTradeResult(false, outcome.tradeId());
    } else {
      skipped.incrementAndGet();
      log.info(
          "Trade skipped trade_id={} reason={} message=\"{}\"",
          outcome.tradeId(),
          outcome.reason().metricTag(),
          outcome.message());
    }
  }

  private Optional<BigDecimal> tryReadPrice(String marketId) {
    try {
      return Optional.of(readPrice(marketId));
    } catch (RuntimeException ex) {
      log.warn(
          "Price unavailable market={} category={} error={}",
          marketId,
          ErrorClassifier.classify(ex).metricTag(),
          ErrorClassifier.describe(ex));
      return Optional.empty();
    }
  }

  private BigDecimal readPrice(String marketId) {
    Duration timeout = properties.getReadTimeout();
    BigDecimal price =
        readRetryExecutor.execute(
            PRICE_FETCH,
            () -> boundedCall.call(PRICE_FETCH, timeout, () -> client.getCurrentPrice(marketId)));
    if (price == null || price.signum() <= 0) {
      throw new PriceUnavailableException(marketId, "no usable price for " + marketId);
    }
    return price;
  }

  private BigDecimal readBalance() {
    Duration timeout = properties.getReadTimeout();
    BigDecimal balance =
        readRetryExecutor.execute(
            BALANCE_FETCH,
            () -> boundedCall.call(BALANCE_FETCH, timeout, client::getAvailableBalance));
    if (balance == null) {
      throw new ExchangeUnavailableException("exchange returned no balance");
    }
    return balance;
  }
}
