package com.copytrading.engine.execution;

import com.copytrading.domain.positions.TradeSide;
import com.copytrading.integration.exchange.OrderExecutionClient;
import com.copytrading.integration.exchange.OrderResult;
import com.copytrading.integration.exchange.OrderResultStatus;
import com.copytrading.integration.exchange.PriceUnavailableException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paper-trading client used when no venue client is wired. Orders fill at the requested price and
 * the last traded price per market is remembered for exit checks.
 */
public class LoggingOrderExecutionClient implements OrderExecutionClient {
  private static final Logger log = LoggerFactory.getLogger(LoggingOrderExecutionClient.class);

  private final BigDecimal paperBalance;
  private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

  public LoggingOrderExecutionClient(BigDecimal paperBalance) {
    this.paperBalance = Objects.requireNonNull(paperBalance, "paperBalance must not be null");
  }

  @Override
  public OrderResult placeOrder(String marketId, TradeSide side, BigDecimal size, BigDecimal price) {
    String orderId = "paper-" + UUID.randomUUID();
    lastPrices.put(marketId, price);
    log.info(
        "Paper order filled orderId={} market={} side={} size={} price={}",
        orderId,
        marketId,
        side,
        size.toPlainString(),
        price.toPlainString());
    return new OrderResult(orderId, price, OrderResultStatus.FILLED);
  }

  @Override
  public BigDecimal getCurrentPrice(String marketId) {
    BigDecimal price = lastPrices.get(marketId);
    if (price == null) {
      throw new PriceUnavailableException(marketId, "no paper price recorded for " + marketId);
    }
    return price;
  }

  @Override
  public BigDecimal getAvailableBalance() {
    return paperBalance;
  }
}
