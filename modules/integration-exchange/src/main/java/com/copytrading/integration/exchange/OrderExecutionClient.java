package com.copytrading.integration.exchange;

import com.copytrading.domain.positions.TradeSide;
import java.math.BigDecimal;

/**
 * Order-book client used by the copy engine. Implementations own the wire protocol; callers only
 * see decimals and the exception types declared here.
 */
public interface OrderExecutionClient {
  /**
   * Submits one order. Not idempotent: callers must not repeat it after a failure.
   *
   * @throws OrderException when the venue rejects or fails to acknowledge the order
   */
  OrderResult placeOrder(String marketId, TradeSide side, BigDecimal size, BigDecimal price);

  /**
   * @throws PriceUnavailableException when no price can be obtained for the market
   */
  BigDecimal getCurrentPrice(String marketId);

  /**
   * @throws ExchangeUnavailableException when the balance cannot be read
   */
  BigDecimal getAvailableBalance();
}
