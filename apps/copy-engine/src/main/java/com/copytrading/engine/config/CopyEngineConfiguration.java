package com.copytrading.engine.config;

import com.copytrading.engine.breaker.CircuitBreaker;
import com.copytrading.engine.breaker.CircuitBreakerProperties;
import com.copytrading.engine.breaker.CircuitBreakerStateStore;
import com.copytrading.engine.breaker.JsonFileCircuitBreakerStateStore;
import com.copytrading.engine.execution.ConfiguredMarketCatalog;
import com.copytrading.engine.execution.CopyTradingProperties;
import com.copytrading.engine.execution.LoggingOrderExecutionClient;
import com.copytrading.engine.execution.PositionTable;
import com.copytrading.engine.execution.TradeExecutionCoordinator;
import com.copytrading.engine.notification.LoggingNotificationSink;
import com.copytrading.engine.notification.NotificationDispatcher;
import com.copytrading.engine.notification.NotificationSink;
import com.copytrading.infra.resilience.retry.RetryExecutor;
import com.copytrading.infra.resilience.timeout.BoundedCall;
import com.copytrading.integration.exchange.MarketCatalog;
import com.copytrading.integration.exchange.OrderExecutionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({CircuitBreakerProperties.class, CopyTradingProperties.class})
public class CopyEngineConfiguration {
  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  @ConditionalOnMissingBean(NotificationSink.class)
  NotificationSink loggingNotificationSink() {
    return new LoggingNotificationSink();
  }

  @Bean
  NotificationDispatcher notificationDispatcher(
      NotificationSink notificationSink, MeterRegistry meterRegistry) {
    return new NotificationDispatcher(notificationSink, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(CircuitBreakerStateStore.class)
  CircuitBreakerStateStore circuitBreakerStateStore(
      CircuitBreakerProperties properties, ObjectMapper objectMapper) {
    String stateFile = properties.getStateFile();
    if (stateFile == null || stateFile.isBlank()) {
      throw new IllegalArgumentException("copytrading.breaker.state-file must be configured");
    }
    return new JsonFileCircuitBreakerStateStore(Path.of(stateFile), objectMapper);
  }

  @Bean
  RetryExecutor breakerPersistRetryExecutor(
      CircuitBreakerProperties properties, MeterRegistry meterRegistry) {
    return new RetryExecutor(
        properties.getPersistRetry().toTransientOnlyPolicy(), meterRegistry);
  }

  @Bean
  RetryExecutor exchangeReadRetryExecutor(
      CopyTradingProperties properties, MeterRegistry meterRegistry) {
    return new RetryExecutor(properties.getReadRetry().toTransientOnlyPolicy(), meterRegistry);
  }

  @Bean
  CircuitBreaker circuitBreaker(
      CircuitBreakerProperties properties,
      CircuitBreakerStateStore stateStore,
      RetryExecutor breakerPersistRetryExecutor,
      NotificationDispatcher notificationDispatcher,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new CircuitBreaker(
        properties,
        stateStore,
        breakerPersistRetryExecutor,
        notificationDispatcher,
        meterRegistry,
        clock);
  }

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService exchangeReadExecutor(CopyTradingProperties copyTradingProperties) {
    AtomicInteger sequence = new AtomicInteger();
    return Executors.newFixedThreadPool(
        Math.max(1, copyTradingProperties.getReadThreads()),
        runnable -> {
          Thread thread = new Thread(runnable, "exchange-read-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  BoundedCall exchangeBoundedCall(ExecutorService exchangeReadExecutor) {
    return new BoundedCall(exchangeReadExecutor);
  }

  @Bean
  @ConditionalOnMissingBean(OrderExecutionClient.class)
  OrderExecutionClient loggingOrderExecutionClient(CopyTradingProperties properties) {
    return new LoggingOrderExecutionClient(properties.getPaperBalance());
  }

  @Bean
  @ConditionalOnMissingBean(MarketCatalog.class)
  MarketCatalog configuredMarketCatalog(CopyTradingProperties properties) {
    return new ConfiguredMarketCatalog(properties.getAllowedMarkets());
  }

  @Bean
  PositionTable positionTable() {
    return new PositionTable();
  }

  @Bean
  TradeExecutionCoordinator tradeExecutionCoordinator(
      CircuitBreaker circuitBreaker,
      OrderExecutionClient orderExecutionClient,
      MarketCatalog marketCatalog,
      PositionTable positionTable,
      CopyTradingProperties properties,
      RetryExecutor exchangeReadRetryExecutor,
      BoundedCall exchangeBoundedCall,
      NotificationDispatcher notificationDispatcher,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new TradeExecutionCoordinator(
        circuitBreaker,
        orderExecutionClient,
        marketCatalog,
        positionTable,
        properties,
        exchangeReadRetryExecutor,
        exchangeBoundedCall,
        notificationDispatcher,
        meterRegistry,
        clock);
  }
}
