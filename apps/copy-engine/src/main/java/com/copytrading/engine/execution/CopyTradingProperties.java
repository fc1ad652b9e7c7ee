package com.copytrading.engine.execution;

import com.copytrading.domain.positions.SizingLimits;
import com.copytrading.engine.config.RetrySettings;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "copytrading.execution")
public class CopyTradingProperties {
  private BigDecimal minPositionSize = new BigDecimal("1");
  private BigDecimal maxPositionSize = new BigDecimal("100");
  private BigDecimal riskBudgetFraction = new BigDecimal("0.01");
  private BigDecimal priceRiskFloor = new BigDecimal("0.001");
  private BigDecimal copyRatio = new BigDecimal("0.1");
  private BigDecimal stopLossFraction = new BigDecimal("0.10");
  private BigDecimal takeProfitFraction = new BigDecimal("0.20");
  private Duration maxHoldingTime = Duration.ofHours(24);
  private int maxConcurrentPositions = 10;
  private BigDecimal minConfidence = BigDecimal.ZERO;
  private BigDecimal minPrice = new BigDecimal("0.01");
  private BigDecimal maxPrice = new BigDecimal("0.99");
  private List<String> allowedMarkets = new ArrayList<>();
  private Duration readTimeout = Duration.ofSeconds(5);
  private int readThreads = 4;
  private long supervisionIntervalMs = 30_000L;
  private long healthCheckIntervalMs = 60_000L;
  private BigDecimal paperBalance = new BigDecimal("1000");
  private RetrySettings readRetry = new RetrySettings();

  public BigDecimal getMinPositionSize() {
    return minPositionSize;
  }

  public void setMinPositionSize(BigDecimal minPositionSize) {
    this.minPositionSize = minPositionSize;
  }

  public BigDecimal getMaxPositionSize() {
    return maxPositionSize;
  }

  public void setMaxPositionSize(BigDecimal maxPositionSize) {
    this.maxPositionSize = maxPositionSize;
  }

  public BigDecimal getRiskBudgetFraction() {
    return riskBudgetFraction;
  }

  public void setRiskBudgetFraction(BigDecimal riskBudgetFraction) {
    this.riskBudgetFraction = riskBudgetFraction;
  }

  public BigDecimal getPriceRiskFloor() {
    return priceRiskFloor;
  }

  public void setPriceRiskFloor(BigDecimal priceRiskFloor) {
    this.priceRiskFloor = priceRiskFloor;
  }

  public BigDecimal getCopyRatio() {
    return copyRatio;
  }

  public void setCopyRatio(BigDecimal copyRatio) {
    this.copyRatio = copyRatio;
  }

  public BigDecimal getStopLossFraction() {
    return stopLossFraction;
  }

  public void setStopLossFraction(BigDecimal stopLossFraction) {
    this.stopLossFraction = stopLossFraction;
  }

  public BigDecimal getTakeProfitFraction() {
    return takeProfitFraction;
  }

  public void setTakeProfitFraction(BigDecimal takeProfitFraction) {
    this.takeProfitFraction = takeProfitFraction;
  }

  public Duration getMaxHoldingTime() {
    return maxHoldingTime;
  }

  public void setMaxHoldingTime(Duration maxHoldingTime) {
    this.maxHoldingTime = maxHoldingTime;
  }

  public int getMaxConcurrentPositions() {
    return maxConcurrentPositions;
  }

  public void setMaxConcurrentPositions(int maxConcurrentPositions) {
    this.maxConcurrentPositions = maxConcurrentPositions;
  }

  public BigDecimal getMinConfidence() {
    return minConfidence;
  }

  public void setMinConfidence(BigDecimal minConfidence) {
    this.minConfidence = minConfidence;
  }

  public BigDecimal getMinPrice() {
    return minPrice;
  }

  public void setMinPrice(BigDecimal minPrice) {
    this.minPrice = minPrice;
  }

  public BigDecimal getMaxPrice() {
    return maxPrice;
  }

  public void setMaxPrice(BigDecimal maxPrice) {
    this.maxPrice = maxPrice;
  }

  public List<String> getAllowedMarkets() {
    return allowedMarkets;
  }

  public void setAllowedMarkets(List<String> allowedMarkets) {
    this.allowedMarkets = allowedMarkets;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public int getReadThreads() {
    return readThreads;
  }

  public void setReadThreads(int readThreads) {
    this.readThreads = readThreads;
  }

  public long getSupervisionIntervalMs() {
    return supervisionIntervalMs;
  }

  public void setSupervisionIntervalMs(long supervisionIntervalMs) {
    this.supervisionIntervalMs = supervisionIntervalMs;
  }

  public long getHealthCheckIntervalMs() {
    return healthCheckIntervalMs;
  }

  public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
    this.healthCheckIntervalMs = healthCheckIntervalMs;
  }

  public BigDecimal getPaperBalance() {
    return paperBalance;
  }

  public void setPaperBalance(BigDecimal paperBalance) {
    this.paperBalance = paperBalance;
  }

  public RetrySettings getReadRetry() {
    return readRetry;
  }

  public void setReadRetry(RetrySettings readRetry) {
    this.readRetry = readRetry;
  }

  public SizingLimits toSizingLimits() {
    return new SizingLimits(
        minPositionSize, maxPositionSize, riskBudgetFraction, priceRiskFloor, copyRatio);
  }
}
