package com.copytrading.engine.breaker;

import com.copytrading.engine.config.RetrySettings;
import com.copytrading.domain.risk.CircuitBreakerState;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "copytrading.breaker")
public class CircuitBreakerProperties {
  private BigDecimal maxDailyLoss = new BigDecimal("100");
  private int consecutiveLossThreshold = CircuitBreakerState.DEFAULT_CONSECUTIVE_LOSS_THRESHOLD;
  private Duration cooldown = Duration.ofHours(1);
  private String stateFile = "data/circuit_breaker_state.json";
  private long checkIntervalMs = 60_000L;
  private boolean alertOnActivation = true;
  private RetrySettings persistRetry = new RetrySettings();

  public BigDecimal getMaxDailyLoss() {
    return maxDailyLoss;
  }

  public void setMaxDailyLoss(BigDecimal maxDailyLoss) {
    this.maxDailyLoss = maxDailyLoss;
  }

  public int getConsecutiveLossThreshold() {
    return consecutiveLossThreshold;
  }

  public void setConsecutiveLossThreshold(int consecutiveLossThreshold) {
    this.consecutiveLossThreshold = consecutiveLossThreshold;
  }

  public Duration getCooldown() {
    return cooldown;
  }

  public void setCooldown(Duration cooldown) {
    this.cooldown = cooldown;
  }

  public String getStateFile() {
    return stateFile;
  }

  public void setStateFile(String stateFile) {
    this.stateFile = stateFile;
  }

  public long getCheckIntervalMs() {
    return checkIntervalMs;
  }

  public void setCheckIntervalMs(long checkIntervalMs) {
    this.checkIntervalMs = checkIntervalMs;
  }

  public boolean isAlertOnActivation() {
    return alertOnActivation;
  }

  public void setAlertOnActivation(boolean alertOnActivation) {
    this.alertOnActivation = alertOnActivation;
  }

  public RetrySettings getPersistRetry() {
    return persistRetry;
  }

  public void setPersistRetry(RetrySettings persistRetry) {
    this.persistRetry = persistRetry;
  }
}
