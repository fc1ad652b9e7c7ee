package com.copytrading.engine.notification;

public enum NotificationType {
  CIRCUIT_BREAKER_ACTIVATED("breaker_activated"),
  CIRCUIT_BREAKER_RECOVERED("breaker_recovered"),
  CIRCUIT_BREAKER_RESET("breaker_reset"),
  TRADE_EXECUTED("trade_executed"),
  POSITION_CLOSED("position_closed");

  private final String metricTag;

  NotificationType(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
