package com.copytrading.domain.positions;

public enum ExitReason {
  STOP_LOSS("stop_loss"),
  TAKE_PROFIT("take_profit"),
  TIME_EXIT("time_exit"),
  MANUAL("manual");

  private final String metricTag;

  ExitReason(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
