package com.copytrading.domain.risk;

public enum ActivationRule {
  DAILY_LOSS("daily_loss"),
  CONSECUTIVE_LOSSES("consecutive_losses"),
  MANUAL("manual");

  private final String metricTag;

  ActivationRule(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
