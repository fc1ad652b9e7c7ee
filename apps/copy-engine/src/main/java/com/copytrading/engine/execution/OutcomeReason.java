package com.copytrading.engine.execution;

public enum OutcomeReason {
  NONE("none"),
  CIRCUIT_BREAKER_ACTIVE("circuit_breaker_active"),
  VALIDATION_ERROR("validation_error"),
  POSITION_ALREADY_OPEN("position_already_open"),
  MAX_POSITIONS_REACHED("max_positions_reached"),
  BALANCE_UNAVAILABLE("balance_unavailable"),
  ORDER_REJECTED("order_rejected"),
  INTERNAL_ERROR("internal_error");

  private final String metricTag;

  OutcomeReason(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
