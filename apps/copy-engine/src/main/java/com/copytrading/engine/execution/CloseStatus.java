package com.copytrading.engine.execution;

public enum CloseStatus {
  CLOSED("closed"),
  NOT_FOUND("not_found"),
  CONDITION_CLEARED("condition_cleared"),
  FAILED("failed");

  private final String metricTag;

  CloseStatus(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
