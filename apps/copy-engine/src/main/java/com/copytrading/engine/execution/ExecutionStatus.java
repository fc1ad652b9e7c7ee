package com.copytrading.engine.execution;

public enum ExecutionStatus {
  SUBMITTED("submitted"),
  SKIPPED("skipped"),
  FAILED("failed");

  private final String metricTag;

  ExecutionStatus(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
