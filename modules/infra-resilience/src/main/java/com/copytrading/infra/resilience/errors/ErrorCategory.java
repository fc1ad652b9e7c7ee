package com.copytrading.infra.resilience.errors;

public enum ErrorCategory {
  VALIDATION("validation", false),
  TRANSIENT_IO("transient_io", true),
  STATE_CORRUPTION("state_corruption", false),
  INTERNAL("internal", false);

  private final String metricTag;
  private final boolean retryable;

  ErrorCategory(String metricTag, boolean retryable) {
    this.metricTag = metricTag;
    this.retryable = retryable;
  }

  public String metricTag() {
    return metricTag;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
