package com.copytrading.integration.exchange;

public enum OrderResultStatus {
  ACCEPTED,
  PARTIALLY_FILLED,
  FILLED,
  REJECTED;

  public boolean isAccepted() {
    return this != REJECTED;
  }
}
