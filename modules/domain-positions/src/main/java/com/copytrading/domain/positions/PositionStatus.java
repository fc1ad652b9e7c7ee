package com.copytrading.domain.positions;

public enum PositionStatus {
  PENDING,
  OPEN,
  CLOSING,
  CLOSED;

  public boolean isTerminal() {
    return this == CLOSED;
  }
}
