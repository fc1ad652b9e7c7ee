package com.copytrading.domain.risk;

public class RiskDomainException extends RuntimeException {
  public RiskDomainException(String message) {
    super(message);
  }
}
