package com.copytrading.integration.exchange;

import com.copytrading.infra.resilience.errors.TransientIoException;

public class ExchangeUnavailableException extends TransientIoException {
  public ExchangeUnavailableException(String message) {
    super(message);
  }

  public ExchangeUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
