package com.copytrading.engine.breaker;

import com.copytrading.infra.resilience.errors.TransientIoException;

public class StateStoreException extends TransientIoException {
  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
