package com.copytrading.infra.resilience.timeout;

import com.copytrading.infra.resilience.errors.TransientIoException;
import java.time.Duration;

public class CallTimeoutException extends TransientIoException {
  public CallTimeoutException(String operationName, Duration timeout, Throwable cause) {
    super(operationName + " did not complete within " + timeout.toMillis() + "ms", cause);
  }
}
