package com.copytrading.infra.resilience.errors;

/**
 * Network, rate-limit or disk failure on an operation that is safe to repeat. The only exception
 * family the default retry policies retry.
 */
public class TransientIoException extends ClassifiedException {
  public TransientIoException(String message) {
    super(message);
  }

  public TransientIoException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorCategory category() {
    return ErrorCategory.TRANSIENT_IO;
  }
}
