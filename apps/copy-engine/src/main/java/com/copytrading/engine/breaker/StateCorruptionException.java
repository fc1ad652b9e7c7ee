package com.copytrading.engine.breaker;

import com.copytrading.infra.resilience.errors.ClassifiedException;
import com.copytrading.infra.resilience.errors.ErrorCategory;

/** The persisted breaker state exists but cannot be turned back into a valid snapshot. */
public class StateCorruptionException extends ClassifiedException {
  public StateCorruptionException(String message) {
    super(message);
  }

  public StateCorruptionException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorCategory category() {
    return ErrorCategory.STATE_CORRUPTION;
  }
}
