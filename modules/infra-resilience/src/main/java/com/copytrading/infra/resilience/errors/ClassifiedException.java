package com.copytrading.infra.resilience.errors;

/** Base for exceptions that carry their own {@link ErrorCategory}. */
public abstract class ClassifiedException extends RuntimeException {
  protected ClassifiedException(String message) {
    super(message);
  }

  protected ClassifiedException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorCategory category();
}
