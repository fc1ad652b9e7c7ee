package com.copytrading.infra.resilience.errors;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

public final class ErrorClassifier {
  private ErrorClassifier() {}

  public static ErrorCategory classify(Throwable throwable) {
    Throwable candidate = throwable;
    while (candidate != null) {
      if (candidate instanceof ClassifiedException classified) {
        return classified.category();
      }
      if (candidate instanceof IOException
          || candidate instanceof UncheckedIOException
          || candidate instanceof TimeoutException) {
        return ErrorCategory.TRANSIENT_IO;
      }
      if (candidate instanceof IllegalArgumentException) {
        return ErrorCategory.VALIDATION;
      }
      candidate = candidate.getCause();
    }
    return ErrorCategory.INTERNAL;
  }

  public static String describe(Throwable throwable) {
    if (throwable == null) {
      return "unknown";
    }
    String message = throwable.getMessage();
    if (message == null || message.isBlank()) {
      return throwable.getClass().getSimpleName();
    }
    return message;
  }
}
