package com.copytrading.infra.resilience.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class ErrorClassifierTest {
  @Test
  void shouldClassifyByExceptionFamily() {
    assertEquals(
        ErrorCategory.TRANSIENT_IO, ErrorClassifier.classify(new TransientIoException("timeout")));
    assertEquals(
        ErrorCategory.TRANSIENT_IO,
        ErrorClassifier.classify(new UncheckedIOException(new IOException("reset"))));
    assertEquals(
        ErrorCategory.VALIDATION, ErrorClassifier.classify(new IllegalArgumentException("amount")));
    assertEquals(ErrorCategory.INTERNAL, ErrorClassifier.classify(new NullPointerException()));
  }

  @Test
  void shouldWalkCauseChain() {
    RuntimeException wrapped =
        new IllegalStateException("outer", new TransientIoException("inner"));

    assertEquals(ErrorCategory.TRANSIENT_IO, ErrorClassifier.classify(wrapped));
  }

  @Test
  void shouldDescribeWithClassNameWhenMessageMissing() {
    assertEquals("NullPointerException", ErrorClassifier.describe(new NullPointerException()));
    assertEquals("boom", ErrorClassifier.describe(new IllegalStateException("boom")));
  }
}
