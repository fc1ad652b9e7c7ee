package com.copytrading.integration.exchange;

/** Order placement failed. Never retried automatically: a repeat could fill twice. */
public class OrderException extends RuntimeException {
  private final String code;

  public OrderException(String code, String message) {
    super(message);
    this.code = code;
  }

  public OrderException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String code() {
    return code;
  }
}
