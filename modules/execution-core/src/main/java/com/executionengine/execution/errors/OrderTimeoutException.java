package com.executionengine.execution.errors;

public class OrderTimeoutException extends OrderExecutionException {
  public OrderTimeoutException(String message, String venueId, String symbol) {
    super(message, venueId, symbol);
  }

  public OrderTimeoutException(String message, String venueId, String symbol, Throwable cause) {
    super(message, venueId, symbol, cause);
  }
}
