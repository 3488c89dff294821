package com.executionengine.execution.errors;

public class OrderValidationException extends OrderExecutionException {
  public OrderValidationException(String message, String venueId, String symbol) {
    super(message, venueId, symbol);
  }

  public OrderValidationException(String message, String venueId, String symbol, Throwable cause) {
    super(message, venueId, symbol, cause);
  }
}
