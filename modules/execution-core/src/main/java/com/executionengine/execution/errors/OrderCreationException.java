package com.executionengine.execution.errors;

public class OrderCreationException extends OrderExecutionException {
  public OrderCreationException(String message, String venueId, String symbol) {
    super(message, venueId, symbol);
  }

  public OrderCreationException(String message, String venueId, String symbol, Throwable cause) {
    super(message, venueId, symbol, cause);
  }
}
