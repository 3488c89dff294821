package com.executionengine.execution.errors;

public class OrderFetchException extends OrderExecutionException {
  public OrderFetchException(String message, String venueId, String symbol) {
    super(message, venueId, symbol);
  }

  public OrderFetchException(String message, String venueId, String symbol, Throwable cause) {
    super(message, venueId, symbol, cause);
  }
}
