package com.executionengine.execution.errors;

public class OrderExecutionException extends RuntimeException {
  private final String venueId;
  private final String symbol;

  public OrderExecutionException(String message, String venueId, String symbol) {
    super(message);
    this.venueId = venueId;
    this.symbol = symbol;
  }

  public OrderExecutionException(String message, String venueId, String symbol, Throwable cause) {
    super(message, cause);
    this.venueId = venueId;
    this.symbol = symbol;
  }

  public String venueId() {
    return venueId;
  }

  public String symbol() {
    return symbol;
  }
}
