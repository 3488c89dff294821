package com.executionengine.execution.errors;

import java.time.Instant;

/**
 * Streaming has been disabled for the venue for the rest of the session. When the stream run had
 * already placed an order, {@link #placedOrderId()} names it and that order must be tracked over
 * REST rather than placed again.
 */
public class CircuitOpenException extends OrderExecutionException {
  private final int attempts;
  private final String placedOrderId;
  private final Instant placedAt;

  public CircuitOpenException(String venueId, String symbol, int attempts) {
    this(venueId, symbol, attempts, null, null);
  }

  public CircuitOpenException(
      String venueId, String symbol, int attempts, String placedOrderId, Instant placedAt) {
    super(
        "Stream circuit open venue=" + venueId + " attempts=" + attempts, venueId, symbol);
    this.attempts = attempts;
    this.placedOrderId = placedOrderId;
    this.placedAt = placedAt;
  }

  /** Copy of this error that also names the order placed before the circuit opened. */
  public CircuitOpenException withPlacedOrder(String orderId, Instant submittedAt) {
    return new CircuitOpenException(venueId(), symbol(), attempts, orderId, submittedAt);
  }

  public int attempts() {
    return attempts;
  }

  public boolean orderPlaced() {
    return placedOrderId != null;
  }

  public String placedOrderId() {
    return placedOrderId;
  }

  public Instant placedAt() {
    return placedAt;
  }
}
