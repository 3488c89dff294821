package com.executionengine.integration.venue;

import com.executionengine.domain.orders.OrderSide;
import com.executionengine.domain.orders.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** Order state as the venue reports it. Quantities may be null when the venue omits them. */
public record VenueOrder(
    String id,
    String symbol,
    OrderSide side,
    OrderStatus status,
    BigDecimal amount,
    BigDecimal filled,
    BigDecimal price,
    BigDecimal average,
    Instant timestamp) {
  public VenueOrder {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(status, "status must not be null");
  }

  public BigDecimal filledOrZero() {
    return filled == null ? BigDecimal.ZERO : filled;
  }

  public BigDecimal fillPrice() {
    return average != null ? average : price;
  }

  public boolean hasFills() {
    return filled != null && filled.signum() > 0;
  }
}
