package com.executionengine.integration.venue;

import java.math.BigDecimal;
import java.util.Objects;

public record OrderBookLevel(BigDecimal price, BigDecimal amount) {
  public OrderBookLevel {
    Objects.requireNonNull(price, "price must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
  }
}
