package com.executionengine.execution.executor;

import java.math.BigDecimal;
import java.util.Objects;

/** Target quote derived from a book snapshot, with the spread observed at the time. */
public record OrderBookState(BigDecimal price, BigDecimal spreadPct) {
  public OrderBookState {
    Objects.requireNonNull(price, "price must not be null");
    Objects.requireNonNull(spreadPct, "spreadPct must not be null");
  }
}
