package com.executionengine.integration.venue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Book snapshot with bids best-first (descending) and asks best-first (ascending). */
public record OrderBookSnapshot(
    String symbol, List<OrderBookLevel> bids, List<OrderBookLevel> asks, Instant timestamp) {
  public OrderBookSnapshot {
    Objects.requireNonNull(symbol, "symbol must not be null");
    bids = bids == null ? List.of() : List.copyOf(bids);
    asks = asks == null ? List.of() : List.copyOf(asks);
  }

  public boolean isEmpty() {
    return bids.isEmpty() || asks.isEmpty();
  }

  public Optional<BigDecimal> bestBid() {
    return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0).price());
  }

  public Optional<BigDecimal> bestAsk() {
    return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0).price());
  }
}
