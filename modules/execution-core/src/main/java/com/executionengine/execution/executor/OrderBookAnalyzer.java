package com.executionengine.execution.executor;

import com.executionengine.domain.orders.OrderSide;
import com.executionengine.execution.config.ExecutionStrategy;
import com.executionengine.integration.venue.OrderBookLevel;
import com.executionengine.integration.venue.OrderBookSnapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class OrderBookAnalyzer {
  private final ExecutionStrategy strategy;

  public OrderBookAnalyzer(ExecutionStrategy strategy) {
    this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
  }

  /** Book depth to quote at. BEST_PRICE starts deep and walks toward the top as the order ages. */
  public int bestPriceIndex(Duration elapsed) {
    if (strategy == ExecutionStrategy.FAST) {
      return 0;
    }
    long seconds = elapsed.getSeconds();
    if (seconds < 10L) {
      return 5;
    }
    if (seconds < 30L) {
      return 4;
    }
    if (seconds < 60L) {
      return 3;
    }
    if (seconds < 120L) {
      return 2;
    }
    if (seconds < 180L) {
      return 1;
    }
    return 0;
  }

  /**
   * Returns a new target when there is no current price, when the target improves on it, or when
   * the current price has crossed the best level of its own side. Empty otherwise.
   */
  public Optional<OrderBookState> analyze(
      OrderBookSnapshot book, OrderSide side, BigDecimal currentPrice, Duration elapsed) {
    if (book == null || book.isEmpty()) {
      return Optional.empty();
    }
    BigDecimal bestBid = book.bids().get(0).price();
    BigDecimal bestAsk = book.asks().get(0).price();
    if (bestBid.signum() <= 0) {
      return Optional.empty();
    }
    BigDecimal spreadPct = bestAsk.subtract(bestBid).divide(bestBid, MathContext.DECIMAL64);
    int index = bestPriceIndex(elapsed);

    BigDecimal target;
    boolean update;
    if (side == OrderSide.BUY) {
      target = levelAt(book.bids(), index);
      update =
          currentPrice == null
              || target.compareTo(currentPrice) > 0
              || currentPrice.compareTo(bestBid) > 0;
    } else {
      target = levelAt(book.asks(), index);
      update =
          currentPrice == null
              || target.compareTo(currentPrice) < 0
              || currentPrice.compareTo(bestAsk) < 0;
    }
    if (!update) {
      return Optional.empty();
    }
    return Optional.of(new OrderBookState(target, spreadPct));
  }

  private static BigDecimal levelAt(List<OrderBookLevel> levels, int index) {
    return levels.get(Math.min(index, levels.size() - 1)).price();
  }
}
