package com.executionengine.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record ExecutionReport(
    String exchangeOrderId,
    String symbol,
    OrderStatus status,
    BigDecimal amount,
    BigDecimal filled,
    BigDecimal remaining,
    BigDecimal averagePrice,
    BigDecimal lastPrice,
    String venueId,
    long fillLatencyMs,
    Instant timestamp) {
  public ExecutionReport {
    requireNonBlank(exchangeOrderId, "exchangeOrderId");
    requireNonBlank(symbol, "symbol");
    Objects.requireNonNull(status, "status must not be null");
    requireNonNegative(amount, "amount");
    requireNonNegative(filled, "filled");
    requireNonNegative(remaining, "remaining");
    if (filled.compareTo(amount) > 0) {
      throw new OrderDomainException("filled must not exceed amount");
    }
    if (remaining.compareTo(amount.subtract(filled)) != 0) {
      throw new OrderDomainException("remaining must equal amount - filled");
    }
    requireNonBlank(venueId, "venueId");
    if (fillLatencyMs < 0L) {
      throw new OrderDomainException("fillLatencyMs must be >= 0");
    }
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }

  /**
   * Builds a report from raw venue quantities. Filled is clamped to [0, amount] and remaining is
   * derived from it.
   */
  public static ExecutionReport of(
      String exchangeOrderId,
      String symbol,
      OrderStatus status,
      BigDecimal amount,
      BigDecimal filled,
      BigDecimal averagePrice,
      BigDecimal lastPrice,
      String venueId,
      long fillLatencyMs,
      Instant timestamp) {
    Objects.requireNonNull(amount, "amount must not be null");
    BigDecimal safeFilled = filled == null ? BigDecimal.ZERO : filled.max(BigDecimal.ZERO).min(amount);
    return new ExecutionReport(
        exchangeOrderId,
        symbol,
        status,
        amount,
        safeFilled,
        amount.subtract(safeFilled),
        averagePrice,
        lastPrice,
        venueId,
        Math.max(0L, fillLatencyMs),
        timestamp);
  }

  public boolean isFilled() {
    return status == OrderStatus.CLOSED;
  }

  private static void requireNonNegative(BigDecimal value, String fieldName) {
    if (value == null || value.signum() < 0) {
      throw new OrderDomainException(fieldName + " must be >= 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException(fieldName + " must not be blank");
    }
  }
}
