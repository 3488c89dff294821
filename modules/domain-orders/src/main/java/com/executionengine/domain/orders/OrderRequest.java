package com.executionengine.domain.orders;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

public record OrderRequest(
    String symbol,
    OrderSide side,
    OrderType type,
    BigDecimal amount,
    BigDecimal price,
    ExecutionStyle executionStyle,
    String venueId,
    Map<String, Object> params,
    Pairing pairing,
    String notes) {
  public OrderRequest {
    requireNonBlank(symbol, "symbol");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(type, "type must not be null");
    requirePositive(amount, "amount");
    if (type == OrderType.MARKET && price != null) {
      throw new OrderDomainException("Market order price must be null");
    }
    if (price != null && price.signum() <= 0) {
      throw new OrderDomainException("price must be > 0");
    }
    Objects.requireNonNull(executionStyle, "executionStyle must not be null");
    requireNonBlank(venueId, "venueId");
    params = params == null ? Map.of() : Map.copyOf(params);
    pairing = pairing == null ? new Pairing() : pairing;
    notes = notes == null ? "" : notes;
  }

  public static OrderRequest limit(
      String venueId, String symbol, OrderSide side, BigDecimal amount, BigDecimal price) {
    return new OrderRequest(
        symbol,
        side,
        OrderType.LIMIT,
        amount,
        price,
        ExecutionStyle.MAKER,
        venueId,
        Map.of(),
        new Pairing(),
        "");
  }

  public static OrderRequest market(
      String venueId, String symbol, OrderSide side, BigDecimal amount) {
    return new OrderRequest(
        symbol,
        side,
        OrderType.MARKET,
        amount,
        null,
        ExecutionStyle.TAKER,
        venueId,
        Map.of(),
        new Pairing(),
        "");
  }

  /** Taker copy of this request sharing the same pairing handle. */
  public OrderRequest toMarketOrder() {
    return new OrderRequest(
        symbol,
        side,
        OrderType.MARKET,
        amount,
        null,
        ExecutionStyle.TAKER,
        venueId,
        params,
        pairing,
        notes);
  }

  public boolean isTaker() {
    return type == OrderType.MARKET || executionStyle == ExecutionStyle.TAKER;
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new OrderDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException(fieldName + " must not be blank");
    }
  }
}
