package com.executionengine.domain.orders;

import java.util.Locale;

/** Status of an order as reported by the venue. */
public enum OrderStatus {
  OPEN,
  CLOSED,
  CANCELED,
  REJECTED,
  EXPIRED;

  public boolean isTerminal() {
    return this != OPEN;
  }

  public boolean isFailure() {
    return this == CANCELED || this == REJECTED || this == EXPIRED;
  }

  public static OrderStatus fromVenueValue(String value) {
    if (value == null || value.isBlank()) {
      throw new OrderDomainException("order status must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if ("CANCELLED".equals(normalized)) {
      return CANCELED;
    }
    try {
      return OrderStatus.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new OrderDomainException("Unknown order status: " + value);
    }
  }
}
