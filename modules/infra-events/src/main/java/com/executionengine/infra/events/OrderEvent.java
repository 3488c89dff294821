package com.executionengine.infra.events;

import com.executionengine.domain.orders.OrderSide;
import com.executionengine.domain.orders.OrderState;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record OrderEvent(
    String orderId,
    String venueId,
    String symbol,
    OrderSide side,
    OrderState state,
    Instant timestamp,
    String eventName,
    Long latencyMs,
    BigDecimal fillPrice,
    BigDecimal fillQty,
    Map<String, String> context) {
  public OrderEvent {
    Objects.requireNonNull(orderId, "orderId must not be null");
    Objects.requireNonNull(venueId, "venueId must not be null");
    Objects.requireNonNull(symbol, "symbol must not be null");
    Objects.requireNonNull(state, "state must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    if (eventName == null || eventName.isBlank()) {
      throw new IllegalArgumentException("eventName must not be blank");
    }
    context = context == null ? Map.of() : Map.copyOf(context);
  }
}
