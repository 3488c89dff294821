package com.executionengine.infra.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.executionengine.domain.orders.OrderSide;
import com.executionengine.domain.orders.OrderState;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BatchSummarySinkTest {
  @Test
  void shouldCountOutcomesAndClearBuffer() {
    BatchSummarySink sink = new BatchSummarySink();
    sink.onEvent(
        event("ex-1", OrderState.FILLED, OrderEventNames.ORDER_FILL_COMPLETE, 120L, "0.5", "100"));
    sink.onEvent(
        event("unknown", OrderState.TIMED_OUT, OrderEventNames.ORDER_TIMEOUT_FALLBACK, 300000L, null, null));

    String summary = sink.flushSummary();

    assertTrue(summary.startsWith("=== Order Batch Summary ==="));
    assertTrue(summary.contains("filled: 1"));
    assertTrue(summary.contains("timeout: 1"));
    assertTrue(summary.contains("filled: 1  timeout: 1  rejected: 0  orphaned: 0"));
    assertTrue(summary.contains("[FILLED] BTC/USDT BUY order=ex-1 fill=0.5@100 latency=120ms"));
    assertEquals("", sink.flushSummary());
  }

  @Test
  void shouldMapFailedAndCancelledToRejectedAndOrphaned() {
    BatchSummarySink sink = new BatchSummarySink();
    sink.onEvent(event("ex-2", OrderState.FAILED, OrderEventNames.ORDER_FAILED, null, null, null));
    sink.onEvent(event("ex-3", OrderState.CANCELLED, "order_orphaned", null, null, null));
    sink.onEvent(event("ex-4", OrderState.SUBMITTED, OrderEventNames.ORDER_SUBMITTED, null, null, null));

    String summary = sink.flushSummary();

    assertTrue(summary.contains("filled: 0  timeout: 0  rejected: 1  orphaned: 1"));
    assertEquals(6, summary.split("\n").length);
    assertEquals(0, sink.pendingEvents());
  }

  @Test
  void shouldOmitFillAndLatencyWhenAbsent() {
    BatchSummarySink sink = new BatchSummarySink();
    sink.onEvent(event("ex-5", OrderState.FAILED, OrderEventNames.ORDER_FAILED, null, null, null));
    sink.onEvent(
        event("unknown", OrderState.TIMED_OUT, OrderEventNames.ORDER_TIMEOUT_FALLBACK, 900L, null, null));

    String[] lines = sink.flushSummary().split("\n");

    assertEquals("[FAILED] BTC/USDT BUY order=ex-5", lines[3]);
    assertEquals("[TIMED_OUT] BTC/USDT BUY order=unknown latency=900ms", lines[4]);
  }

  @Test
  void shouldReturnEmptyWhenNothingBuffered() {
    assertEquals("", new BatchSummarySink().flushSummary());
  }

  private static OrderEvent event(
      String orderId, OrderState state, String name, Long latency, String qty, String price) {
    return new OrderEvent(
        orderId,
        "binance",
        "BTC/USDT",
        OrderSide.BUY,
        state,
        Instant.parse("2026-03-01T00:00:00Z"),
        name,
        latency,
        price == null ? null : new BigDecimal(price),
        qty == null ? null : new BigDecimal(qty),
        Map.of());
  }
}
