package com.executionengine.infra.events;

import com.executionengine.domain.orders.OrderState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Buffers events for a chat-style batch digest. */
public class BatchSummarySink implements EventSink {
  private static final String HEADER = "=== Order Batch Summary ===";

  private final List<OrderEvent> buffer = new ArrayList<>();

  @Override
  public synchronized void onEvent(OrderEvent event) {
    buffer.add(event);
  }

  /** Renders and clears everything buffered so far; empty string when nothing was buffered. */
  public synchronized String flushSummary() {
    if (buffer.isEmpty()) {
      return "";
    }
    Map<String, Integer> counts = new LinkedHashMap<>();
    counts.put("filled", 0);
    counts.put("timeout", 0);
    counts.put("rejected", 0);
    counts.put("orphaned", 0);
    for (OrderEvent event : buffer) {
      String bucket = bucketOf(event.state());
      if (bucket != null) {
        counts.merge(bucket, 1, Integer::sum);
      }
    }

    List<String> lines = new ArrayList<>();
    lines.add(HEADER);
    lines.add(
        "filled: "
            + counts.get("filled")
            + "  timeout: "
            + counts.get("timeout")
            + "  rejected: "
            + counts.get("rejected")
            + "  orphaned: "
            + counts.get("orphaned"));
    lines.add("");
    for (OrderEvent event : buffer) {
      lines.add(renderLine(event));
    }
    buffer.clear();
    return String.join("\n", lines);
  }

  public synchronized int pendingEvents() {
    return buffer.size();
  }

  private static String bucketOf(OrderState state) {
    switch (state) {
      case FILLED:
        return "filled";
      case TIMED_OUT:
        return "timeout";
      case FAILED:
        return "rejected";
      case CANCELLED:
        return "orphaned";
      default:
        return null;
    }
  }

  private static String renderLine(OrderEvent event) {
    StringBuilder line =
        new StringBuilder()
            .append('[')
            .append(event.state())
            .append("] ")
            .append(event.symbol())
            .append(' ')
            .append(event.side())
            .append(" order=")
            .append(event.orderId());
    if (event.fillQty() != null && event.fillPrice() != null) {
      line.append(" fill=").append(event.fillQty()).append('@').append(event.fillPrice());
    }
    if (event.latencyMs() != null) {
      line.append(" latency=").append(event.latencyMs()).append("ms");
    }
    return line.toString();
  }
}
