package com.executionengine.infra.events.observability;

import com.executionengine.infra.events.OrderEvent;
import com.executionengine.infra.events.OrderEventNames;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerEventSink implements OrderEventTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerEventSink(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onEvent(OrderEvent event) {
    Counter.builder("execution.order.events.total")
        .description("Order lifecycle events by name and state")
        .tag("event", event.eventName())
        .tag("state", event.state().name())
        .tag("venue", safeValue(event.venueId()))
        .register(meterRegistry)
        .increment();

    if (OrderEventNames.ORDER_FILL_COMPLETE.equals(event.eventName())
        && event.latencyMs() != null) {
      Timer.builder("execution.order.fill.latency")
          .description("Time from submission to complete fill")
          .tag("venue", safeValue(event.venueId()))
          .register(meterRegistry)
          .record(Math.max(0L, event.latencyMs()), TimeUnit.MILLISECONDS);
    }
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}
