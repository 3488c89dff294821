package com.executionengine.infra.events.observability;

import com.executionengine.infra.events.OrderEvent;

public class NoOpEventSink implements OrderEventTelemetry {
  @Override
  public void onEvent(OrderEvent event) {}
}
