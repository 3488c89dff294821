package com.executionengine.infra.events;

@FunctionalInterface
public interface EventSink {
  void onEvent(OrderEvent event);
}
