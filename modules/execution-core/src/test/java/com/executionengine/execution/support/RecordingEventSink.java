package com.executionengine.execution.support;

import com.executionengine.infra.events.EventSink;
import com.executionengine.infra.events.OrderEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public final class RecordingEventSink implements EventSink {
  private final List<OrderEvent> events = new ArrayList<>();

  @Override
  public synchronized void onEvent(OrderEvent event) {
    events.add(event);
  }

  public synchronized List<OrderEvent> events() {
    return List.copyOf(events);
  }

  public synchronized List<String> names() {
    return events.stream().map(OrderEvent::eventName).collect(Collectors.toList());
  }

  public synchronized List<OrderEvent> named(String eventName) {
    return events.stream()
        .filter(event -> event.eventName().equals(eventName))
        .collect(Collectors.toList());
  }
}
