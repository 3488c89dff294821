package com.executionengine.infra.events;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Delivers each event to every registered sink, in registration order, on the caller thread. */
public class OrderEventBus {
  private static final Logger log = LoggerFactory.getLogger(OrderEventBus.class);

  private final List<EventSink> sinks = new CopyOnWriteArrayList<>();

  public void registerSink(EventSink sink) {
    sinks.add(Objects.requireNonNull(sink, "sink must not be null"));
  }

  public void emit(OrderEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    for (EventSink sink : sinks) {
      try {
        sink.onEvent(event);
      } catch (RuntimeException ex) {
        log.warn(
            "Event sink failed sink={} event={} orderId={}",
            sink.getClass().getSimpleName(),
            event.eventName(),
            event.orderId(),
            ex);
      }
    }
  }

  public int sinkCount() {
    return sinks.size();
  }
}
