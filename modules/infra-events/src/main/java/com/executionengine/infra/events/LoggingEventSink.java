package com.executionengine.infra.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingEventSink implements EventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

  @Override
  public void onEvent(OrderEvent event) {
    log.info(
        "Order event event_name={} order_id={} venue_id={} symbol={} side={} state={} timestamp={} latency_ms={} fill_price={} fill_qty={} context={}",
        event.eventName(),
        event.orderId(),
        event.venueId(),
        event.symbol(),
        event.side(),
        event.state(),
        event.timestamp().toEpochMilli(),
        event.latencyMs(),
        event.fillPrice(),
        event.fillQty(),
        event.context());
  }
}
