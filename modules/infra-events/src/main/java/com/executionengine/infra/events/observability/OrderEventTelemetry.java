package com.executionengine.infra.events.observability;

import com.executionengine.infra.events.EventSink;

/** Sink that turns lifecycle events into metrics. */
public interface OrderEventTelemetry extends EventSink {}
