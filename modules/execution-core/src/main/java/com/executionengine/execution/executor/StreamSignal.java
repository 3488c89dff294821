package com.executionengine.execution.executor;

import com.executionengine.execution.errors.CircuitOpenException;
import com.executionengine.integration.venue.OrderBookSnapshot;
import com.executionengine.integration.venue.VenueOrder;
import java.util.List;

/** One wake-up of the streaming order loop. */
interface StreamSignal {
  record BookUpdate(OrderBookSnapshot snapshot) implements StreamSignal {}

  record OrderUpdates(List<VenueOrder> orders) implements StreamSignal {}

  record CircuitOpened(CircuitOpenException error) implements StreamSignal {}

  record SubscriptionRejected(String streamName, RuntimeException error) implements StreamSignal {}
}
