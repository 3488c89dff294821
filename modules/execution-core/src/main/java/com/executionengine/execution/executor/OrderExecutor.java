package com.executionengine.execution.executor;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.execution.session.ExchangeSession;
import java.time.Instant;

public interface OrderExecutor {
  ExecutionReport executeMakerOrder(ExchangeSession session, OrderRequest request);

  ExecutionReport executeTakerOrder(ExchangeSession session, OrderRequest request);

  /** Follows an order that is already on the venue until it ends; never places a new one. */
  ExecutionReport resumePlacedOrder(
      ExchangeSession session, OrderRequest request, String orderId, Instant submittedAt);

  default ExecutionReport execute(ExchangeSession session, OrderRequest request) {
    if (request.isTaker()) {
      return executeTakerOrder(session, request);
    }
    return executeMakerOrder(session, request);
  }
}
