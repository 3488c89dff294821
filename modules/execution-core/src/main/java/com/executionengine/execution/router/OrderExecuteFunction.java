package com.executionengine.execution.router;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.execution.session.ExchangeSession;

/** Caller-supplied replacement for executor selection. */
@FunctionalInterface
public interface OrderExecuteFunction {
  ExecutionReport execute(ExchangeSession session, OrderRequest request);
}
