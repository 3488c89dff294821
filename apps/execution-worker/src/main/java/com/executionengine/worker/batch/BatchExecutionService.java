package com.executionengine.worker.batch;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrdersToExecute;
import com.executionengine.execution.router.OrderRouter;
import com.executionengine.infra.events.BatchSummarySink;
import com.executionengine.integration.venue.Venue;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for one batch: routes the orders, then reports how many filled together with the
 * per-event summary collected while the batch ran.
 */
public class BatchExecutionService {
  private static final Logger log = LoggerFactory.getLogger(BatchExecutionService.class);

  private final OrderRouter orderRouter;
  private final BatchSummarySink summarySink;
  private final BatchSummaryNotifier notifier;

  /** {@code summarySink} may be null when summaries are disabled. */
  public BatchExecutionService(
      OrderRouter orderRouter, BatchSummarySink summarySink, BatchSummaryNotifier notifier) {
    this.orderRouter = Objects.requireNonNull(orderRouter, "orderRouter must not be null");
    this.summarySink = summarySink;
    this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
  }

  public List<ExecutionReport> executeOrders(List<Venue> venues, OrdersToExecute orders) {
    if (orders == null || orders.isEmpty()) {
      log.info("Batch skipped, no orders to execute");
      return List.of();
    }
    List<ExecutionReport> reports = orderRouter.routeAndCollect(venues, orders);
    long filled = reports.stream().filter(ExecutionReport::isFilled).count();
    String headline = "filled " + filled + " out of " + orders.count() + " orders";
    log.info(
        "Batch complete filled={} submitted={} reports={}", filled, orders.count(), reports.size());

    String summary = summarySink == null ? "" : summarySink.flushSummary();
    try {
      notifier.send(summary.isEmpty() ? headline : headline + "\n\n" + summary);
    } catch (RuntimeException ex) {
      log.warn("Batch summary notification failed error={}", ex.toString());
    }
    return reports;
  }
}
