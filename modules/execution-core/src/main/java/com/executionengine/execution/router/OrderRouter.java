package com.executionengine.execution.router;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.domain.orders.OrderState;
import com.executionengine.domain.orders.OrdersToExecute;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.errors.CircuitOpenException;
import com.executionengine.execution.executor.OrderExecutor;
import com.executionengine.execution.executor.RestOrderExecutor;
import com.executionengine.execution.executor.StreamOrderExecutor;
import com.executionengine.execution.session.ExchangeSession;
import com.executionengine.infra.events.OrderEvent;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.OrderEventNames;
import com.executionengine.integration.venue.Venue;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a batch of orders to their venues. Sessions are initialised for every venue first, then
 * every order runs as its own task; a failing task resolves its own pairing and never affects
 * the rest of the batch.
 */
public class OrderRouter {
  private static final Logger log = LoggerFactory.getLogger(OrderRouter.class);

  private final ExecutorConfig config;
  private final OrderEventBus eventBus;
  private final Executor taskExecutor;
  private final OrderExecutor restExecutor;
  private final OrderExecutor streamExecutor;
  private final Clock clock;

  public OrderRouter(
      ExecutorConfig config,
      OrderEventBus eventBus,
      Executor taskExecutor,
      ExecutorService streamTaskExecutor) {
    this(
        config,
        eventBus,
        taskExecutor,
        new RestOrderExecutor(config, eventBus),
        new StreamOrderExecutor(config, eventBus, streamTaskExecutor),
        Clock.systemUTC());
  }

  public OrderRouter(
      ExecutorConfig config,
      OrderEventBus eventBus,
      Executor taskExecutor,
      OrderExecutor restExecutor,
      OrderExecutor streamExecutor,
      Clock clock) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
    this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor must not be null");
    this.restExecutor = Objects.requireNonNull(restExecutor, "restExecutor must not be null");
    this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public List<ExecutionReport> routeAndCollect(List<Venue> venues, OrdersToExecute orders) {
    return routeAndCollect(venues, orders, null);
  }

  /**
   * Executes every order and returns the reports that resolved. Orders without a venue, orders
   * that fail and orders that end without a report are resolved through their pairing instead.
   *
   * @param override replaces executor selection when not null
   */
  public List<ExecutionReport> routeAndCollect(
      List<Venue> venues, OrdersToExecute orders, OrderExecuteFunction override) {
    Objects.requireNonNull(venues, "venues must not be null");
    Objects.requireNonNull(orders, "orders must not be null");

    Map<String, Venue> venuesById = new LinkedHashMap<>();
    for (Venue venue : venues) {
      venuesById.putIfAbsent(venue.id(), venue);
    }

    Map<String, List<OrderRequest>> ordersByVenue = new LinkedHashMap<>();
    for (OrderRequest request : orders.all()) {
      if (!venuesById.containsKey(request.venueId())) {
        handleOrphan(request);
        continue;
      }
      ordersByVenue.computeIfAbsent(request.venueId(), id -> new ArrayList<>()).add(request);
    }
    if (ordersByVenue.isEmpty()) {
      return List.of();
    }

    Map<String, ExchangeSession> sessions = new LinkedHashMap<>();
    try {
      for (String venueId : ordersByVenue.keySet()) {
        sessions.put(
            venueId,
            new ExchangeSession(
                venuesById.get(venueId), config.maxConcurrentOrdersPerExchange()));
      }
      initializeSessions(sessions, ordersByVenue);
      return executeOrders(sessions, ordersByVenue, override);
    } finally {
      for (ExchangeSession session : sessions.values()) {
        session.close();
      }
    }
  }

  private void initializeSessions(
      Map<String, ExchangeSession> sessions, Map<String, List<OrderRequest>> ordersByVenue) {
    List<CompletableFuture<Void>> initializations = new ArrayList<>();
    for (Map.Entry<String, ExchangeSession> entry : sessions.entrySet()) {
      ExchangeSession session = entry.getValue();
      String firstSymbol = ordersByVenue.get(entry.getKey()).get(0).symbol();
      initializations.add(
          CompletableFuture.runAsync(() -> session.initialize(firstSymbol), taskExecutor)
              .exceptionally(
                  ex -> {
                    log.warn(
                        "Venue session initialisation failed venue={} symbol={} error={}",
                        session.venueId(),
                        firstSymbol,
                        ex.toString());
                    return null;
                  }));
    }
    CompletableFuture.allOf(initializations.toArray(new CompletableFuture[0])).join();
  }

  private List<ExecutionReport> executeOrders(
      Map<String, ExchangeSession> sessions,
      Map<String, List<OrderRequest>> ordersByVenue,
      OrderExecuteFunction override) {
    List<CompletableFuture<ExecutionReport>> tasks = new ArrayList<>();
    for (Map.Entry<String, List<OrderRequest>> entry : ordersByVenue.entrySet()) {
      ExchangeSession session = sessions.get(entry.getKey());
      for (OrderRequest request : entry.getValue()) {
        tasks.add(
            CompletableFuture.supplyAsync(
                    () -> executeOrder(session, request, override), taskExecutor)
                .exceptionally(
                    ex -> {
                      log.warn(
                          "Order execution failed venue={} symbol={} side={} error={}",
                          request.venueId(),
                          request.symbol(),
                          request.side(),
                          ex.toString());
                      request.pairing().notifyFailed();
                      return null;
                    }));
      }
    }
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

    List<ExecutionReport> reports = new ArrayList<>();
    for (CompletableFuture<ExecutionReport> task : tasks) {
      ExecutionReport report = task.join();
      if (report != null) {
        reports.add(report);
      }
    }
    log.info(
        "Batch routed venues={} orders={} reports={}",
        sessions.size(),
        tasks.size(),
        reports.size());
    return reports;
  }

  private ExecutionReport executeOrder(
      ExchangeSession session, OrderRequest request, OrderExecuteFunction override) {
    session.ensureMarginInitialized(request.symbol());
    ExecutionReport report =
        session.withOrderSlot(() -> runExecutor(session, request, override));
    return resolve(request, report);
  }

  private ExecutionReport runExecutor(
      ExchangeSession session, OrderRequest request, OrderExecuteFunction override) {
    if (override != null) {
      return override.execute(session, request);
    }
    if (!session.venue().streamingCapable() || session.isCircuitOpen()) {
      return restExecutor.execute(session, request);
    }
    try {
      return streamExecutor.execute(session, request);
    } catch (CircuitOpenException circuitOpen) {
      if (circuitOpen.orderPlaced()) {
        log.warn(
            "Streaming circuit open, tracking placed order over REST venue={} symbol={} orderId={} attempts={}",
            session.venueId(),
            request.symbol(),
            circuitOpen.placedOrderId(),
            circuitOpen.attempts());
        return restExecutor.resumePlacedOrder(
            session, request, circuitOpen.placedOrderId(), circuitOpen.placedAt());
      }
      log.warn(
          "Streaming circuit open, retrying order over REST venue={} symbol={} attempts={}",
          session.venueId(),
          request.symbol(),
          circuitOpen.attempts());
      return restExecutor.execute(session, request);
    }
  }

  private ExecutionReport resolve(OrderRequest request, ExecutionReport report) {
    if (report == null || report.status() == null || !report.status().isTerminal()) {
      log.warn(
          "Order ended without a terminal report venue={} symbol={} side={} status={}",
          request.venueId(),
          request.symbol(),
          request.side(),
          report == null ? null : report.status());
      request.pairing().notifyFailed();
      return null;
    }
    if (report.isFilled()) {
      request.pairing().notifyFilled();
    } else {
      request.pairing().notifyFailed();
    }
    return report;
  }

  private void handleOrphan(OrderRequest request) {
    log.warn(
        "Dropping order for unknown venue venue={} symbol={} side={} amount={}",
        request.venueId(),
        request.symbol(),
        request.side(),
        request.amount());
    request.pairing().notifyFailed();
    eventBus.emit(
        new OrderEvent(
            "unknown",
            request.venueId(),
            request.symbol(),
            request.side(),
            OrderState.CANCELLED,
            clock.instant(),
            OrderEventNames.ORDER_ORPHANED,
            null,
            null,
            request.amount(),
            Map.of("reason", "venue_not_configured")));
  }
}
