package com.executionengine.execution.executor;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.domain.orders.OrderState;
import com.executionengine.domain.orders.OrderStateMachine;
import com.executionengine.domain.orders.OrderStatus;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.errors.OrderCreationException;
import com.executionengine.execution.errors.OrderExecutionException;
import com.executionengine.execution.errors.OrderFetchException;
import com.executionengine.execution.errors.OrderTimeoutException;
import com.executionengine.execution.rejection.RejectionClassifier;
import com.executionengine.execution.reprice.RepricePolicies;
import com.executionengine.execution.reprice.RepricePolicy;
import com.executionengine.execution.retry.Sleeper;
import com.executionengine.execution.session.ExchangeSession;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.OrderEventNames;
import com.executionengine.integration.venue.OrderBookSnapshot;
import com.executionengine.integration.venue.VenueClient;
import com.executionengine.integration.venue.VenueOrder;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request/response executor. Maker orders run a poll loop: create, monitor, cancel and replace
 * on reprice, and fall back to a market order on timeout or unrecoverable failure.
 */
public class RestOrderExecutor extends AbstractOrderExecutor {
  private static final Logger log = LoggerFactory.getLogger(RestOrderExecutor.class);

  public RestOrderExecutor(ExecutorConfig config, OrderEventBus eventBus) {
    this(
        config,
        eventBus,
        RepricePolicies.fromConfig(config),
        new RejectionClassifier(),
        Clock.systemUTC(),
        Sleeper.THREAD_SLEEPER);
  }

  public RestOrderExecutor(
      ExecutorConfig config,
      OrderEventBus eventBus,
      RepricePolicy repricePolicy,
      RejectionClassifier rejectionClassifier,
      Clock clock,
      Sleeper sleeper) {
    super(config, eventBus, repricePolicy, rejectionClassifier, clock, sleeper);
  }

  @Override
  public ExecutionReport executeTakerOrder(ExchangeSession session, OrderRequest request) {
    validateRequest(session, request);
    return placeTakerOrder(session, request);
  }

  @Override
  public ExecutionReport executeMakerOrder(ExchangeSession session, OrderRequest request) {
    validateRequest(session, request);
    Instant start = clock.instant();
    MakerProgress progress = new MakerProgress();
    cancelPendingOrders(session, request, null);

    boolean timedOut;
    try {
      return runMakerLoop(session, request, start, progress);
    } catch (OrderTimeoutException timeout) {
      timedOut = true;
    } catch (OrderFetchException fetchFailure) {
      log.warn(
          "Maker order lost track of status, switching to market order venue={} symbol={} orderId={} error={}",
          session.venueId(),
          request.symbol(),
          progress.orderId,
          fetchFailure.toString());
      timedOut = false;
    } catch (OrderExecutionException fatal) {
      cancelPendingOrders(session, request, progress.orderId);
      throw fatal;
    } catch (RuntimeException unexpected) {
      log.warn(
          "Maker order failed, switching to market order venue={} symbol={} orderId={}",
          session.venueId(),
          request.symbol(),
          progress.orderId,
          unexpected);
      timedOut = false;
    }

    cancelPendingOrders(session, request, progress.orderId);
    progress.orderId = null;
    if (timedOut) {
      return executeTakerFallback(session, request, start);
    }
    return placeTakerOrder(session, request.toMarketOrder());
  }

  private ExecutionReport runMakerLoop(
      ExchangeSession session, OrderRequest request, Instant start, MakerProgress progress) {
    while (true) {
      Duration elapsed = checkTimeout(session, request, start);
      switch (progress.state) {
        case CREATING_ORDER:
          createLimitOrder(session, request, elapsed, progress);
          break;
        case MONITORING_ORDER:
          ExecutionReport report = monitorOrder(session, request, elapsed, progress);
          if (report != null) {
            return report;
          }
          break;
        case UPDATING_ORDER:
          cancelForReprice(session, request, progress);
          break;
        case WAIT_UNTIL_ORDER_CANCELLED:
          progress.moveTo(OrderState.CREATING_ORDER);
          break;
        default:
          throw new IllegalStateException("Unexpected maker state " + progress.state);
      }
      sleep(session, request, pollInterval(elapsed));
    }
  }

  private void createLimitOrder(
      ExchangeSession session, OrderRequest request, Duration elapsed, MakerProgress progress) {
    VenueClient client = session.venue().client();
    OrderBookSnapshot book;
    try {
      book = client.fetchOrderBook(request.symbol());
    } catch (RuntimeException ex) {
      handleCreationFailure(session, request, ex, "fetch_order_book");
      return;
    }
    Optional<OrderBookState> next = analyzeOrderBook(book, request, progress.bookState, elapsed);
    if (next.isPresent()) {
      progress.bookState = next.get();
    }
    if (progress.bookState == null) {
      return;
    }
    if (!spreadAcceptable(progress.bookState)) {
      log.debug(
          "Spread too wide venue={} symbol={} spreadPct={} maxSpreadPct={}",
          session.venueId(),
          request.symbol(),
          progress.bookState.spreadPct(),
          config.maxSpreadPct());
      return;
    }

    BigDecimal price = progress.bookState.price();
    VenueOrder created;
    try {
      created =
          client.createLimitOrder(
              request.symbol(), request.side(), request.amount(), price, request.params());
    } catch (RuntimeException ex) {
      handleCreationFailure(session, request, ex, "create_limit_order");
      return;
    }
    progress.orderId = created.id();
    progress.submittedAt = clock.instant();
    progress.lastFilled = BigDecimal.ZERO;
    emit(
        session,
        request,
        created.id(),
        OrderState.SUBMITTED,
        OrderEventNames.ORDER_SUBMITTED,
        progress.submittedAt,
        price,
        request.amount(),
        Map.of("type", "limit"));
    progress.moveTo(OrderState.MONITORING_ORDER);
  }

  private ExecutionReport monitorOrder(
      ExchangeSession session, OrderRequest request, Duration elapsed, MakerProgress progress) {
    VenueOrder order = fetchOrderWithBackoff(session, request, progress.orderId);
    if (order.status() == OrderStatus.CLOSED) {
      emitFillComplete(session, request, order, progress.submittedAt);
      return buildExecutionReport(session, request, order, progress.submittedAt);
    }
    if (order.status().isFailure()) {
      emitOrderFailed(session, request, order.id(), progress.submittedAt, order.status().name());
      log.info(
          "Maker order ended without fill, placing again venue={} symbol={} orderId={} status={}",
          session.venueId(),
          request.symbol(),
          order.id(),
          order.status());
      progress.orderId = null;
      progress.moveTo(OrderState.CREATING_ORDER);
      return null;
    }
    if (order.hasFills() && order.filled().compareTo(progress.lastFilled) > 0) {
      progress.lastFilled = order.filled();
      emit(
          session,
          request,
          order.id(),
          OrderState.PARTIALLY_FILLED,
          OrderEventNames.ORDER_FILL_PARTIAL,
          progress.submittedAt,
          order.fillPrice(),
          order.filled(),
          Map.of());
    }

    OrderBookSnapshot book;
    try {
      book = session.venue().client().fetchOrderBook(request.symbol());
    } catch (RuntimeException ex) {
      log.debug(
          "Book refresh failed venue={} symbol={} error={}",
          session.venueId(),
          request.symbol(),
          ex.toString());
      return null;
    }
    Optional<OrderBookState> next = analyzeOrderBook(book, request, progress.bookState, elapsed);
    if (next.isPresent()
        && progress.bookState != null
        && checkShouldReprice(
            session,
            request,
            progress.orderId,
            progress.submittedAt,
            progress.bookState.price(),
            next.get().price(),
            elapsed)) {
      progress.bookState = next.get();
      progress.moveTo(OrderState.UPDATING_ORDER);
    }
    return null;
  }

  private void cancelForReprice(
      ExchangeSession session, OrderRequest request, MakerProgress progress) {
    try {
      session.venue().client().cancelOrder(progress.orderId, request.symbol());
    } catch (RuntimeException ex) {
      log.warn(
          "Cancel for reprice failed, resuming monitoring venue={} symbol={} orderId={} error={}",
          session.venueId(),
          request.symbol(),
          progress.orderId,
          ex.toString());
      progress.moveTo(OrderState.MONITORING_ORDER);
      return;
    }
    progress.orderId = null;
    progress.moveTo(OrderState.WAIT_UNTIL_ORDER_CANCELLED);
  }

  private void handleCreationFailure(
      ExchangeSession session, OrderRequest request, RuntimeException ex, String step) {
    if (rejectionClassifier.isFatal(ex)) {
      request.pairing().notifyFailed();
      emitOrderFailed(session, request, null, null, ex.getClass().getSimpleName());
      throw new OrderCreationException(
          "Order rejected by venue at " + step, session.venueId(), request.symbol(), ex);
    }
    log.warn(
        "Order creation step failed, will retry venue={} symbol={} step={} error={}",
        session.venueId(),
        request.symbol(),
        step,
        ex.toString());
  }

  private static final class MakerProgress {
    private OrderState state = OrderState.CREATING_ORDER;
    private String orderId;
    private Instant submittedAt;
    private OrderBookState bookState;
    private BigDecimal lastFilled = BigDecimal.ZERO;

    private void moveTo(OrderState next) {
      OrderStateMachine.validateTransition(state, next);
      state = next;
    }
  }
}
