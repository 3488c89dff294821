package com.executionengine.execution.executor;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.domain.orders.OrderState;
import com.executionengine.domain.orders.OrderStatus;
import com.executionengine.domain.orders.OrderType;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.errors.OrderCreationException;
import com.executionengine.execution.errors.OrderExecutionException;
import com.executionengine.execution.errors.OrderFetchException;
import com.executionengine.execution.errors.OrderTimeoutException;
import com.executionengine.execution.errors.OrderValidationException;
import com.executionengine.execution.rejection.RejectionClassifier;
import com.executionengine.execution.reprice.RepricePolicy;
import com.executionengine.execution.retry.BackoffRetryExecutor;
import com.executionengine.execution.retry.ExponentialBackoff;
import com.executionengine.execution.retry.Sleeper;
import com.executionengine.execution.session.ExchangeSession;
import com.executionengine.infra.events.OrderEvent;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.OrderEventNames;
import com.executionengine.integration.venue.OrderBookSnapshot;
import com.executionengine.integration.venue.VenueClient;
import com.executionengine.integration.venue.VenueOrder;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for both transports: request validation, book analysis, event emission, the
 * REST taker routine used for timeouts, and best-effort cancellation.
 */
public abstract class AbstractOrderExecutor implements OrderExecutor {
  private static final Logger log = LoggerFactory.getLogger(AbstractOrderExecutor.class);

  static final String UNKNOWN_ORDER_ID = "unknown";
  static final Duration FAST_POLL_WINDOW = Duration.ofSeconds(10);
  static final Duration FAST_POLL_INTERVAL = Duration.ofMillis(200);
  static final Duration SLOW_POLL_INTERVAL = Duration.ofSeconds(1);
  static final int MAX_FETCH_FAILURES = 4;
  static final int MAX_CREATE_ATTEMPTS = 3;

  private static final ExponentialBackoff FETCH_BACKOFF = new ExponentialBackoff(500L, 4_000L);

  protected final ExecutorConfig config;
  protected final OrderEventBus eventBus;
  protected final RepricePolicy repricePolicy;
  protected final RejectionClassifier rejectionClassifier;
  protected final OrderBookAnalyzer bookAnalyzer;
  protected final Clock clock;
  protected final Sleeper sleeper;

  protected AbstractOrderExecutor(
      ExecutorConfig config,
      OrderEventBus eventBus,
      RepricePolicy repricePolicy,
      RejectionClassifier rejectionClassifier,
      Clock clock,
      Sleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
    this.repricePolicy = Objects.requireNonNull(repricePolicy, "repricePolicy must not be null");
    this.rejectionClassifier =
        Objects.requireNonNull(rejectionClassifier, "rejectionClassifier must not be null");
    this.bookAnalyzer = new OrderBookAnalyzer(config.execution());
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  protected void validateRequest(ExchangeSession session, OrderRequest request) {
    if (request.amount() == null || request.amount().signum() <= 0) {
      throw new OrderValidationException(
          "Order amount must be > 0", session.venueId(), request.symbol());
    }
    if (request.type() == OrderType.LIMIT
        && (request.price() == null || request.price().signum() <= 0)) {
      throw new OrderValidationException(
          "Limit order requires a price > 0", session.venueId(), request.symbol());
    }
  }

  protected Optional<OrderBookState> analyzeOrderBook(
      OrderBookSnapshot book, OrderRequest request, OrderBookState current, Duration elapsed) {
    BigDecimal currentPrice = current == null ? null : current.price();
    return bookAnalyzer.analyze(book, request.side(), currentPrice, elapsed);
  }

  protected boolean spreadAcceptable(OrderBookState state) {
    return state.spreadPct().compareTo(config.maxSpreadPct()) <= 0;
  }

  /** Consults the reprice policy and records the decision as an event. */
  protected boolean checkShouldReprice(
      ExchangeSession session,
      OrderRequest request,
      String orderId,
      Instant submittedAt,
      BigDecimal oldPrice,
      BigDecimal newPrice,
      Duration elapsed) {
    if (repricePolicy.shouldReprice(oldPrice, newPrice, elapsed)) {
      emit(
          session,
          request,
          orderId,
          OrderState.UPDATING_ORDER,
          OrderEventNames.ORDER_REPRICED,
          submittedAt,
          newPrice,
          oldPrice,
          Map.of("old_price", oldPrice.toPlainString(), "new_price", newPrice.toPlainString()));
      return true;
    }
    String changePct =
        oldPrice.signum() == 0
            ? "inf"
            : newPrice
                .subtract(oldPrice)
                .abs()
                .divide(oldPrice.abs(), MathContext.DECIMAL64)
                .toPlainString();
    String thresholdPct = config.minRepriceThresholdPct().toPlainString();
    log.debug(
        "Reprice suppressed venue={} symbol={} orderId={} oldPrice={} newPrice={} change_pct={} threshold_pct={}",
        session.venueId(),
        request.symbol(),
        orderId,
        oldPrice,
        newPrice,
        changePct,
        thresholdPct);
    emit(
        session,
        request,
        orderId,
        OrderState.MONITORING_ORDER,
        OrderEventNames.ORDER_REPRICE_SUPPRESSED,
        submittedAt,
        null,
        null,
        Map.of("change_pct", changePct, "threshold_pct", thresholdPct));
    return false;
  }

  protected void emit(
      ExchangeSession session,
      OrderRequest request,
      String orderId,
      OrderState state,
      String eventName,
      Instant submittedAt,
      BigDecimal fillPrice,
      BigDecimal fillQty,
      Map<String, String> context) {
    Instant now = clock.instant();
    Long latencyMs =
        submittedAt == null ? null : Math.max(0L, Duration.between(submittedAt, now).toMillis());
    eventBus.emit(
        new OrderEvent(
            orderId == null ? UNKNOWN_ORDER_ID : orderId,
            session.venueId(),
            request.symbol(),
            request.side(),
            state,
            now,
            eventName,
            latencyMs,
            fillPrice,
            fillQty,
            context));
  }

  protected void emitFillComplete(
      ExchangeSession session, OrderRequest request, VenueOrder order, Instant submittedAt) {
    emit(
        session,
        request,
        order.id(),
        OrderState.FILLED,
        OrderEventNames.ORDER_FILL_COMPLETE,
        submittedAt,
        order.fillPrice(),
        order.filled(),
        Map.of());
  }

  protected void emitOrderFailed(
      ExchangeSession session,
      OrderRequest request,
      String orderId,
      Instant submittedAt,
      String reason) {
    emit(
        session,
        request,
        orderId,
        OrderState.FAILED,
        OrderEventNames.ORDER_FAILED,
        submittedAt,
        null,
        null,
        Map.of("reason", reason));
  }

  /** Market order over REST after a maker attempt ran out of time. */
  protected ExecutionReport executeTakerFallback(
      ExchangeSession session, OrderRequest request, Instant makerStartedAt) {
    emit(
        session,
        request,
        null,
        OrderState.TIMED_OUT,
        OrderEventNames.ORDER_TIMEOUT_FALLBACK,
        makerStartedAt,
        null,
        null,
        Map.of());
    log.info(
        "Maker order timed out, falling back to market order venue={} symbol={} side={} amount={}",
        session.venueId(),
        request.symbol(),
        request.side(),
        request.amount());
    return placeTakerOrder(session, request.toMarketOrder());
  }

  /**
   * Places a market order over REST, retrying creation, then polls until the venue reports a
   * terminal status.
   */
  protected ExecutionReport placeTakerOrder(ExchangeSession session, OrderRequest request) {
    Instant start = clock.instant();
    VenueOrder created = createMarketOrder(session, request, start);
    Instant submittedAt = clock.instant();
    emit(
        session,
        request,
        created.id(),
        OrderState.SUBMITTED,
        OrderEventNames.ORDER_SUBMITTED,
        submittedAt,
        null,
        request.amount(),
        Map.of("type", "market"));

    VenueOrder current = created;
    while (!current.status().isTerminal()) {
      Duration elapsed = checkTimeout(session, request, start);
      sleep(session, request, pollInterval(elapsed));
      current = fetchOrderWithBackoff(session, request, created.id());
    }
    if (current.status() == OrderStatus.CLOSED) {
      emitFillComplete(session, request, current, submittedAt);
    } else {
      emitOrderFailed(session, request, current.id(), submittedAt, current.status().name());
    }
    return buildExecutionReport(session, request, current, submittedAt);
  }

  /**
   * Polls an order placed by another transport until it reaches a terminal status. At the
   * deadline the order is cancelled; a maker order with nothing filled then falls back to a
   * market order.
   */
  @Override
  public ExecutionReport resumePlacedOrder(
      ExchangeSession session, OrderRequest request, String orderId, Instant submittedAt) {
    Objects.requireNonNull(orderId, "orderId must not be null");
    Instant start = submittedAt == null ? clock.instant() : submittedAt;
    log.info(
        "Tracking placed order over REST venue={} symbol={} orderId={}",
        session.venueId(),
        request.symbol(),
        orderId);
    VenueOrder current = fetchOrderWithBackoff(session, request, orderId);
    try {
      while (!current.status().isTerminal()) {
        Duration elapsed = checkTimeout(session, request, start);
        sleep(session, request, pollInterval(elapsed));
        current = fetchOrderWithBackoff(session, request, orderId);
      }
    } catch (OrderTimeoutException timeout) {
      cancelQuietly(session, request, orderId);
      current = fetchOrderWithBackoff(session, request, orderId);
      if (current.status() != OrderStatus.CLOSED && !request.isTaker() && !current.hasFills()) {
        return executeTakerFallback(session, request, start);
      }
    }
    if (current.status() == OrderStatus.CLOSED) {
      emitFillComplete(session, request, current, start);
    } else {
      emitOrderFailed(session, request, current.id(), start, current.status().name());
    }
    return buildExecutionReport(session, request, current, start);
  }

  protected VenueOrder createMarketOrder(
      ExchangeSession session, OrderRequest request, Instant start) {
    VenueClient client = session.venue().client();
    BackoffRetryExecutor retry =
        new BackoffRetryExecutor(
            MAX_CREATE_ATTEMPTS,
            attempt -> pollInterval(Duration.between(start, clock.instant())),
            ex -> !rejectionClassifier.isFatal(ex),
            sleeper);
    try {
      return retry.execute(
          "create_market_order",
          () ->
              client.createMarketOrder(
                  request.symbol(), request.side(), request.amount(), request.params()));
    } catch (RuntimeException ex) {
      if (rejectionClassifier.isFatal(ex)) {
        request.pairing().notifyFailed();
      }
      emitOrderFailed(session, request, null, null, ex.getClass().getSimpleName());
      throw new OrderCreationException(
          "Market order creation failed after retries", session.venueId(), request.symbol(), ex);
    }
  }

  /**
   * Fetches order status, backing off 0.5s, 1s, 2s, 4s on consecutive failures. The fourth
   * consecutive failure is raised after its delay.
   */
  protected VenueOrder fetchOrderWithBackoff(
      ExchangeSession session, OrderRequest request, String orderId) {
    int failures = 0;
    while (true) {
      try {
        return session.venue().client().fetchOrder(orderId, request.symbol());
      } catch (RuntimeException ex) {
        if (rejectionClassifier.isFatal(ex)) {
          throw new OrderFetchException(
              "Order status fetch rejected", session.venueId(), request.symbol(), ex);
        }
        failures++;
        Duration delay = FETCH_BACKOFF.backoffForAttempt(failures);
        log.warn(
            "Order status fetch failed venue={} symbol={} orderId={} failures={} delayMs={} error={}",
            session.venueId(),
            request.symbol(),
            orderId,
            failures,
            delay.toMillis(),
            ex.toString());
        sleep(session, request, delay);
        if (failures >= MAX_FETCH_FAILURES) {
          throw new OrderFetchException(
              "Order status fetch failed " + failures + " times in a row",
              session.venueId(),
              request.symbol(),
              ex);
        }
      }
    }
  }

  /** Cancels the tracked order, then any other open order on the same symbol and side. */
  protected void cancelPendingOrders(ExchangeSession session, OrderRequest request, String orderId) {
    VenueClient client = session.venue().client();
    if (orderId != null) {
      cancelQuietly(session, request, orderId);
    }
    List<VenueOrder> openOrders;
    try {
      openOrders = client.fetchOpenOrders(request.symbol());
    } catch (RuntimeException ex) {
      log.debug(
          "Open order lookup failed venue={} symbol={} error={}",
          session.venueId(),
          request.symbol(),
          ex.toString());
      return;
    }
    for (VenueOrder open : openOrders) {
      if (open.id().equals(orderId)) {
        continue;
      }
      if (open.side() != null && open.side() != request.side()) {
        continue;
      }
      cancelQuietly(session, request, open.id());
    }
  }

  protected boolean cancelQuietly(ExchangeSession session, OrderRequest request, String orderId) {
    try {
      session.venue().client().cancelOrder(orderId, request.symbol());
      return true;
    } catch (RuntimeException ex) {
      log.debug(
          "Cancel failed venue={} symbol={} orderId={} error={}",
          session.venueId(),
          request.symbol(),
          orderId,
          ex.toString());
      return false;
    }
  }

  protected ExecutionReport buildExecutionReport(
      ExchangeSession session, OrderRequest request, VenueOrder order, Instant submittedAt) {
    Instant now = clock.instant();
    long latencyMs = submittedAt == null ? 0L : Duration.between(submittedAt, now).toMillis();
    BigDecimal amount = order.amount() == null ? request.amount() : order.amount();
    return ExecutionReport.of(
        order.id(),
        request.symbol(),
        order.status(),
        amount,
        order.filledOrZero(),
        order.fillPrice(),
        order.price(),
        session.venueId(),
        latencyMs,
        order.timestamp() == null ? now : order.timestamp());
  }

  /** Throws once the order has been running for longer than the configured timeout. */
  protected Duration checkTimeout(ExchangeSession session, OrderRequest request, Instant start) {
    Duration elapsed = Duration.between(start, clock.instant());
    if (elapsed.compareTo(config.timeout()) >= 0) {
      throw new OrderTimeoutException(
          "Order exceeded timeout of " + config.timeout(), session.venueId(), request.symbol());
    }
    return elapsed;
  }

  protected static Duration pollInterval(Duration elapsed) {
    return elapsed.compareTo(FAST_POLL_WINDOW) < 0 ? FAST_POLL_INTERVAL : SLOW_POLL_INTERVAL;
  }

  protected void sleep(ExchangeSession session, OrderRequest request, Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new OrderExecutionException(
          "Interrupted while waiting", session.venueId(), request.symbol(), interrupted);
    }
  }
}
