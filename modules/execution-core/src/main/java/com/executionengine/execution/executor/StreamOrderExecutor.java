package com.executionengine.execution.executor;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.domain.orders.OrderState;
import com.executionengine.domain.orders.OrderStatus;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.errors.CircuitOpenException;
import com.executionengine.execution.errors.OrderCreationException;
import com.executionengine.execution.errors.OrderExecutionException;
import com.executionengine.execution.errors.OrderTimeoutException;
import com.executionengine.execution.rejection.RejectionClassifier;
import com.executionengine.execution.reprice.RepricePolicies;
import com.executionengine.execution.reprice.RepricePolicy;
import com.executionengine.execution.retry.ExponentialBackoff;
import com.executionengine.execution.retry.Sleeper;
import com.executionengine.execution.session.ExchangeSession;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.OrderEventNames;
import com.executionengine.integration.venue.OrderBookSnapshot;
import com.executionengine.integration.venue.VenueClient;
import com.executionengine.integration.venue.VenueOrder;
import com.executionengine.integration.venue.VenueStream;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Push-based executor. Each order runs a single-threaded loop that waits on whichever comes
 * first: a book update, an order-status push, the order deadline or, while an order rests, the
 * staleness timer. Subscriptions are pumped into the loop by background tasks that reconnect
 * with backoff and open the session circuit after too many consecutive failures.
 */
public class StreamOrderExecutor extends AbstractOrderExecutor {
  private static final Logger log = LoggerFactory.getLogger(StreamOrderExecutor.class);

  static final ExponentialBackoff RECONNECT_BACKOFF = new ExponentialBackoff(100L, 30_000L);

  private final ExecutorService streamExecutor;

  public StreamOrderExecutor(
      ExecutorConfig config, OrderEventBus eventBus, ExecutorService streamExecutor) {
    this(
        config,
        eventBus,
        RepricePolicies.fromConfig(config),
        new RejectionClassifier(),
        streamExecutor,
        Clock.systemUTC(),
        Sleeper.THREAD_SLEEPER);
  }

  public StreamOrderExecutor(
      ExecutorConfig config,
      OrderEventBus eventBus,
      RepricePolicy repricePolicy,
      RejectionClassifier rejectionClassifier,
      ExecutorService streamExecutor,
      Clock clock,
      Sleeper sleeper) {
    super(config, eventBus, repricePolicy, rejectionClassifier, clock, sleeper);
    this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor must not be null");
  }

  @Override
  public ExecutionReport executeMakerOrder(ExchangeSession session, OrderRequest request) {
    validateRequest(session, request);
    requireCircuitClosed(session, request);
    return new StreamOrderRun(session, request).executeMaker();
  }

  @Override
  public ExecutionReport executeTakerOrder(ExchangeSession session, OrderRequest request) {
    validateRequest(session, request);
    requireCircuitClosed(session, request);
    return new StreamOrderRun(session, request).executeTaker();
  }

  private static void requireCircuitClosed(ExchangeSession session, OrderRequest request) {
    if (session.isCircuitOpen()) {
      throw new CircuitOpenException(session.venueId(), request.symbol(), 0);
    }
  }

  /** State of one order on the stream transport. Only touched by the calling thread. */
  private final class StreamOrderRun {
    private final ExchangeSession session;
    private final OrderRequest request;
    private final VenueClient client;
    private final BlockingQueue<StreamSignal> signals = new LinkedBlockingQueue<>();
    private final List<SubscriptionPump<?>> pumps = new ArrayList<>();
    private final Instant start;
    private final Instant deadline;

    private SubscriptionPump<List<VenueOrder>> orderPump;
    private String orderId;
    private Instant submittedAt;
    private Instant stalenessDeadline;
    private OrderBookState bookState;
    private BigDecimal lastFilled = BigDecimal.ZERO;
    private boolean handedOff;

    private StreamOrderRun(ExchangeSession session, OrderRequest request) {
      this.session = session;
      this.request = request;
      this.client = session.venue().client();
      this.start = clock.instant();
      this.deadline = start.plus(config.timeout());
    }

    private ExecutionReport executeMaker() {
      cancelPendingOrders(session, request, null);
      try {
        startBookPump();
        return runMakerLoop();
      } catch (OrderTimeoutException timeout) {
        log.info(
            "Stream maker order reached deadline venue={} symbol={} orderId={}",
            session.venueId(),
            request.symbol(),
            orderId);
      } finally {
        stopPumps();
        if (!handedOff) {
          cancelPendingOrders(session, request, orderId);
        }
      }
      return executeTakerFallback(session, request, start);
    }

    private ExecutionReport executeTaker() {
      try {
        startOrderPump();
        VenueOrder created = createMarketOrder(session, request, start);
        trackPlacedOrder(created.id());
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
        ExecutionReport immediate = onOrderStatus(created);
        if (immediate != null) {
          return immediate;
        }
        while (true) {
          StreamSignal signal = awaitSignal();
          if (signal == null) {
            ExecutionReport report = checkStaleness();
            if (report != null) {
              return report;
            }
            continue;
          }
          if (signal instanceof StreamSignal.CircuitOpened opened) {
            throw circuitOpened(opened.error());
          }
          if (signal instanceof StreamSignal.SubscriptionRejected rejected) {
            throw subscriptionRejected(rejected);
          }
          if (signal instanceof StreamSignal.OrderUpdates updates) {
            ExecutionReport report = onOrderUpdates(updates.orders());
            if (report != null) {
              return report;
            }
          }
        }
      } finally {
        stopPumps();
      }
    }

    private ExecutionReport runMakerLoop() {
      while (true) {
        StreamSignal signal = awaitSignal();
        if (signal == null) {
          ExecutionReport report = checkStaleness();
          if (report != null) {
            return report;
          }
        } else if (signal instanceof StreamSignal.CircuitOpened opened) {
          throw circuitOpened(opened.error());
        } else if (signal instanceof StreamSignal.SubscriptionRejected rejected) {
          throw subscriptionRejected(rejected);
        } else if (signal instanceof StreamSignal.BookUpdate update) {
          ExecutionReport report = onBookUpdate(update.snapshot());
          if (report != null) {
            return report;
          }
        } else if (signal instanceof StreamSignal.OrderUpdates updates) {
          ExecutionReport report = onOrderUpdates(updates.orders());
          if (report != null) {
            return report;
          }
        }

        if (orderId == null && bookState != null) {
          ExecutionReport report = placeLimitOrder();
          if (report != null) {
            return report;
          }
        }
      }
    }

    /**
     * A placed order stays on the venue when the circuit opens; the error names it so the caller
     * keeps tracking it over REST instead of placing it again.
     */
    private CircuitOpenException circuitOpened(CircuitOpenException error) {
      if (orderId == null) {
        return error;
      }
      handedOff = true;
      log.warn(
          "Stream circuit opened with an order on the venue venue={} symbol={} orderId={}",
          session.venueId(),
          request.symbol(),
          orderId);
      return error.withPlacedOrder(orderId, submittedAt);
    }

    private OrderExecutionException subscriptionRejected(
        StreamSignal.SubscriptionRejected rejected) {
      return new OrderExecutionException(
          "Venue rejected " + rejected.streamName() + " subscription",
          session.venueId(),
          request.symbol(),
          rejected.error());
    }

    /**
     * Waits for the next signal, bounded by the deadline and, while an order rests, the staleness
     * timer. Returns null when the staleness timer fired first.
     */
    private StreamSignal awaitSignal() {
      Instant now = clock.instant();
      if (!now.isBefore(deadline)) {
        throw new OrderTimeoutException(
            "Order exceeded timeout of " + config.timeout(), session.venueId(), request.symbol());
      }
      Duration wait = Duration.between(now, deadline);
      boolean stalenessBound = false;
      if (orderId != null && stalenessDeadline != null) {
        Duration untilStale = Duration.between(now, stalenessDeadline);
        if (untilStale.compareTo(wait) < 0) {
          wait = untilStale;
          stalenessBound = true;
        }
      }
      StreamSignal signal;
      try {
        signal = signals.poll(Math.max(0L, wait.toNanos()), TimeUnit.NANOSECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw new OrderExecutionException(
            "Interrupted while waiting for stream updates",
            session.venueId(),
            request.symbol(),
            interrupted);
      }
      if (signal != null) {
        return signal;
      }
      if (!stalenessBound) {
        throw new OrderTimeoutException(
            "Order exceeded timeout of " + config.timeout(), session.venueId(), request.symbol());
      }
      return null;
    }

    private ExecutionReport onBookUpdate(OrderBookSnapshot snapshot) {
      Duration elapsed = Duration.between(start, clock.instant());
      Optional<OrderBookState> next = analyzeOrderBook(snapshot, request, bookState, elapsed);
      if (next.isEmpty()) {
        return null;
      }
      OrderBookState candidate = next.get();
      if (!spreadAcceptable(candidate)) {
        log.debug(
            "Spread too wide venue={} symbol={} spreadPct={} maxSpreadPct={}",
            session.venueId(),
            request.symbol(),
            candidate.spreadPct(),
            config.maxSpreadPct());
        return null;
      }
      if (orderId == null || bookState == null) {
        bookState = candidate;
        return null;
      }
      if (!checkShouldReprice(
          session,
          request,
          orderId,
          submittedAt,
          bookState.price(),
          candidate.price(),
          elapsed)) {
        return null;
      }
      String resting = orderId;
      cancelQuietly(session, request, resting);
      try {
        VenueOrder afterCancel = client.fetchOrder(resting, request.symbol());
        if (afterCancel.status() == OrderStatus.CLOSED) {
          emitFillComplete(session, request, afterCancel, submittedAt);
          return buildExecutionReport(session, request, afterCancel, submittedAt);
        }
      } catch (RuntimeException ex) {
        log.debug(
            "Post-cancel status check failed venue={} symbol={} orderId={} error={}",
            session.venueId(),
            request.symbol(),
            resting,
            ex.toString());
      }
      orderId = null;
      bookState = candidate;
      return null;
    }

    private ExecutionReport onOrderUpdates(List<VenueOrder> orders) {
      if (orderId == null) {
        return null;
      }
      for (VenueOrder order : orders) {
        if (orderId.equals(order.id())) {
          stalenessDeadline = clock.instant().plus(config.wsStalenessWindow());
          return onOrderStatus(order);
        }
      }
      return null;
    }

    private ExecutionReport onOrderStatus(VenueOrder order) {
      if (order.status() == OrderStatus.CLOSED) {
        emitFillComplete(session, request, order, submittedAt);
        return buildExecutionReport(session, request, order, submittedAt);
      }
      if (order.status().isFailure()) {
        emitOrderFailed(session, request, order.id(), submittedAt, order.status().name());
        if (request.isTaker()) {
          throw new OrderCreationException(
              "Market order ended with status " + order.status(),
              session.venueId(),
              request.symbol());
        }
        log.info(
            "Stream order ended without fill, re-entering price discovery venue={} symbol={} orderId={} status={}",
            session.venueId(),
            request.symbol(),
            order.id(),
            order.status());
        orderId = null;
        stalenessDeadline = null;
        return null;
      }
      if (order.hasFills() && order.filled().compareTo(lastFilled) > 0) {
        lastFilled = order.filled();
        emit(
            session,
            request,
            order.id(),
            OrderState.PARTIALLY_FILLED,
            OrderEventNames.ORDER_FILL_PARTIAL,
            submittedAt,
            order.fillPrice(),
            order.filled(),
            Map.of());
      }
      return null;
    }

    /** One REST status check after the stream went quiet. Never cancels the order. */
    private ExecutionReport checkStaleness() {
      stalenessDeadline = clock.instant().plus(config.wsStalenessWindow());
      if (orderId == null) {
        return null;
      }
      VenueOrder order;
      try {
        order = client.fetchOrder(orderId, request.symbol());
      } catch (RuntimeException ex) {
        log.warn(
            "Staleness status check failed venue={} symbol={} orderId={} error={}",
            session.venueId(),
            request.symbol(),
            orderId,
            ex.toString());
        return null;
      }
      emit(
          session,
          request,
          orderId,
          OrderState.MONITORING_ORDER,
          OrderEventNames.WS_STALENESS_FALLBACK,
          submittedAt,
          null,
          null,
          Map.of("status", order.status().name()));
      return onOrderStatus(order);
    }

    private ExecutionReport placeLimitOrder() {
      BigDecimal price = bookState.price();
      VenueOrder created;
      try {
        created =
            client.createLimitOrder(
                request.symbol(), request.side(), request.amount(), price, request.params());
      } catch (RuntimeException ex) {
        if (rejectionClassifier.isFatal(ex)) {
          request.pairing().notifyFailed();
          emitOrderFailed(session, request, null, null, ex.getClass().getSimpleName());
          throw new OrderCreationException(
              "Order rejected by venue", session.venueId(), request.symbol(), ex);
        }
        log.warn(
            "Stream limit order creation failed, will retry venue={} symbol={} price={} error={}",
            session.venueId(),
            request.symbol(),
            price,
            ex.toString());
        sleep(session, request, pollInterval(Duration.between(start, clock.instant())));
        return null;
      }
      trackPlacedOrder(created.id());
      emit(
          session,
          request,
          created.id(),
          OrderState.SUBMITTED,
          OrderEventNames.ORDER_SUBMITTED,
          submittedAt,
          price,
          request.amount(),
          Map.of("type", "limit"));
      if (orderPump == null) {
        startOrderPump();
      }
      return onOrderStatus(created);
    }

    private void trackPlacedOrder(String id) {
      orderId = id;
      submittedAt = clock.instant();
      stalenessDeadline = submittedAt.plus(config.wsStalenessWindow());
      lastFilled = BigDecimal.ZERO;
    }

    private void startBookPump() {
      VenueStream<OrderBookSnapshot> prewarmed = session.takePrewarmedBookStream(request.symbol());
      SubscriptionPump<OrderBookSnapshot> pump =
          new SubscriptionPump<>(
              "order_book",
              this,
              prewarmed,
              () -> client.subscribeOrderBook(request.symbol()),
              StreamSignal.BookUpdate::new);
      launch(pump);
    }

    private void startOrderPump() {
      orderPump =
          new SubscriptionPump<>(
              "orders",
              this,
              null,
              () -> client.subscribeOrders(request.symbol()),
              StreamSignal.OrderUpdates::new);
      launch(orderPump);
    }

    private void launch(SubscriptionPump<?> pump) {
      pumps.add(pump);
      pump.future = streamExecutor.submit(pump);
    }

    private void stopPumps() {
      for (SubscriptionPump<?> pump : pumps) {
        pump.stop();
      }
      pumps.clear();
      orderPump = null;
    }
  }

  /**
   * Moves items from one venue subscription into the order loop, reconnecting on failure. Runs
   * on the stream executor; the attempt counter is confined to that thread.
   */
  private final class SubscriptionPump<T> implements Runnable {
    private final String streamName;
    private final StreamOrderRun run;
    private final Supplier<VenueStream<T>> subscriber;
    private final Function<T, StreamSignal> toSignal;
    private volatile VenueStream<T> current;
    private volatile boolean stopped;
    private volatile Future<?> future;
    private int attempt;

    private SubscriptionPump(
        String streamName,
        StreamOrderRun run,
        VenueStream<T> initial,
        Supplier<VenueStream<T>> subscriber,
        Function<T, StreamSignal> toSignal) {
      this.streamName = streamName;
      this.run = run;
      this.current = initial;
      this.subscriber = subscriber;
      this.toSignal = toSignal;
    }

    @Override
    public void run() {
      while (!stopped && !Thread.currentThread().isInterrupted()) {
        try {
          VenueStream<T> stream = current;
          if (stream == null) {
            stream = subscriber.get();
            current = stream;
            if (stopped) {
              stream.close();
              return;
            }
          }
          T item = stream.next();
          attempt = 0;
          run.signals.offer(toSignal.apply(item));
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return;
        } catch (RuntimeException ex) {
          if (stopped) {
            return;
          }
          closeCurrent();
          if (rejectionClassifier.isFatal(ex)) {
            log.warn(
                "Stream subscription rejected venue={} symbol={} stream={} error={}",
                run.session.venueId(),
                run.request.symbol(),
                streamName,
                ex.toString());
            run.signals.offer(new StreamSignal.SubscriptionRejected(streamName, ex));
            return;
          }
          attempt++;
          if (!backOffOrOpenCircuit(ex)) {
            return;
          }
        }
      }
    }

    /** Returns false once the circuit has been opened and the pump should exit. */
    private boolean backOffOrOpenCircuit(RuntimeException failure) {
      ExchangeSession session = run.session;
      OrderRequest request = run.request;
      emit(
          session,
          request,
          run.orderId,
          OrderState.MONITORING_ORDER,
          OrderEventNames.WS_RECONNECT_ATTEMPT,
          run.submittedAt,
          null,
          null,
          Map.of(
              "attempt", Integer.toString(attempt),
              "stream", streamName,
              "error", failure.getClass().getSimpleName()));
      int maxAttempts = config.maxWsReconnectAttempts();
      if (!config.reconnectAttemptsUnlimited() && attempt >= maxAttempts) {
        session.markCircuitOpen();
        emit(
            session,
            request,
            run.orderId,
            OrderState.FAILED,
            OrderEventNames.WS_CIRCUIT_OPEN,
            run.submittedAt,
            null,
            null,
            Map.of("attempt", Integer.toString(attempt), "stream", streamName));
        log.warn(
            "Stream reconnect attempts exhausted venue={} symbol={} stream={} attempts={} error={}",
            session.venueId(),
            request.symbol(),
            streamName,
            attempt,
            failure.toString());
        run.signals.offer(
            new StreamSignal.CircuitOpened(
                new CircuitOpenException(session.venueId(), request.symbol(), attempt)));
        return false;
      }
      Duration delay = RECONNECT_BACKOFF.backoffForAttempt(attempt);
      log.info(
          "Stream reconnect scheduled venue={} symbol={} stream={} attempt={} delayMs={} error={}",
          session.venueId(),
          request.symbol(),
          streamName,
          attempt,
          delay.toMillis(),
          failure.toString());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        return false;
      }
      return !stopped;
    }

    private void stop() {
      stopped = true;
      closeCurrent();
      Future<?> running = future;
      if (running != null) {
        running.cancel(true);
      }
    }

    private void closeCurrent() {
      VenueStream<T> stream = current;
      current = null;
      if (stream != null) {
        try {
          stream.close();
        } catch (RuntimeException ex) {
          log.debug("Stream close failed stream={} error={}", streamName, ex.toString());
        }
      }
    }
  }
}
