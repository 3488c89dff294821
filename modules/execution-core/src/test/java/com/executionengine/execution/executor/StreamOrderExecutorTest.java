package com.executionengine.execution.executor;

import static com.executionengine.execution.executor.OrderBookAnalyzerTest.book;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.domain.orders.OrderSide;
import com.executionengine.domain.orders.OrderState;
import com.executionengine.domain.orders.OrderStatus;
import com.executionengine.execution.config.ExecutionStrategy;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.errors.CircuitOpenException;
import com.executionengine.execution.errors.OrderCreationException;
import com.executionengine.execution.errors.OrderExecutionException;
import com.executionengine.execution.rejection.RejectionClassifier;
import com.executionengine.execution.reprice.RepricePolicies;
import com.executionengine.execution.retry.Sleeper;
import com.executionengine.execution.session.ExchangeSession;
import com.executionengine.execution.support.RecordingEventSink;
import com.executionengine.infra.events.OrderEvent;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.OrderEventNames;
import com.executionengine.integration.venue.BadSymbolException;
import com.executionengine.integration.venue.InsufficientFundsException;
import com.executionengine.integration.venue.OrderBookSnapshot;
import com.executionengine.integration.venue.PaperVenueClient;
import com.executionengine.integration.venue.Venue;
import com.executionengine.integration.venue.VenueNetworkException;
import com.executionengine.integration.venue.VenueOrder;
import com.executionengine.integration.venue.VenueStream;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamOrderExecutorTest {
  private static final String SYMBOL = "BTC/USDT";

  private ThreadPoolExecutor streamPool;
  private RecordingEventSink sink;
  private OrderEventBus eventBus;
  private List<Duration> reconnectSleeps;
  private Sleeper recordingSleeper;

  @BeforeEach
  void setUp() {
    streamPool = (ThreadPoolExecutor) Executors.newCachedThreadPool();
    sink = new RecordingEventSink();
    eventBus = new OrderEventBus();
    eventBus.registerSink(sink);
    reconnectSleeps = Collections.synchronizedList(new ArrayList<>());
    recordingSleeper = reconnectSleeps::add;
  }

  @AfterEach
  void tearDown() {
    streamPool.shutdownNow();
  }

  @Test
  void shouldReconnectWithDoublingDelaysThenFillViaStalenessCheck() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(3, Duration.ZERO);
    ExecutorConfig config =
        config().wsStalenessWindow(Duration.ofMillis(200)).maxWsReconnectAttempts(5).build();
    ExchangeSession session = session(client);

    ExecutionReport report = executor(config).execute(session, buyLimit());

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("100").compareTo(report.averagePrice()));
    assertEquals(
        List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
        reconnectSleeps);
    List<OrderEvent> reconnects = sink.named(OrderEventNames.WS_RECONNECT_ATTEMPT);
    assertEquals(3, reconnects.size());
    assertEquals("1", reconnects.get(0).context().get("attempt"));
    assertEquals("3", reconnects.get(2).context().get("attempt"));
    List<OrderEvent> staleness = sink.named(OrderEventNames.WS_STALENESS_FALLBACK);
    assertEquals(1, staleness.size());
    assertEquals(OrderState.MONITORING_ORDER, staleness.get(0).state());
    assertTrue(sink.named(OrderEventNames.ORDER_TIMEOUT_FALLBACK).isEmpty());
    assertFalse(session.isCircuitOpen());
    awaitCondition(() -> streamPool.getActiveCount() == 0);
  }

  @Test
  void shouldOpenCircuitAfterMaxReconnectAttempts() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(Integer.MAX_VALUE, Duration.ZERO);
    ExecutorConfig config = config().maxWsReconnectAttempts(3).build();
    ExchangeSession session = session(client);
    OrderRequest request = buyLimit();

    CircuitOpenException error =
        assertThrows(CircuitOpenException.class, () -> executor(config).execute(session, request));

    assertEquals(3, error.attempts());
    assertTrue(session.isCircuitOpen());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), reconnectSleeps);
    assertEquals(3, client.bookSubscribeAttempts());
    List<OrderEvent> circuitOpen = sink.named(OrderEventNames.WS_CIRCUIT_OPEN);
    assertEquals(1, circuitOpen.size());
    assertEquals(OrderState.FAILED, circuitOpen.get(0).state());
    assertTrue(sink.named(OrderEventNames.ORDER_SUBMITTED).isEmpty());
    assertFalse(request.pairing().isResolved());
  }

  @Test
  void shouldRefuseWorkOnceCircuitIsOpen() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ZERO);
    ExchangeSession session = session(client);
    session.markCircuitOpen();

    assertThrows(
        CircuitOpenException.class, () -> executor(config().build()).execute(session, buyLimit()));
    assertEquals(0, client.bookSubscribeAttempts());
  }

  @Test
  void shouldFallBackToMarketOrderAtDeadline() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ofHours(1));
    ExecutorConfig config = config().timeout(Duration.ofMillis(300)).build();

    ExecutionReport report = executor(config).execute(session(client), buyLimit());

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("101").compareTo(report.averagePrice()));
    assertEquals(
        List.of(
            OrderEventNames.ORDER_SUBMITTED,
            OrderEventNames.ORDER_TIMEOUT_FALLBACK,
            OrderEventNames.ORDER_SUBMITTED,
            OrderEventNames.ORDER_FILL_COMPLETE),
        sink.names());
    String restingId = sink.events().get(0).orderId();
    assertEquals(OrderStatus.CANCELED, client.fetchOrder(restingId, SYMBOL).status());
  }

  @Test
  void shouldRepriceWhenBookUpdateArrives() throws Exception {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ofHours(1));
    ExecutorConfig config = config().timeout(Duration.ofSeconds(1)).build();
    StreamOrderExecutor executor = executor(config);
    ExchangeSession session = session(client);

    CompletableFuture<ExecutionReport> running =
        CompletableFuture.supplyAsync(() -> executor.execute(session, buyLimit()));
    awaitCondition(() -> !sink.named(OrderEventNames.ORDER_SUBMITTED).isEmpty());
    client.updateOrderBook(book("102", "103", 6));
    ExecutionReport report = running.get(5, TimeUnit.SECONDS);

    List<OrderEvent> repriced = sink.named(OrderEventNames.ORDER_REPRICED);
    assertEquals(1, repriced.size());
    assertEquals(0, new BigDecimal("102").compareTo(repriced.get(0).fillPrice()));
    List<OrderEvent> submitted = sink.named(OrderEventNames.ORDER_SUBMITTED);
    assertEquals(0, new BigDecimal("102").compareTo(submitted.get(1).fillPrice()));
    assertEquals(OrderStatus.CANCELED, client.fetchOrder(submitted.get(0).orderId(), SYMBOL).status());
    assertEquals(OrderStatus.CANCELED, client.fetchOrder(submitted.get(1).orderId(), SYMBOL).status());
    assertEquals(0, new BigDecimal("103").compareTo(report.averagePrice()));
  }

  @Test
  void shouldRePlaceMakerOrderAfterVenueCancelsIt() throws Exception {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ofMillis(300));
    ExecutorConfig config =
        config().timeout(Duration.ofSeconds(3)).wsStalenessWindow(Duration.ofMillis(200)).build();
    StreamOrderExecutor executor = executor(config);
    ExchangeSession session = session(client);

    CompletableFuture<ExecutionReport> running =
        CompletableFuture.supplyAsync(() -> executor.execute(session, buyLimit()));
    awaitCondition(() -> !sink.named(OrderEventNames.ORDER_SUBMITTED).isEmpty());
    String cancelledId = sink.named(OrderEventNames.ORDER_SUBMITTED).get(0).orderId();
    client.cancelOrder(cancelledId, SYMBOL);
    ExecutionReport report = running.get(5, TimeUnit.SECONDS);

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("100").compareTo(report.averagePrice()));
    List<OrderEvent> submitted = sink.named(OrderEventNames.ORDER_SUBMITTED);
    assertEquals(2, submitted.size());
    assertEquals(cancelledId, submitted.get(0).orderId());
    assertEquals(report.exchangeOrderId(), submitted.get(1).orderId());
    assertEquals(0, new BigDecimal("100").compareTo(submitted.get(1).fillPrice()));
    List<OrderEvent> failed = sink.named(OrderEventNames.ORDER_FAILED);
    assertEquals(1, failed.size());
    assertEquals("CANCELED", failed.get(0).context().get("reason"));
    assertTrue(sink.named(OrderEventNames.ORDER_TIMEOUT_FALLBACK).isEmpty());
  }

  @Test
  void shouldLeaveRestingOrderOnVenueWhenOrderStreamOpensCircuit() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ofHours(1));
    client.failOrderSubscriptions = true;
    ExecutorConfig config = config().maxWsReconnectAttempts(2).build();
    ExchangeSession session = session(client);

    CircuitOpenException error =
        assertThrows(
            CircuitOpenException.class, () -> executor(config).execute(session, buyLimit()));

    String restingId = sink.named(OrderEventNames.ORDER_SUBMITTED).get(0).orderId();
    assertTrue(error.orderPlaced());
    assertEquals(restingId, error.placedOrderId());
    assertEquals(OrderStatus.OPEN, client.fetchOrder(restingId, SYMBOL).status());
    assertTrue(session.isCircuitOpen());
    assertEquals(List.of(Duration.ofMillis(100)), reconnectSleeps);
    assertEquals(1, sink.named(OrderEventNames.ORDER_SUBMITTED).size());
  }

  @Test
  void fatalSubscriptionErrorShouldFailOrderWithoutReconnecting() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ZERO);
    client.rejectBookSubscriptions = true;
    ExchangeSession session = session(client);

    OrderExecutionException error =
        assertThrows(
            OrderExecutionException.class,
            () -> executor(config().build()).execute(session, buyLimit()));

    assertFalse(error instanceof CircuitOpenException);
    assertTrue(error.getCause() instanceof BadSymbolException);
    assertEquals(1, client.bookSubscribeAttempts());
    assertTrue(reconnectSleeps.isEmpty());
    assertTrue(sink.named(OrderEventNames.WS_RECONNECT_ATTEMPT).isEmpty());
    assertFalse(session.isCircuitOpen());
  }

  @Test
  void fatalRejectionShouldFailPairingWithoutRetry() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ZERO);
    client.rejectLimitOrders = true;
    OrderRequest request = buyLimit();

    assertThrows(
        OrderCreationException.class,
        () -> executor(config().build()).execute(session(client), request));

    assertTrue(request.pairing().isPairFailed());
    assertEquals(List.of(OrderEventNames.ORDER_FAILED), sink.names());
  }

  @Test
  void takerOrderShouldCompleteFromCreationResponse() {
    FlakyPaperVenueClient client = new FlakyPaperVenueClient(0, Duration.ZERO);

    ExecutionReport report =
        executor(config().build())
            .execute(
                session(client), OrderRequest.market("paper", SYMBOL, OrderSide.SELL, BigDecimal.ONE));

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("100").compareTo(report.averagePrice()));
    assertEquals(
        List.of(OrderEventNames.ORDER_SUBMITTED, OrderEventNames.ORDER_FILL_COMPLETE),
        sink.names());
  }

  private StreamOrderExecutor executor(ExecutorConfig config) {
    return new StreamOrderExecutor(
        config,
        eventBus,
        RepricePolicies.fromConfig(config),
        new RejectionClassifier(),
        streamPool,
        Clock.systemUTC(),
        recordingSleeper);
  }

  private static ExchangeSession session(PaperVenueClient client) {
    return new ExchangeSession(Venue.streaming("paper", client), 4);
  }

  private static ExecutorConfig.Builder config() {
    return ExecutorConfig.builder(ExecutionStrategy.FAST, new BigDecimal("0.05"));
  }

  private static OrderRequest buyLimit() {
    return OrderRequest.limit("paper", SYMBOL, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100"));
  }

  private static void awaitCondition(BooleanSupplier condition) {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Condition not met within 3s");
      }
      try {
        Thread.sleep(10L);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw new AssertionError("Interrupted while waiting", interrupted);
      }
    }
  }

  /** Paper venue with scripted subscription and order placement failures. */
  private static final class FlakyPaperVenueClient extends PaperVenueClient {
    private final int failingSubscriptions;
    private final AtomicInteger bookSubscribeAttempts = new AtomicInteger();
    private volatile boolean rejectLimitOrders;
    private volatile boolean rejectBookSubscriptions;
    private volatile boolean failOrderSubscriptions;

    private FlakyPaperVenueClient(int failingSubscriptions, Duration restingFillDelay) {
      super("paper", true, restingFillDelay);
      this.failingSubscriptions = failingSubscriptions;
      updateOrderBook(book("100", "101", 6));
    }

    @Override
    public VenueStream<OrderBookSnapshot> subscribeOrderBook(String symbol) {
      if (bookSubscribeAttempts.incrementAndGet() <= failingSubscriptions) {
        throw new VenueNetworkException("paper", "handshake failed");
      }
      if (rejectBookSubscriptions) {
        throw new BadSymbolException("paper", "market delisted");
      }
      return super.subscribeOrderBook(symbol);
    }

    @Override
    public VenueStream<List<VenueOrder>> subscribeOrders(String symbol) {
      if (failOrderSubscriptions) {
        throw new VenueNetworkException("paper", "order stream unavailable");
      }
      return super.subscribeOrders(symbol);
    }

    @Override
    public synchronized VenueOrder createLimitOrder(
        String symbol,
        OrderSide side,
        BigDecimal amount,
        BigDecimal price,
        Map<String, Object> params) {
      if (rejectLimitOrders) {
        throw new InsufficientFundsException("paper", "balance too low");
      }
      return super.createLimitOrder(symbol, side, amount, price, params);
    }

    int bookSubscribeAttempts() {
      return bookSubscribeAttempts.get();
    }
  }
}
