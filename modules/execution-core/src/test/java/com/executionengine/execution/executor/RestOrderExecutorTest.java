package com.executionengine.execution.executor;

import static com.executionengine.execution.executor.OrderBookAnalyzerTest.book;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.executionengine.domain.orders.ExecutionReport;
import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.domain.orders.OrderSide;
import com.executionengine.domain.orders.OrderStatus;
import com.executionengine.execution.config.ExecutionStrategy;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.errors.OrderCreationException;
import com.executionengine.execution.errors.OrderFetchException;
import com.executionengine.execution.rejection.RejectionClassifier;
import com.executionengine.execution.reprice.RepricePolicies;
import com.executionengine.execution.retry.Sleeper;
import com.executionengine.execution.session.ExchangeSession;
import com.executionengine.execution.support.ManualClock;
import com.executionengine.execution.support.RecordingEventSink;
import com.executionengine.infra.events.OrderEvent;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.OrderEventNames;
import com.executionengine.integration.venue.InsufficientFundsException;
import com.executionengine.integration.venue.PaperVenueClient;
import com.executionengine.integration.venue.Venue;
import com.executionengine.integration.venue.VenueClient;
import com.executionengine.integration.venue.VenueNetworkException;
import com.executionengine.integration.venue.VenueOrder;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RestOrderExecutorTest {
  private static final String SYMBOL = "BTC/USDT";

  private ManualClock clock;
  private RecordingEventSink sink;
  private OrderEventBus eventBus;

  @BeforeEach
  void setUp() {
    clock = ManualClock.startingAt("2026-03-01T00:00:00Z");
    sink = new RecordingEventSink();
    eventBus = new OrderEventBus();
    eventBus.registerSink(sink);
  }

  @Test
  void makerOrderShouldRestUntilFilledAndReportLatency() {
    PaperVenueClient client = paperClient(Duration.ofSeconds(1));
    RestOrderExecutor executor = executor(config().build(), clock);

    ExecutionReport report = executor.execute(session(client), buyLimit());

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("100").compareTo(report.averagePrice()));
    assertEquals(0, report.amount().compareTo(report.filled().add(report.remaining())));
    assertEquals(1_000L, report.fillLatencyMs());
    assertEquals(
        List.of(OrderEventNames.ORDER_SUBMITTED, OrderEventNames.ORDER_FILL_COMPLETE), sink.names());
  }

  @Test
  void makerOrderShouldPollFastFirstThenSlow() {
    PaperVenueClient client = paperClient(Duration.ofSeconds(15));
    RestOrderExecutor executor = executor(config().build(), clock);

    executor.execute(session(client), buyLimit());

    List<Duration> sleeps = clock.sleeps();
    assertEquals(Duration.ofMillis(200), sleeps.get(0));
    assertEquals(Duration.ofSeconds(1), sleeps.get(sleeps.size() - 1));
    assertEquals(Duration.ofMillis(200), AbstractOrderExecutor.pollInterval(Duration.ofSeconds(9)));
    assertEquals(Duration.ofSeconds(1), AbstractOrderExecutor.pollInterval(Duration.ofSeconds(10)));
  }

  @Test
  void makerOrderShouldCancelAndReplaceWhenBookMoves() {
    PaperVenueClient client = paperClient(Duration.ofSeconds(1));
    Sleeper movingBook =
        duration -> {
          clock.sleep(duration);
          if (clock.sleeps().size() == 2) {
            client.updateOrderBook(book("102", "103", 6));
          }
        };
    RestOrderExecutor executor = executor(config().build(), movingBook);

    ExecutionReport report = executor.execute(session(client), buyLimit());

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("102").compareTo(report.averagePrice()));
    assertEquals(
        List.of(
            OrderEventNames.ORDER_SUBMITTED,
            OrderEventNames.ORDER_REPRICED,
            OrderEventNames.ORDER_SUBMITTED,
            OrderEventNames.ORDER_FILL_COMPLETE),
        sink.names());
    String firstOrderId = sink.events().get(0).orderId();
    assertEquals(OrderStatus.CANCELED, client.fetchOrder(firstOrderId, SYMBOL).status());
  }

  @Test
  void makerOrderShouldSuppressSmallMoves() {
    PaperVenueClient client = paperClient(Duration.ofSeconds(1));
    Sleeper movingBook =
        duration -> {
          clock.sleep(duration);
          if (clock.sleeps().size() == 1) {
            client.updateOrderBook(book("100.5", "101.5", 6));
          }
        };
    ExecutorConfig config = config().minRepriceThresholdPct(new BigDecimal("0.05")).build();
    RestOrderExecutor executor = executor(config, movingBook);

    ExecutionReport report = executor.execute(session(client), buyLimit());

    assertEquals(0, new BigDecimal("100").compareTo(report.averagePrice()));
    List<OrderEvent> suppressed = sink.named(OrderEventNames.ORDER_REPRICE_SUPPRESSED);
    assertTrue(suppressed.size() >= 1);
    assertEquals("0.05", suppressed.get(0).context().get("threshold_pct"));
    assertEquals("0.005", suppressed.get(0).context().get("change_pct"));
    assertTrue(sink.named(OrderEventNames.ORDER_REPRICED).isEmpty());
  }

  @Test
  void makerOrderShouldFallBackToMarketOrderOnTimeout() {
    PaperVenueClient client = paperClient(Duration.ofHours(1));
    ExecutorConfig config = config().timeout(Duration.ofSeconds(2)).build();
    RestOrderExecutor executor = executor(config, clock);

    ExecutionReport report = executor.execute(session(client), buyLimit());

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
    assertTrue(client.fetchOpenOrders(SYMBOL).isEmpty());
  }

  @Test
  void makerOrderShouldPlaceAgainAfterRejection() {
    VenueClient client = mock(VenueClient.class);
    when(client.fetchOrderBook(SYMBOL)).thenReturn(book("100", "101", 6));
    when(client.createLimitOrder(any(), any(), any(), any(), anyMap()))
        .thenReturn(order("l-1", OrderStatus.OPEN, "0"), order("l-2", OrderStatus.OPEN, "0"));
    when(client.fetchOrder("l-1", SYMBOL)).thenReturn(order("l-1", OrderStatus.REJECTED, "0"));
    when(client.fetchOrder("l-2", SYMBOL))
        .thenReturn(order("l-2", OrderStatus.OPEN, "0.4"), order("l-2", OrderStatus.CLOSED, "1"));
    RestOrderExecutor executor = executor(config().build(), clock);

    ExecutionReport report = executor.execute(session(client), buyLimit());

    assertEquals("l-2", report.exchangeOrderId());
    assertEquals(
        List.of(
            OrderEventNames.ORDER_SUBMITTED,
            OrderEventNames.ORDER_FAILED,
            OrderEventNames.ORDER_SUBMITTED,
            OrderEventNames.ORDER_FILL_PARTIAL,
            OrderEventNames.ORDER_FILL_COMPLETE),
        sink.names());
    assertEquals("REJECTED", sink.events().get(1).context().get("reason"));
  }

  @Test
  void resumedOrderShouldBeTrackedUntilFilledWithoutPlacingAgain() {
    PaperVenueClient client = paperClient(Duration.ofSeconds(1));
    Instant placedAt = clock.instant();
    String restingId =
        client
            .createLimitOrder(SYMBOL, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100"), Map.of())
            .id();
    RestOrderExecutor executor = executor(config().build(), clock);

    ExecutionReport report =
        executor.resumePlacedOrder(session(client), buyLimit(), restingId, placedAt);

    assertEquals(restingId, report.exchangeOrderId());
    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("100").compareTo(report.averagePrice()));
    assertEquals(1_000L, report.fillLatencyMs());
    assertEquals(List.of(OrderEventNames.ORDER_FILL_COMPLETE), sink.names());
  }

  @Test
  void resumedMakerOrderShouldFallBackToMarketOrderAtDeadline() {
    PaperVenueClient client = paperClient(Duration.ofHours(1));
    Instant placedAt = clock.instant();
    String restingId =
        client
            .createLimitOrder(SYMBOL, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100"), Map.of())
            .id();
    ExecutorConfig config = config().timeout(Duration.ofSeconds(2)).build();
    RestOrderExecutor executor = executor(config, clock);

    ExecutionReport report =
        executor.resumePlacedOrder(session(client), buyLimit(), restingId, placedAt);

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(0, new BigDecimal("101").compareTo(report.averagePrice()));
    assertEquals(
        List.of(
            OrderEventNames.ORDER_TIMEOUT_FALLBACK,
            OrderEventNames.ORDER_SUBMITTED,
            OrderEventNames.ORDER_FILL_COMPLETE),
        sink.names());
    assertEquals(OrderStatus.CANCELED, client.fetchOrder(restingId, SYMBOL).status());
  }

  @Test
  void fatalRejectionShouldFailPairingWithoutFallback() {
    VenueClient client = mock(VenueClient.class);
    when(client.fetchOrderBook(SYMBOL)).thenReturn(book("100", "101", 6));
    when(client.createLimitOrder(any(), any(), any(), any(), anyMap()))
        .thenThrow(new InsufficientFundsException("paper", "balance too low"));
    RestOrderExecutor executor = executor(config().build(), clock);
    OrderRequest request = buyLimit();

    assertThrows(OrderCreationException.class, () -> executor.execute(session(client), request));

    assertTrue(request.pairing().isPairFailed());
    assertEquals(List.of(OrderEventNames.ORDER_FAILED), sink.names());
    verify(client, never()).createMarketOrder(any(), any(), any(), anyMap());
  }

  @Test
  void takerOrderShouldRaiseAfterFourConsecutiveFetchFailures() {
    VenueClient client = mock(VenueClient.class);
    when(client.createMarketOrder(any(), any(), any(), anyMap()))
        .thenReturn(order("m-1", OrderStatus.OPEN, "0"));
    when(client.fetchOrder("m-1", SYMBOL)).thenThrow(new VenueNetworkException("paper", "reset"));
    RestOrderExecutor executor = executor(config().build(), clock);

    assertThrows(
        OrderFetchException.class, () -> executor.execute(session(client), buyMarket()));

    assertEquals(
        List.of(
            Duration.ofMillis(200),
            Duration.ofMillis(500),
            Duration.ofMillis(1_000),
            Duration.ofMillis(2_000),
            Duration.ofMillis(4_000)),
        clock.sleeps());
  }

  @Test
  void takerOrderShouldRecoverAfterThreeFetchFailures() {
    VenueClient client = mock(VenueClient.class);
    when(client.createMarketOrder(any(), any(), any(), anyMap()))
        .thenReturn(order("m-1", OrderStatus.OPEN, "0"));
    when(client.fetchOrder("m-1", SYMBOL))
        .thenThrow(
            new VenueNetworkException("paper", "reset"),
            new VenueNetworkException("paper", "reset"),
            new VenueNetworkException("paper", "reset"))
        .thenReturn(order("m-1", OrderStatus.CLOSED, "1"));
    RestOrderExecutor executor = executor(config().build(), clock);

    ExecutionReport report = executor.execute(session(client), buyMarket());

    assertEquals(OrderStatus.CLOSED, report.status());
    assertEquals(
        List.of(
            Duration.ofMillis(200),
            Duration.ofMillis(500),
            Duration.ofMillis(1_000),
            Duration.ofMillis(2_000)),
        clock.sleeps());
    assertTrue(report.fillLatencyMs() >= 0L);
  }

  @Test
  void takerOrderShouldRetryTransientCreationFailures() {
    VenueClient client = mock(VenueClient.class);
    when(client.createMarketOrder(any(), any(), any(), anyMap()))
        .thenThrow(new VenueNetworkException("paper", "reset"))
        .thenReturn(order("m-2", OrderStatus.CLOSED, "1"));
    RestOrderExecutor executor = executor(config().build(), clock);

    ExecutionReport report = executor.execute(session(client), buyMarket());

    assertEquals("m-2", report.exchangeOrderId());
    assertEquals(List.of(Duration.ofMillis(200)), clock.sleeps());
  }

  @Test
  void takerOrderShouldGiveUpAfterThreeCreationAttempts() {
    VenueClient client = mock(VenueClient.class);
    when(client.createMarketOrder(any(), any(), any(), anyMap()))
        .thenThrow(new VenueNetworkException("paper", "reset"));
    RestOrderExecutor executor = executor(config().build(), clock);

    assertThrows(
        OrderCreationException.class, () -> executor.execute(session(client), buyMarket()));

    assertEquals(2, clock.sleeps().size());
    assertEquals(List.of(OrderEventNames.ORDER_FAILED), sink.names());
  }

  private RestOrderExecutor executor(ExecutorConfig config, Sleeper sleeper) {
    return new RestOrderExecutor(
        config,
        eventBus,
        RepricePolicies.fromConfig(config),
        new RejectionClassifier(),
        clock,
        sleeper);
  }

  private PaperVenueClient paperClient(Duration restingFillDelay) {
    PaperVenueClient client = new PaperVenueClient("paper", false, restingFillDelay, clock);
    client.updateOrderBook(book("100", "101", 6));
    return client;
  }

  private static ExchangeSession session(VenueClient client) {
    return new ExchangeSession(Venue.rest("paper", client), 4);
  }

  private static ExecutorConfig.Builder config() {
    return ExecutorConfig.builder(ExecutionStrategy.FAST, new BigDecimal("0.05"));
  }

  private static OrderRequest buyLimit() {
    return OrderRequest.limit("paper", SYMBOL, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100"));
  }

  private static OrderRequest buyMarket() {
    return OrderRequest.market("paper", SYMBOL, OrderSide.BUY, BigDecimal.ONE);
  }

  private static VenueOrder order(String id, OrderStatus status, String filled) {
    return new VenueOrder(
        id,
        SYMBOL,
        OrderSide.BUY,
        status,
        BigDecimal.ONE,
        new BigDecimal(filled),
        new BigDecimal("100"),
        new BigDecimal("100"),
        Instant.parse("2026-03-01T00:00:00Z"));
  }
}
