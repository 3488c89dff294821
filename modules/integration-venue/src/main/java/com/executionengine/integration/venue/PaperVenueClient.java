package com.executionengine.integration.venue;

import com.executionengine.domain.orders.OrderSide;
import com.executionengine.domain.orders.OrderStatus;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory venue. Limit orders that cross the book fill at once; resting limit orders fill at
 * their own price once {@code restingFillDelay} has passed and they are next observed. Market
 * orders fill at the best opposite level.
 */
public class PaperVenueClient implements VenueClient {
  private static final Logger log = LoggerFactory.getLogger(PaperVenueClient.class);

  private final String venueId;
  private final boolean streaming;
  private final Duration restingFillDelay;
  private final Clock clock;
  private final AtomicLong sequence = new AtomicLong();
  private final Map<String, OrderBookSnapshot> books = new ConcurrentHashMap<>();
  private final Map<String, PaperOrder> orders = new ConcurrentHashMap<>();
  private final Map<String, String> marginModes = new ConcurrentHashMap<>();
  private final Map<String, Integer> leverages = new ConcurrentHashMap<>();
  private final List<Subscription<OrderBookSnapshot>> bookSubscriptions =
      new CopyOnWriteArrayList<>();
  private final List<Subscription<List<VenueOrder>>> orderSubscriptions =
      new CopyOnWriteArrayList<>();

  public PaperVenueClient(String venueId, boolean streaming, Duration restingFillDelay) {
    this(venueId, streaming, restingFillDelay, Clock.systemUTC());
  }

  public PaperVenueClient(
      String venueId, boolean streaming, Duration restingFillDelay, Clock clock) {
    if (venueId == null || venueId.isBlank()) {
      throw new IllegalArgumentException("venueId must not be blank");
    }
    this.venueId = venueId;
    this.streaming = streaming;
    this.restingFillDelay =
        Objects.requireNonNull(restingFillDelay, "restingFillDelay must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public void updateOrderBook(OrderBookSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    books.put(snapshot.symbol(), snapshot);
    for (Subscription<OrderBookSnapshot> subscription : bookSubscriptions) {
      if (subscription.symbol().equals(snapshot.symbol())) {
        subscription.stream().publish(snapshot);
      }
    }
  }

  @Override
  public synchronized VenueOrder createLimitOrder(
      String symbol,
      OrderSide side,
      BigDecimal amount,
      BigDecimal price,
      Map<String, Object> params) {
    OrderBookSnapshot book = requireBook(symbol);
    boolean crosses =
        side == OrderSide.BUY
            ? book.bestAsk().map(ask -> price.compareTo(ask) >= 0).orElse(false)
            : book.bestBid().map(bid -> price.compareTo(bid) <= 0).orElse(false);
    VenueOrder order =
        crosses
            ? filledOrder(nextId(), symbol, side, amount, price)
            : new VenueOrder(
                nextId(), symbol, side, OrderStatus.OPEN, amount, BigDecimal.ZERO, price, null, clock.instant());
    store(order);
    log.info(
        "Paper limit order accepted venue={} orderId={} symbol={} side={} amount={} price={} status={}",
        venueId,
        order.id(),
        symbol,
        side,
        amount,
        price,
        order.status());
    return order;
  }

  @Override
  public synchronized VenueOrder createMarketOrder(
      String symbol, OrderSide side, BigDecimal amount, Map<String, Object> params) {
    OrderBookSnapshot book = requireBook(symbol);
    BigDecimal price =
        (side == OrderSide.BUY ? book.bestAsk() : book.bestBid())
            .orElseThrow(() -> new VenueException(venueId, "Empty book side for " + symbol));
    VenueOrder order = filledOrder(nextId(), symbol, side, amount, price);
    store(order);
    log.info(
        "Paper market order filled venue={} orderId={} symbol={} side={} amount={} price={}",
        venueId,
        order.id(),
        symbol,
        side,
        amount,
        price);
    return order;
  }

  @Override
  public synchronized void cancelOrder(String orderId, String symbol) {
    PaperOrder existing = orders.get(orderId);
    if (existing == null) {
      throw new OrderNotFoundException(venueId, "Unknown order " + orderId);
    }
    VenueOrder order = existing.order();
    if (order.status() != OrderStatus.OPEN) {
      return;
    }
    store(
        new VenueOrder(
            order.id(),
            order.symbol(),
            order.side(),
            OrderStatus.CANCELED,
            order.amount(),
            order.filled(),
            order.price(),
            order.average(),
            clock.instant()));
  }

  @Override
  public synchronized List<VenueOrder> fetchOpenOrders(String symbol) {
    List<VenueOrder> open = new ArrayList<>();
    for (PaperOrder paperOrder : orders.values()) {
      VenueOrder order = settle(paperOrder);
      if (order.status() == OrderStatus.OPEN && order.symbol().equals(symbol)) {
        open.add(order);
      }
    }
    return open;
  }

  @Override
  public synchronized VenueOrder fetchOrder(String orderId, String symbol) {
    PaperOrder paperOrder = orders.get(orderId);
    if (paperOrder == null) {
      throw new OrderNotFoundException(venueId, "Unknown order " + orderId);
    }
    return settle(paperOrder);
  }

  @Override
  public OrderBookSnapshot fetchOrderBook(String symbol) {
    return requireBook(symbol);
  }

  @Override
  public void setMarginMode(String marginMode, String symbol) {
    marginModes.put(symbol, marginMode);
    log.debug("Paper margin mode set venue={} symbol={} mode={}", venueId, symbol, marginMode);
  }

  @Override
  public void setLeverage(int leverage, String symbol) {
    leverages.put(symbol, leverage);
    log.debug("Paper leverage set venue={} symbol={} leverage={}", venueId, symbol, leverage);
  }

  @Override
  public boolean supportsStreaming() {
    return streaming;
  }

  @Override
  public VenueStream<OrderBookSnapshot> subscribeOrderBook(String symbol) {
    requireStreaming();
    QueueVenueStream<OrderBookSnapshot> stream =
        new QueueVenueStream<>(venueId, closed -> bookSubscriptions.removeIf(s -> s.stream() == closed));
    bookSubscriptions.add(new Subscription<>(symbol, stream));
    OrderBookSnapshot current = books.get(symbol);
    if (current != null) {
      stream.publish(current);
    }
    return stream;
  }

  @Override
  public VenueStream<List<VenueOrder>> subscribeOrders(String symbol) {
    requireStreaming();
    QueueVenueStream<List<VenueOrder>> stream =
        new QueueVenueStream<>(venueId, closed -> orderSubscriptions.removeIf(s -> s.stream() == closed));
    orderSubscriptions.add(new Subscription<>(symbol, stream));
    return stream;
  }

  public String venueId() {
    return venueId;
  }

  public String marginMode(String symbol) {
    return marginModes.get(symbol);
  }

  public Integer leverage(String symbol) {
    return leverages.get(symbol);
  }

  private VenueOrder settle(PaperOrder paperOrder) {
    VenueOrder order = paperOrder.order();
    if (order.status() != OrderStatus.OPEN) {
      return order;
    }
    Duration resting = Duration.between(paperOrder.createdAt(), clock.instant());
    if (resting.compareTo(restingFillDelay) < 0) {
      return order;
    }
    VenueOrder filled =
        filledOrder(order.id(), order.symbol(), order.side(), order.amount(), order.price());
    orders.put(filled.id(), new PaperOrder(filled, paperOrder.createdAt()));
    publishOrder(filled);
    return filled;
  }

  private void store(VenueOrder order) {
    PaperOrder previous = orders.get(order.id());
    Instant createdAt = previous == null ? clock.instant() : previous.createdAt();
    orders.put(order.id(), new PaperOrder(order, createdAt));
    publishOrder(order);
  }

  private void publishOrder(VenueOrder order) {
    for (Subscription<List<VenueOrder>> subscription : orderSubscriptions) {
      if (subscription.symbol().equals(order.symbol())) {
        subscription.stream().publish(List.of(order));
      }
    }
  }

  private VenueOrder filledOrder(
      String id, String symbol, OrderSide side, BigDecimal amount, BigDecimal price) {
    return new VenueOrder(
        id, symbol, side, OrderStatus.CLOSED, amount, amount, price, price, clock.instant());
  }

  private OrderBookSnapshot requireBook(String symbol) {
    OrderBookSnapshot book = books.get(symbol);
    if (book == null) {
      throw new BadSymbolException(venueId, "Unknown symbol " + symbol);
    }
    return book;
  }

  private void requireStreaming() {
    if (!streaming) {
      throw new UnsupportedOperationException("Paper venue " + venueId + " is REST only");
    }
  }

  private String nextId() {
    return venueId + "-" + sequence.incrementAndGet();
  }

  private record PaperOrder(VenueOrder order, Instant createdAt) {}

  private record Subscription<T>(String symbol, QueueVenueStream<T> stream) {}
}
