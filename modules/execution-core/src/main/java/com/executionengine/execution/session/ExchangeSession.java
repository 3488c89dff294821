package com.executionengine.execution.session;

import com.executionengine.execution.errors.OrderExecutionException;
import com.executionengine.integration.venue.OrderBookSnapshot;
import com.executionengine.integration.venue.Venue;
import com.executionengine.integration.venue.VenueStream;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-venue state for one routed batch: margin setup done so far, the order concurrency limit,
 * the stream circuit breaker and pre-warmed book subscriptions.
 */
public class ExchangeSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ExchangeSession.class);

  private final Venue venue;
  private final Semaphore orderSlots;
  private final int maxConcurrentOrders;
  private final Map<String, CompletableFuture<Void>> marginSetups = new ConcurrentHashMap<>();
  private final Map<String, VenueStream<OrderBookSnapshot>> prewarmedBooks =
      new ConcurrentHashMap<>();
  private final AtomicBoolean circuitOpen = new AtomicBoolean(false);

  public ExchangeSession(Venue venue, int maxConcurrentOrders) {
    this.venue = Objects.requireNonNull(venue, "venue must not be null");
    if (maxConcurrentOrders < 1) {
      throw new IllegalArgumentException("maxConcurrentOrders must be >= 1");
    }
    this.maxConcurrentOrders = maxConcurrentOrders;
    this.orderSlots = new Semaphore(maxConcurrentOrders, true);
  }

  public Venue venue() {
    return venue;
  }

  public String venueId() {
    return venue.id();
  }

  /** Opens a book subscription ahead of the first order. Failures are logged only. */
  public void initialize(String symbol) {
    if (!venue.streamingCapable()) {
      return;
    }
    try {
      VenueStream<OrderBookSnapshot> stream = venue.client().subscribeOrderBook(symbol);
      VenueStream<OrderBookSnapshot> previous = prewarmedBooks.put(symbol, stream);
      if (previous != null) {
        previous.close();
      }
      log.debug("Book stream pre-warmed venue={} symbol={}", venue.id(), symbol);
    } catch (RuntimeException ex) {
      log.debug(
          "Book stream pre-warm failed venue={} symbol={} error={}",
          venue.id(),
          symbol,
          ex.toString());
    }
  }

  /** Hands a pre-warmed book subscription to its first taker; null when none is waiting. */
  public VenueStream<OrderBookSnapshot> takePrewarmedBookStream(String symbol) {
    return prewarmedBooks.remove(symbol);
  }

  /**
   * Sets margin mode and leverage for {@code symbol} once per session. Concurrent callers for the
   * same symbol wait until the first caller's setup has finished.
   */
  public void ensureMarginInitialized(String symbol) {
    CompletableFuture<Void> setup = new CompletableFuture<>();
    CompletableFuture<Void> existing = marginSetups.putIfAbsent(symbol, setup);
    if (existing != null) {
      existing.join();
      return;
    }
    try {
      applyMarginMode(symbol);
      applyLeverage(symbol);
    } finally {
      setup.complete(null);
    }
  }

  public boolean isMarginInitialized(String symbol) {
    CompletableFuture<Void> setup = marginSetups.get(symbol);
    return setup != null && setup.isDone();
  }

  public void markCircuitOpen() {
    if (circuitOpen.compareAndSet(false, true)) {
      log.warn("Stream circuit opened venue={}", venue.id());
    }
  }

  public boolean isCircuitOpen() {
    return circuitOpen.get();
  }

  public int maxConcurrentOrders() {
    return maxConcurrentOrders;
  }

  public int availableOrderSlots() {
    return orderSlots.availablePermits();
  }

  /** Runs {@code work} while holding one of the venue's order slots. */
  public <T> T withOrderSlot(Supplier<T> work) {
    try {
      orderSlots.acquire();
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new OrderExecutionException(
          "Interrupted waiting for an order slot", venue.id(), null, interrupted);
    }
    try {
      return work.get();
    } finally {
      orderSlots.release();
    }
  }

  @Override
  public void close() {
    for (VenueStream<OrderBookSnapshot> stream : prewarmedBooks.values()) {
      stream.close();
    }
    prewarmedBooks.clear();
  }

  private void applyMarginMode(String symbol) {
    try {
      venue.client().setMarginMode(venue.marginMode(), symbol);
    } catch (RuntimeException ex) {
      log.debug(
          "Margin mode setup failed venue={} symbol={} mode={} error={}",
          venue.id(),
          symbol,
          venue.marginMode(),
          ex.toString());
    }
  }

  private void applyLeverage(String symbol) {
    try {
      venue.client().setLeverage(venue.leverage(), symbol);
    } catch (RuntimeException ex) {
      log.debug(
          "Leverage setup failed venue={} symbol={} leverage={} error={}",
          venue.id(),
          symbol,
          venue.leverage(),
          ex.toString());
    }
  }
}
