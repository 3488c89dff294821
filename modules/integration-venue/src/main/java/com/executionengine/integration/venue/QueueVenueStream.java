package com.executionengine.integration.venue;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/** Stream fed by an in-process producer through {@link #publish(Object)}. */
public class QueueVenueStream<T> implements VenueStream<T> {
  private static final long CLOSE_CHECK_MILLIS = 50L;

  private final String venueId;
  private final BlockingQueue<T> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Consumer<QueueVenueStream<T>> onClose;

  public QueueVenueStream(String venueId, Consumer<QueueVenueStream<T>> onClose) {
    this.venueId = venueId;
    this.onClose = Objects.requireNonNull(onClose, "onClose must not be null");
  }

  public void publish(T item) {
    if (!closed.get()) {
      queue.offer(item);
    }
  }

  @Override
  public T next() throws InterruptedException {
    while (true) {
      if (closed.get()) {
        throw new VenueNetworkException(venueId, "Stream closed");
      }
      T item = queue.poll(CLOSE_CHECK_MILLIS, TimeUnit.MILLISECONDS);
      if (item != null) {
        return item;
      }
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      onClose.accept(this);
    }
  }
}
