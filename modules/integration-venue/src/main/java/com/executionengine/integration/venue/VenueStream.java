package com.executionengine.integration.venue;

/**
 * Push subscription. {@link #next()} blocks until the venue delivers the next item and throws
 * {@link VenueNetworkException} when the transport drops; the subscription is dead afterwards.
 */
public interface VenueStream<T> extends AutoCloseable {
  T next() throws InterruptedException;

  @Override
  void close();
}
