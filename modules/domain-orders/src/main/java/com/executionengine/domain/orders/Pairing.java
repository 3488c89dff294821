package com.executionengine.domain.orders;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome latch shared between the caller that submitted an order and the component that sees
 * it finish. Both flags are monotonic: once set they stay set.
 */
public final class Pairing {
  private final Object monitor = new Object();
  private boolean filled;
  private boolean failed;

  public void notifyFilled() {
    synchronized (monitor) {
      if (!filled) {
        filled = true;
        monitor.notifyAll();
      }
    }
  }

  public void notifyFailed() {
    synchronized (monitor) {
      if (!failed) {
        failed = true;
        monitor.notifyAll();
      }
    }
  }

  public boolean isPairFilled() {
    synchronized (monitor) {
      return filled;
    }
  }

  public boolean isPairFailed() {
    synchronized (monitor) {
      return failed;
    }
  }

  public boolean isResolved() {
    synchronized (monitor) {
      return filled || failed;
    }
  }

  /** Blocks until either flag is set. Returns false if the timeout elapsed first. */
  public boolean awaitResolution(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout must not be null");
    long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
    synchronized (monitor) {
      while (!filled && !failed) {
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0L) {
          return false;
        }
        long millis = remainingNanos / 1_000_000L;
        int nanos = (int) (remainingNanos % 1_000_000L);
        monitor.wait(millis, nanos);
      }
      return true;
    }
  }

  public void awaitResolution() throws InterruptedException {
    synchronized (monitor) {
      while (!filled && !failed) {
        monitor.wait();
      }
    }
  }

  @Override
  public String toString() {
    synchronized (monitor) {
      return "Pairing[filled=" + filled + ", failed=" + failed + "]";
    }
  }
}
