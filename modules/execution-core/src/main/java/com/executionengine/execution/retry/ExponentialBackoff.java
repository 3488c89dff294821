package com.executionengine.execution.retry;

import java.time.Duration;

/** Delay for attempt n is {@code base * 2^(n-1)}, capped at {@code max}. */
public class ExponentialBackoff {
  private final long baseMs;
  private final long capMs;

  public ExponentialBackoff(long baseMs, long capMs) {
    if (baseMs <= 0L) {
      throw new IllegalArgumentException("baseMs must be > 0");
    }
    if (capMs < baseMs) {
      throw new IllegalArgumentException("capMs must be >= baseMs");
    }
    this.baseMs = baseMs;
    this.capMs = capMs;
  }

  public Duration backoffForAttempt(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
    long delay = baseMs;
    for (int i = 1; i < attempt && delay < capMs; i++) {
      delay *= 2L;
    }
    return Duration.ofMillis(Math.min(delay, capMs));
  }

  public Duration cap() {
    return Duration.ofMillis(capMs);
  }
}
