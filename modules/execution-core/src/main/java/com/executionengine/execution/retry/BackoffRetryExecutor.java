package com.executionengine.execution.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation up to {@code maxAttempts} times, sleeping between attempts. Non-retryable
 * failures and the final failure are rethrown unchanged.
 */
public class BackoffRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(BackoffRetryExecutor.class);

  private final int maxAttempts;
  private final IntFunction<Duration> delayForAttempt;
  private final Predicate<RuntimeException> retryable;
  private final Sleeper sleeper;

  public BackoffRetryExecutor(
      int maxAttempts,
      IntFunction<Duration> delayForAttempt,
      Predicate<RuntimeException> retryable,
      Sleeper sleeper) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.delayForAttempt =
        Objects.requireNonNull(delayForAttempt, "delayForAttempt must not be null");
    this.retryable = Objects.requireNonNull(retryable, "retryable must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public <T> T execute(String operationName, Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (RuntimeException ex) {
        if (!retryable.test(ex) || attempt >= maxAttempts) {
          throw ex;
        }
        Duration wait = delayForAttempt.apply(attempt);
        log.warn(
            "Retrying operation={} attempt={} maxAttempts={} delayMs={} error={}",
            operationName,
            attempt,
            maxAttempts,
            wait.toMillis(),
            ex.toString());
        sleep(wait);
        attempt++;
      }
    }
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during retry backoff", interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }
}
