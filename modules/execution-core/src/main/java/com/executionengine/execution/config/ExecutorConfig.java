package com.executionengine.execution.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

public record ExecutorConfig(
    ExecutionStrategy execution,
    BigDecimal maxSpreadPct,
    BigDecimal minRepriceThresholdPct,
    Duration repriceOverrideAfter,
    Duration timeout,
    Duration wsStalenessWindow,
    int maxWsReconnectAttempts,
    int maxConcurrentOrdersPerExchange) {
  public static final BigDecimal DEFAULT_MIN_REPRICE_THRESHOLD_PCT = BigDecimal.ZERO;
  public static final Duration DEFAULT_REPRICE_OVERRIDE_AFTER = Duration.ZERO;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration DEFAULT_WS_STALENESS_WINDOW = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_WS_RECONNECT_ATTEMPTS = 5;
  public static final int DEFAULT_MAX_CONCURRENT_ORDERS_PER_EXCHANGE = 10;

  public ExecutorConfig {
    Objects.requireNonNull(execution, "execution must not be null");
    Objects.requireNonNull(maxSpreadPct, "maxSpreadPct must not be null");
    if (maxSpreadPct.signum() < 0 || maxSpreadPct.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("maxSpreadPct must be between 0 and 1");
    }
    minRepriceThresholdPct =
        minRepriceThresholdPct == null ? DEFAULT_MIN_REPRICE_THRESHOLD_PCT : minRepriceThresholdPct;
    if (minRepriceThresholdPct.signum() < 0) {
      throw new IllegalArgumentException("minRepriceThresholdPct must be >= 0");
    }
    repriceOverrideAfter =
        repriceOverrideAfter == null ? DEFAULT_REPRICE_OVERRIDE_AFTER : repriceOverrideAfter;
    requireNotNegative(repriceOverrideAfter, "repriceOverrideAfter");
    timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    requirePositive(timeout, "timeout");
    wsStalenessWindow = wsStalenessWindow == null ? DEFAULT_WS_STALENESS_WINDOW : wsStalenessWindow;
    requirePositive(wsStalenessWindow, "wsStalenessWindow");
    if (maxWsReconnectAttempts < 0) {
      throw new IllegalArgumentException("maxWsReconnectAttempts must be >= 0");
    }
    if (maxConcurrentOrdersPerExchange < 1) {
      throw new IllegalArgumentException("maxConcurrentOrdersPerExchange must be >= 1");
    }
  }

  public static Builder builder(ExecutionStrategy execution, BigDecimal maxSpreadPct) {
    return new Builder(execution, maxSpreadPct);
  }

  /** Zero means reconnect attempts are unbounded. */
  public boolean reconnectAttemptsUnlimited() {
    return maxWsReconnectAttempts == 0;
  }

  private static void requirePositive(Duration value, String fieldName) {
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be > 0");
    }
  }

  private static void requireNotNegative(Duration value, String fieldName) {
    if (value.isNegative()) {
      throw new IllegalArgumentException(fieldName + " must be >= 0");
    }
  }

  public static final class Builder {
    private final ExecutionStrategy execution;
    private final BigDecimal maxSpreadPct;
    private BigDecimal minRepriceThresholdPct = DEFAULT_MIN_REPRICE_THRESHOLD_PCT;
    private Duration repriceOverrideAfter = DEFAULT_REPRICE_OVERRIDE_AFTER;
    private Duration timeout = DEFAULT_TIMEOUT;
    private Duration wsStalenessWindow = DEFAULT_WS_STALENESS_WINDOW;
    private int maxWsReconnectAttempts = DEFAULT_MAX_WS_RECONNECT_ATTEMPTS;
    private int maxConcurrentOrdersPerExchange = DEFAULT_MAX_CONCURRENT_ORDERS_PER_EXCHANGE;

    private Builder(ExecutionStrategy execution, BigDecimal maxSpreadPct) {
      this.execution = execution;
      this.maxSpreadPct = maxSpreadPct;
    }

    public Builder minRepriceThresholdPct(BigDecimal minRepriceThresholdPct) {
      this.minRepriceThresholdPct = minRepriceThresholdPct;
      return this;
    }

    public Builder repriceOverrideAfter(Duration repriceOverrideAfter) {
      this.repriceOverrideAfter = repriceOverrideAfter;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder wsStalenessWindow(Duration wsStalenessWindow) {
      this.wsStalenessWindow = wsStalenessWindow;
      return this;
    }

    public Builder maxWsReconnectAttempts(int maxWsReconnectAttempts) {
      this.maxWsReconnectAttempts = maxWsReconnectAttempts;
      return this;
    }

    public Builder maxConcurrentOrdersPerExchange(int maxConcurrentOrdersPerExchange) {
      this.maxConcurrentOrdersPerExchange = maxConcurrentOrdersPerExchange;
      return this;
    }

    public ExecutorConfig build() {
      return new ExecutorConfig(
          execution,
          maxSpreadPct,
          minRepriceThresholdPct,
          repriceOverrideAfter,
          timeout,
          wsStalenessWindow,
          maxWsReconnectAttempts,
          maxConcurrentOrdersPerExchange);
    }
  }
}
