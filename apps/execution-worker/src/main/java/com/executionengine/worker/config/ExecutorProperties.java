package com.executionengine.worker.config;

import com.executionengine.execution.config.ExecutionStrategy;
import com.executionengine.execution.config.ExecutorConfig;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "execution.executor")
public class ExecutorProperties {
  private ExecutionStrategy execution = ExecutionStrategy.BEST_PRICE;
  private BigDecimal maxSpreadPct = new BigDecimal("0.01");
  private BigDecimal minRepriceThresholdPct = ExecutorConfig.DEFAULT_MIN_REPRICE_THRESHOLD_PCT;
  private Duration repriceOverrideAfter = ExecutorConfig.DEFAULT_REPRICE_OVERRIDE_AFTER;
  private Duration timeout = ExecutorConfig.DEFAULT_TIMEOUT;
  private Duration wsStalenessWindow = ExecutorConfig.DEFAULT_WS_STALENESS_WINDOW;
  private int maxWsReconnectAttempts = ExecutorConfig.DEFAULT_MAX_WS_RECONNECT_ATTEMPTS;
  private int maxConcurrentOrdersPerExchange =
      ExecutorConfig.DEFAULT_MAX_CONCURRENT_ORDERS_PER_EXCHANGE;
  private int orderThreads = 16;

  public ExecutorConfig toExecutorConfig() {
    return ExecutorConfig.builder(execution, maxSpreadPct)
        .minRepriceThresholdPct(minRepriceThresholdPct)
        .repriceOverrideAfter(repriceOverrideAfter)
        .timeout(timeout)
        .wsStalenessWindow(wsStalenessWindow)
        .maxWsReconnectAttempts(maxWsReconnectAttempts)
        .maxConcurrentOrdersPerExchange(maxConcurrentOrdersPerExchange)
        .build();
  }

  public ExecutionStrategy getExecution() {
    return execution;
  }

  public void setExecution(ExecutionStrategy execution) {
    this.execution = execution;
  }

  public BigDecimal getMaxSpreadPct() {
    return maxSpreadPct;
  }

  public void setMaxSpreadPct(BigDecimal maxSpreadPct) {
    this.maxSpreadPct = maxSpreadPct;
  }

  public BigDecimal getMinRepriceThresholdPct() {
    return minRepriceThresholdPct;
  }

  public void setMinRepriceThresholdPct(BigDecimal minRepriceThresholdPct) {
    this.minRepriceThresholdPct = minRepriceThresholdPct;
  }

  public Duration getRepriceOverrideAfter() {
    return repriceOverrideAfter;
  }

  public void setRepriceOverrideAfter(Duration repriceOverrideAfter) {
    this.repriceOverrideAfter = repriceOverrideAfter;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Duration getWsStalenessWindow() {
    return wsStalenessWindow;
  }

  public void setWsStalenessWindow(Duration wsStalenessWindow) {
    this.wsStalenessWindow = wsStalenessWindow;
  }

  public int getMaxWsReconnectAttempts() {
    return maxWsReconnectAttempts;
  }

  public void setMaxWsReconnectAttempts(int maxWsReconnectAttempts) {
    this.maxWsReconnectAttempts = maxWsReconnectAttempts;
  }

  public int getMaxConcurrentOrdersPerExchange() {
    return maxConcurrentOrdersPerExchange;
  }

  public void setMaxConcurrentOrdersPerExchange(int maxConcurrentOrdersPerExchange) {
    this.maxConcurrentOrdersPerExchange = maxConcurrentOrdersPerExchange;
  }

  public int getOrderThreads() {
    return orderThreads;
  }

  public void setOrderThreads(int orderThreads) {
    this.orderThreads = orderThreads;
  }
}
