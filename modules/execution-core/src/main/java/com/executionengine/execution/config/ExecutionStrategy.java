package com.executionengine.execution.config;

public enum ExecutionStrategy {
  /** Always quote at the best level of the book. */
  FAST,
  /** Start deeper in the book and move toward the best level as the order ages. */
  BEST_PRICE
}
