package com.executionengine.domain.orders;

public enum ExecutionStyle {
  MAKER,
  TAKER
}
