package com.executionengine.domain.orders;

public enum OrderSide {
  BUY,
  SELL
}
