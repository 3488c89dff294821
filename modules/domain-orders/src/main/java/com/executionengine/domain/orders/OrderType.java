package com.executionengine.domain.orders;

public enum OrderType {
  LIMIT,
  MARKET
}
