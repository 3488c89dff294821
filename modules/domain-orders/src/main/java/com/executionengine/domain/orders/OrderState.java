package com.executionengine.domain.orders;

public enum OrderState {
  PENDING,
  SUBMITTED,
  PARTIALLY_FILLED,
  FILLED,
  CANCELLED,
  TIMED_OUT,
  FAILED,

  // executor-internal phases
  INITIALIZING,
  CREATING_ORDER,
  MONITORING_ORDER,
  UPDATING_ORDER,
  WAIT_UNTIL_ORDER_CANCELLED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELLED || this == TIMED_OUT || this == FAILED;
  }

  public boolean isInternal() {
    return ordinal() >= INITIALIZING.ordinal();
  }
}
