package com.executionengine.domain.orders;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

public final class OrderStateMachine {
  private static final Map<OrderState, EnumSet<OrderState>> ALLOWED_TRANSITIONS =
      new EnumMap<>(OrderState.class);

  static {
    ALLOWED_TRANSITIONS.put(
        OrderState.PENDING,
        EnumSet.of(
            OrderState.SUBMITTED,
            OrderState.FILLED,
            OrderState.CANCELLED,
            OrderState.TIMED_OUT,
            OrderState.FAILED));
    ALLOWED_TRANSITIONS.put(
        OrderState.SUBMITTED,
        EnumSet.of(
            OrderState.PARTIALLY_FILLED,
            OrderState.FILLED,
            OrderState.CANCELLED,
            OrderState.TIMED_OUT,
            OrderState.FAILED));
    ALLOWED_TRANSITIONS.put(
        OrderState.PARTIALLY_FILLED,
        EnumSet.of(
            OrderState.PARTIALLY_FILLED,
            OrderState.FILLED,
            OrderState.CANCELLED,
            OrderState.TIMED_OUT,
            OrderState.FAILED));
    ALLOWED_TRANSITIONS.put(OrderState.FILLED, EnumSet.noneOf(OrderState.class));
    ALLOWED_TRANSITIONS.put(OrderState.CANCELLED, EnumSet.noneOf(OrderState.class));
    ALLOWED_TRANSITIONS.put(OrderState.TIMED_OUT, EnumSet.of(OrderState.FILLED, OrderState.FAILED));
    ALLOWED_TRANSITIONS.put(OrderState.FAILED, EnumSet.noneOf(OrderState.class));

    ALLOWED_TRANSITIONS.put(OrderState.INITIALIZING, EnumSet.of(OrderState.CREATING_ORDER));
    ALLOWED_TRANSITIONS.put(
        OrderState.CREATING_ORDER,
        EnumSet.of(OrderState.CREATING_ORDER, OrderState.MONITORING_ORDER));
    ALLOWED_TRANSITIONS.put(
        OrderState.MONITORING_ORDER,
        EnumSet.of(
            OrderState.MONITORING_ORDER, OrderState.UPDATING_ORDER, OrderState.CREATING_ORDER));
    ALLOWED_TRANSITIONS.put(
        OrderState.UPDATING_ORDER,
        EnumSet.of(OrderState.WAIT_UNTIL_ORDER_CANCELLED, OrderState.MONITORING_ORDER));
    ALLOWED_TRANSITIONS.put(
        OrderState.WAIT_UNTIL_ORDER_CANCELLED, EnumSet.of(OrderState.CREATING_ORDER));
  }

  private OrderStateMachine() {}

  public static boolean canTransition(OrderState from, OrderState to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<OrderState> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(OrderState from, OrderState to) {
    if (!canTransition(from, to)) {
      throw new OrderDomainException("Invalid order state transition from " + from + " to " + to);
    }
  }
}
