package com.executionengine.infra.events;

public final class OrderEventNames {
  public static final String ORDER_SUBMITTED = "order_submitted";
  public static final String ORDER_FILL_PARTIAL = "order_fill_partial";
  public static final String ORDER_FILL_COMPLETE = "order_fill_complete";
  public static final String ORDER_FAILED = "order_failed";
  public static final String ORDER_REPRICED = "order_repriced";
  public static final String ORDER_REPRICE_SUPPRESSED = "order_reprice_suppressed";
  public static final String ORDER_TIMEOUT_FALLBACK = "order_timeout_fallback";
  public static final String ORDER_ORPHANED = "order_orphaned";
  public static final String WS_RECONNECT_ATTEMPT = "ws_reconnect_attempt";
  public static final String WS_CIRCUIT_OPEN = "ws_circuit_open";
  public static final String WS_STALENESS_FALLBACK = "ws_staleness_fallback";

  private OrderEventNames() {}
}
