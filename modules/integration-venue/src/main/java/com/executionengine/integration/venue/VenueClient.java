package com.executionengine.integration.venue;

import com.executionengine.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public interface VenueClient {
  VenueOrder createLimitOrder(
      String symbol, OrderSide side, BigDecimal amount, BigDecimal price, Map<String, Object> params);

  VenueOrder createMarketOrder(
      String symbol, OrderSide side, BigDecimal amount, Map<String, Object> params);

  void cancelOrder(String orderId, String symbol);

  List<VenueOrder> fetchOpenOrders(String symbol);

  VenueOrder fetchOrder(String orderId, String symbol);

  OrderBookSnapshot fetchOrderBook(String symbol);

  void setMarginMode(String marginMode, String symbol);

  void setLeverage(int leverage, String symbol);

  default boolean supportsStreaming() {
    return false;
  }

  default VenueStream<OrderBookSnapshot> subscribeOrderBook(String symbol) {
    throw new UnsupportedOperationException("order book streaming is not supported");
  }

  default VenueStream<List<VenueOrder>> subscribeOrders(String symbol) {
    throw new UnsupportedOperationException("order streaming is not supported");
  }
}
