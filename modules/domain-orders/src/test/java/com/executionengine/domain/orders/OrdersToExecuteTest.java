package com.executionengine.domain.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class OrdersToExecuteTest {
  @Test
  void shouldYieldUpdatesBeforeNewOrders() {
    OrderRequest update =
        OrderRequest.market("binance", "BTC/USDT", OrderSide.SELL, new BigDecimal("0.1"));
    OrderRequest fresh =
        OrderRequest.market("binance", "ETH/USDT", OrderSide.BUY, new BigDecimal("1"));

    OrdersToExecute batch = new OrdersToExecute(List.of(update), List.of(fresh));

    assertEquals(List.of(update, fresh), batch.all());
    assertEquals(2, batch.count());
  }

  @Test
  void shouldDropNewOrderDuplicatingAnUpdate() {
    OrderRequest update =
        OrderRequest.market("binance", "BTC/USDT", OrderSide.SELL, new BigDecimal("0.1"));
    OrderRequest duplicate =
        OrderRequest.market("binance", "BTC/USDT", OrderSide.SELL, new BigDecimal("0.3"));

    OrdersToExecute batch = new OrdersToExecute(List.of(update), List.of(duplicate));

    assertEquals(1, batch.count());
    assertTrue(batch.newOrders().isEmpty());
  }

  @Test
  void shouldReportEmptyBatch() {
    assertTrue(OrdersToExecute.empty().isEmpty());
    assertTrue(new OrdersToExecute(null, null).isEmpty());
  }
}
