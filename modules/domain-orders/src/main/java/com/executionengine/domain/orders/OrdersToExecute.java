package com.executionengine.domain.orders;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** A batch of orders. Updates to existing positions run ahead of new orders. */
public record OrdersToExecute(List<OrderRequest> updates, List<OrderRequest> newOrders) {
  public OrdersToExecute {
    updates = updates == null ? List.of() : List.copyOf(updates);
    List<OrderRequest> candidates = newOrders == null ? List.of() : newOrders;
    Set<String> updateKeys = new HashSet<>();
    for (OrderRequest update : updates) {
      updateKeys.add(key(update));
    }
    List<OrderRequest> accepted = new ArrayList<>();
    for (OrderRequest candidate : candidates) {
      if (!updateKeys.contains(key(candidate))) {
        accepted.add(candidate);
      }
    }
    newOrders = List.copyOf(accepted);
  }

  public static OrdersToExecute empty() {
    return new OrdersToExecute(List.of(), List.of());
  }

  public static OrdersToExecute ofNew(List<OrderRequest> newOrders) {
    return new OrdersToExecute(List.of(), newOrders);
  }

  public List<OrderRequest> all() {
    List<OrderRequest> all = new ArrayList<>(updates.size() + newOrders.size());
    all.addAll(updates);
    all.addAll(newOrders);
    return List.copyOf(all);
  }

  public int count() {
    return updates.size() + newOrders.size();
  }

  public boolean isEmpty() {
    return count() == 0;
  }

  private static String key(OrderRequest request) {
    return request.venueId() + ':' + request.symbol() + ':' + request.side();
  }
}
