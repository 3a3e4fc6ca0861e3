package com.acme.brewbucks.orders;

import com.acme.brewbucks.ids.Id;

/** Read-only view of an order. */
public record OrderStatus(Id<Order> orderId, boolean made) {

  static OrderStatus of(Order order) {
    return new OrderStatus(order.getId(), order.isMade());
  }
}
