package com.acme.brewbucks.orders;

import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.documents.NotFoundException;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.ids.IdGen;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Domain service for Order operations. */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class OrderService {
  private final DocumentStore store;
  private final IdGen idGen;

  public Id<Order> placeOrder(PlaceOrder cmd) {
    Order order = Order.place(idGen.generate(Order.class), cmd.drinkId());
    store.save(order);
    log.info("Order {} placed for drink {}", order.getId(), cmd.drinkId());
    return order.getId();
  }

  /**
   * @throws NotFoundException if the order does not exist
   * @throws com.acme.brewbucks.documents.ConcurrencyException if the order changed concurrently
   */
  public OrderStatus fulfillDrink(FulfillDrink cmd) {
    Order order = load(cmd.orderId());
    if (order.markMade()) {
      store.save(order);
      log.info("Order {} fulfilled", order.getId());
    } else {
      log.debug("Order {} was already fulfilled", order.getId());
    }
    return OrderStatus.of(order);
  }

  /**
   * @throws NotFoundException if the order does not exist
   */
  public OrderStatus queryOrder(QueryOrder cmd) {
    return OrderStatus.of(load(cmd.orderId()));
  }

  private Order load(Id<Order> id) {
    return store.load(Order.class, id).orElseThrow(() -> new NotFoundException(id.toString()));
  }
}
