package com.acme.brewbucks.barista;

import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.orders.Order;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Messages a preparation ticket sends out. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = PreparationMsg.DrinkPrepared.class, name = "drink_prepared")
})
public sealed interface PreparationMsg {

  <R> R accept(Handler<R> handler);

  interface Handler<R> {
    R onDrinkPrepared(DrinkPrepared prepared);
  }

  /** Tells the order its drink is ready. */
  record DrinkPrepared(@JsonProperty("order_id") Id<Order> orderId) implements PreparationMsg {

    @Override
    public <R> R accept(Handler<R> handler) {
      return handler.onDrinkPrepared(this);
    }
  }
}
