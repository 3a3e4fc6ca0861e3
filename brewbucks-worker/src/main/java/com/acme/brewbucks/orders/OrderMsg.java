package com.acme.brewbucks.orders;

import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.menu.Drink;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Messages an order sends out. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({@JsonSubTypes.Type(value = OrderMsg.DrinkRequest.class, name = "drink_request")})
public sealed interface OrderMsg {

  <R> R accept(Handler<R> handler);

  /** One method per message kind; adding a kind breaks every handler until it is covered. */
  interface Handler<R> {
    R onDrinkRequest(DrinkRequest request);
  }

  /** Asks the barista to prepare the ordered drink. */
  record DrinkRequest(
      @JsonProperty("drink_id") Id<Drink> drinkId, @JsonProperty("order_id") Id<Order> orderId)
      implements OrderMsg {

    @Override
    public <R> R accept(Handler<R> handler) {
      return handler.onDrinkRequest(this);
    }
  }
}
