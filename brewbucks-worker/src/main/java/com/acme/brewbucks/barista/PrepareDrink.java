package com.acme.brewbucks.barista;

import com.acme.brewbucks.command.DomainCommand;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.menu.Drink;
import com.acme.brewbucks.orders.Order;
import java.util.Objects;

/** Asks the barista to make a drink for an order. Safe to repeat. */
public record PrepareDrink(Id<Drink> drinkId, Id<Order> orderId) implements DomainCommand {
  public PrepareDrink {
    Objects.requireNonNull(drinkId, "drinkId");
    Objects.requireNonNull(orderId, "orderId");
  }
}
