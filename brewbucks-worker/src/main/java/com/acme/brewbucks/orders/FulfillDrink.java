package com.acme.brewbucks.orders;

import com.acme.brewbucks.command.DomainCommand;
import com.acme.brewbucks.ids.Id;
import java.util.Objects;

/** Marks an order as made. Safe to repeat. */
public record FulfillDrink(Id<Order> orderId) implements DomainCommand {
  public FulfillDrink {
    Objects.requireNonNull(orderId, "orderId");
  }
}
