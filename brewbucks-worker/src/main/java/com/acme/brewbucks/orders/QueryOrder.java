package com.acme.brewbucks.orders;

import com.acme.brewbucks.command.DomainCommand;
import com.acme.brewbucks.ids.Id;
import java.util.Objects;

public record QueryOrder(Id<Order> orderId) implements DomainCommand {
  public QueryOrder {
    Objects.requireNonNull(orderId, "orderId");
  }
}
