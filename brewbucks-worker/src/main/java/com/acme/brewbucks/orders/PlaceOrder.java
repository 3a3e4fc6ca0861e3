package com.acme.brewbucks.orders;

import com.acme.brewbucks.command.DomainCommand;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.menu.Drink;
import java.util.Objects;

public record PlaceOrder(Id<Drink> drinkId) implements DomainCommand {
  public PlaceOrder {
    Objects.requireNonNull(drinkId, "drinkId");
  }
}
