package com.acme.brewbucks.orders;

import com.acme.brewbucks.documents.DocMeta;
import com.acme.brewbucks.documents.HasMailbox;
import com.acme.brewbucks.documents.Mailbox;
import com.acme.brewbucks.documents.Versioned;
import com.acme.brewbucks.ids.EntityPrefix;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.menu.Drink;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import lombok.Getter;

/** Aggregate root for a customer's order of one drink. */
@EntityPrefix("order")
public class Order implements Versioned<Order>, HasMailbox<OrderMsg> {

  @Getter @JsonUnwrapped private DocMeta<Order> meta;

  @Getter
  @JsonProperty("drink_id")
  private Id<Drink> drinkId;

  @Getter
  @JsonProperty("is_made")
  private boolean made;

  @JsonProperty("_outgoing")
  @JsonDeserialize(as = LinkedHashSet.class)
  private Set<OrderMsg> outgoing = Mailbox.newOutgoing();

  private Order(Id<Order> id, Id<Drink> drinkId) {
    this.meta = new DocMeta<>(id);
    this.drinkId = Objects.requireNonNull(drinkId, "drinkId");
  }

  @SuppressWarnings("unused")
  private Order() {}

  /** A new, unsaved order that will ask for its drink to be prepared. */
  public static Order place(Id<Order> id, Id<Drink> drinkId) {
    Order order = new Order(id, drinkId);
    order.getMailbox().send(new OrderMsg.DrinkRequest(drinkId, id));
    return order;
  }

  public Id<Order> getId() {
    return meta.getId();
  }

  /**
   * @return false if the order was already made
   */
  public boolean markMade() {
    boolean changed = !made;
    made = true;
    return changed;
  }

  @Override
  public Mailbox<OrderMsg> getMailbox() {
    return new Mailbox<>(outgoing);
  }
}
