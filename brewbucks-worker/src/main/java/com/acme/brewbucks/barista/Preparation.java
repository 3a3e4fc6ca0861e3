package com.acme.brewbucks.barista;

import com.acme.brewbucks.documents.DocMeta;
import com.acme.brewbucks.documents.HasMailbox;
import com.acme.brewbucks.documents.Mailbox;
import com.acme.brewbucks.documents.Versioned;
import com.acme.brewbucks.ids.EntityPrefix;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.menu.Drink;
import com.acme.brewbucks.orders.Order;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;

/**
 * The barista's ticket for one order. Its id is derived from the order id, so an order never gets
 * more than one ticket.
 */
@EntityPrefix("preparation")
public class Preparation implements Versioned<Preparation>, HasMailbox<PreparationMsg> {

  @Getter @JsonUnwrapped private DocMeta<Preparation> meta;

  @Getter
  @JsonProperty("drink_id")
  private Id<Drink> drinkId;

  @Getter
  @JsonProperty("order_id")
  private Id<Order> orderId;

  @JsonProperty("_outgoing")
  @JsonDeserialize(as = LinkedHashSet.class)
  private Set<PreparationMsg> outgoing = Mailbox.newOutgoing();

  @SuppressWarnings("unused")
  private Preparation() {}

  public static Id<Preparation> idFor(Id<Order> orderId) {
    return Id.hashed(Preparation.class, orderId);
  }

  /** A new, unsaved ticket whose drink is ready to be handed back to the order. */
  public static Preparation forOrder(Id<Drink> drinkId, Id<Order> orderId) {
    Preparation preparation = new Preparation();
    preparation.meta = new DocMeta<>(idFor(orderId));
    preparation.drinkId = drinkId;
    preparation.orderId = orderId;
    preparation.getMailbox().send(new PreparationMsg.DrinkPrepared(orderId));
    return preparation;
  }

  public Id<Preparation> getId() {
    return meta.getId();
  }

  @Override
  public Mailbox<PreparationMsg> getMailbox() {
    return new Mailbox<>(outgoing);
  }
}
