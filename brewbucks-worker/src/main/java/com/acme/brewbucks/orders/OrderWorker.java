package com.acme.brewbucks.orders;

import com.acme.brewbucks.barista.BaristaService;
import com.acme.brewbucks.barista.PrepareDrink;
import com.acme.brewbucks.command.CommandHandler;
import com.acme.brewbucks.config.WorkerConfig;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.outbox.MailboxWorker;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Delivers order messages to the barista. */
@Singleton
@Slf4j
public class OrderWorker extends MailboxWorker<Order, OrderMsg> {
  private final CommandHandler<PrepareDrink, ?> prepareDrink;

  @Inject
  public OrderWorker(DocumentStore store, WorkerConfig config, BaristaService barista) {
    this(store, config, barista::prepareDrink);
  }

  public OrderWorker(
      DocumentStore store, WorkerConfig config, CommandHandler<PrepareDrink, ?> prepareDrink) {
    super(store, Order.class, config);
    this.prepareDrink = prepareDrink;
  }

  @Override
  protected void deliver(OrderMsg message) {
    message.accept(
        new OrderMsg.Handler<Void>() {
          @Override
          public Void onDrinkRequest(OrderMsg.DrinkRequest request) {
            log.debug("Requesting {} for order {}", request.drinkId(), request.orderId());
            prepareDrink.handle(new PrepareDrink(request.drinkId(), request.orderId()));
            return null;
          }
        });
  }
}
