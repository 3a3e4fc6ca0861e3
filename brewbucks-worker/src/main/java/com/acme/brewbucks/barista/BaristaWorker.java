package com.acme.brewbucks.barista;

import com.acme.brewbucks.command.CommandHandler;
import com.acme.brewbucks.config.WorkerConfig;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.orders.FulfillDrink;
import com.acme.brewbucks.orders.OrderService;
import com.acme.brewbucks.outbox.MailboxWorker;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Delivers finished drinks back to their orders. */
@Singleton
@Slf4j
public class BaristaWorker extends MailboxWorker<Preparation, PreparationMsg> {
  private final CommandHandler<FulfillDrink, ?> fulfillDrink;

  @Inject
  public BaristaWorker(DocumentStore store, WorkerConfig config, OrderService orders) {
    this(store, config, orders::fulfillDrink);
  }

  public BaristaWorker(
      DocumentStore store, WorkerConfig config, CommandHandler<FulfillDrink, ?> fulfillDrink) {
    super(store, Preparation.class, config);
    this.fulfillDrink = fulfillDrink;
  }

  @Override
  protected void deliver(PreparationMsg message) {
    message.accept(
        new PreparationMsg.Handler<Void>() {
          @Override
          public Void onDrinkPrepared(PreparationMsg.DrinkPrepared prepared) {
            log.debug("Handing drink to order {}", prepared.orderId());
            fulfillDrink.handle(new FulfillDrink(prepared.orderId()));
            return null;
          }
        });
  }
}
