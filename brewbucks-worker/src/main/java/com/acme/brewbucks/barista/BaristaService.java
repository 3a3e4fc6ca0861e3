package com.acme.brewbucks.barista;

import com.acme.brewbucks.documents.ConcurrencyException;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.ids.Id;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Domain service for drink preparation. */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class BaristaService {
  private final DocumentStore store;

  /**
   * Opens the ticket for the order, or finds the one already opened by an earlier delivery of the
   * same request.
   */
  public Id<Preparation> prepareDrink(PrepareDrink cmd) {
    Id<Preparation> id = Preparation.idFor(cmd.orderId());
    if (store.load(Preparation.class, id).isPresent()) {
      log.info("Order {} already has preparation {}", cmd.orderId(), id);
      return id;
    }
    try {
      store.save(Preparation.forOrder(cmd.drinkId(), cmd.orderId()));
      log.info("Preparing {} for order {} as {}", cmd.drinkId(), cmd.orderId(), id);
    } catch (ConcurrencyException e) {
      log.info("Preparation {} was opened concurrently", id);
    }
    return id;
  }
}
