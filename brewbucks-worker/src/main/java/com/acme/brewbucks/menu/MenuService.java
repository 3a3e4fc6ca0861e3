package com.acme.brewbucks.menu;

import com.acme.brewbucks.documents.ConcurrencyException;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.documents.NotFoundException;
import com.acme.brewbucks.ids.Id;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds and reads the menu. Drinks and the list use hashed ids, so any number of instances can run
 * {@link #setup()} at once and still converge on the same documents.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class MenuService {
  static final List<String> HOUSE_DRINKS = List.of("Umbrella", "Fnordy");

  private final DocumentStore store;

  public void setup() {
    List<Id<Drink>> ids = HOUSE_DRINKS.stream().map(this::ensureDrink).toList();

    Optional<DrinkList> current = store.load(DrinkList.class, DrinkList.ID);
    if (current.isPresent() && current.get().getDrinks().containsAll(ids)) {
      log.debug("Menu already lists {}", HOUSE_DRINKS);
      return;
    }
    store.modify(
        DrinkList.class,
        DrinkList.ID,
        existing -> {
          DrinkList list = existing.orElseGet(DrinkList::empty);
          ids.forEach(list::add);
          return list;
        });
    log.info("Menu seeded with {}", HOUSE_DRINKS);
  }

  /**
   * @throws NotFoundException if the menu was never set up
   */
  public List<Drink> showMenu() {
    DrinkList list =
        store
            .load(DrinkList.class, DrinkList.ID)
            .orElseThrow(() -> new NotFoundException(DrinkList.ID.toString()));
    return list.getDrinks().stream()
        .map(id -> store.load(Drink.class, id))
        .flatMap(Optional::stream)
        .toList();
  }

  private Id<Drink> ensureDrink(String name) {
    Id<Drink> id = Id.hashed(Drink.class, name);
    if (store.load(Drink.class, id).isEmpty()) {
      try {
        store.save(new Drink(id, name));
        log.info("Added drink {} as {}", name, id);
      } catch (ConcurrencyException e) {
        log.debug("Drink {} was added concurrently", name);
      }
    }
    return id;
  }
}
