package com.acme.brewbucks.menu;

import com.acme.brewbucks.documents.DocMeta;
import com.acme.brewbucks.documents.Versioned;
import com.acme.brewbucks.ids.EntityPrefix;
import com.acme.brewbucks.ids.Id;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;

/** The one list of drinks on offer, stored under a well-known hashed id. */
@EntityPrefix("drinklist")
public class DrinkList implements Versioned<DrinkList> {
  public static final Id<DrinkList> ID = Id.hashed(DrinkList.class, "DrinkList");

  @Getter @JsonUnwrapped private DocMeta<DrinkList> meta;

  @JsonProperty("drinks")
  @JsonDeserialize(as = LinkedHashSet.class)
  private Set<Id<Drink>> drinks = new LinkedHashSet<>();

  public static DrinkList empty() {
    DrinkList list = new DrinkList();
    list.meta = new DocMeta<>(ID);
    return list;
  }

  private DrinkList() {}

  /**
   * @return false if the drink was already listed
   */
  public boolean add(Id<Drink> drink) {
    return drinks.add(drink);
  }

  public Set<Id<Drink>> getDrinks() {
    return Collections.unmodifiableSet(drinks);
  }
}
