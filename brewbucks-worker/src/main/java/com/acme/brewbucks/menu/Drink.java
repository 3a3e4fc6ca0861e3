package com.acme.brewbucks.menu;

import com.acme.brewbucks.documents.DocMeta;
import com.acme.brewbucks.documents.Versioned;
import com.acme.brewbucks.ids.EntityPrefix;
import com.acme.brewbucks.ids.Id;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.util.Objects;
import lombok.Getter;

/** A drink on the menu. */
@EntityPrefix("drink")
public class Drink implements Versioned<Drink> {

  @Getter @JsonUnwrapped private DocMeta<Drink> meta;

  @Getter
  @JsonProperty("name")
  private String name;

  public Drink(Id<Drink> id, String name) {
    this.meta = new DocMeta<>(id);
    this.name = Objects.requireNonNull(name, "name");
  }

  @SuppressWarnings("unused")
  private Drink() {}

  public Id<Drink> getId() {
    return meta.getId();
  }
}
