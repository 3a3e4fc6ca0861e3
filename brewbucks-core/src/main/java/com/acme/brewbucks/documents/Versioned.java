package com.acme.brewbucks.documents;

/** A document the {@link DocumentStore} can persist. */
public interface Versioned<T> {
  DocMeta<T> getMeta();
}
