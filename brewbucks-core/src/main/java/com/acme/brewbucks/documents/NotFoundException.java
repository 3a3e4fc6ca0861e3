package com.acme.brewbucks.documents;

/** A document that an operation requires does not exist. */
public class NotFoundException extends RuntimeException {
  private final String key;

  public NotFoundException(String key) {
    super("Document not found: " + key);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
