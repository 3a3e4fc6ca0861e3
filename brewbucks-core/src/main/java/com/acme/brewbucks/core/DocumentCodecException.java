package com.acme.brewbucks.core;

/** A document could not be converted to or from its stored JSON form. */
public class DocumentCodecException extends RuntimeException {
  public DocumentCodecException(String message, Throwable cause) {
    super(message, cause);
  }
}
