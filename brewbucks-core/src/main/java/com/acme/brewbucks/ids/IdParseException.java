package com.acme.brewbucks.ids;

/** Raised when identifier text cannot be turned back into an identifier. */
public abstract class IdParseException extends RuntimeException {
  private final String input;

  protected IdParseException(String input, String message) {
    super(message);
    this.input = input;
  }

  protected IdParseException(String input, String message, Throwable cause) {
    super(message, cause);
    this.input = input;
  }

  public String getInput() {
    return input;
  }
}
