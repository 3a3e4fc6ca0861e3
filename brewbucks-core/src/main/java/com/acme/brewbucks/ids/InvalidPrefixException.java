package com.acme.brewbucks.ids;

/** The text names a different entity kind than the one being parsed. */
public class InvalidPrefixException extends IdParseException {
  private final String expectedPrefix;
  private final String actualPrefix;

  public InvalidPrefixException(String input, String expectedPrefix, String actualPrefix) {
    super(
        input,
        String.format(
            "Identifier '%s' has prefix '%s', expected '%s'", input, actualPrefix, expectedPrefix));
    this.expectedPrefix = expectedPrefix;
    this.actualPrefix = actualPrefix;
  }

  public String getExpectedPrefix() {
    return expectedPrefix;
  }

  public String getActualPrefix() {
    return actualPrefix;
  }
}
