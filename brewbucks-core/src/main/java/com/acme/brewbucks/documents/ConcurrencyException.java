package com.acme.brewbucks.documents;

/**
 * A save lost an optimistic-concurrency race: the stored version differs from the version the
 * caller loaded. Reload, re-apply the change and save again.
 */
public class ConcurrencyException extends RuntimeException {
  private final String key;
  private final Version expected;
  private final Version actual;

  public ConcurrencyException(String key, Version expected, Version actual) {
    super(
        String.format(
            "Concurrent modification of %s: expected %s but found %s", key, expected, actual));
    this.key = key;
    this.expected = expected;
    this.actual = actual;
  }

  public String getKey() {
    return key;
  }

  public Version getExpected() {
    return expected;
  }

  public Version getActual() {
    return actual;
  }
}
