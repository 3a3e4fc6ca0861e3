package com.acme.brewbucks.documents;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-document version counter. {@link #INITIAL} marks a document that has never been persisted;
 * every successful save writes the next value.
 */
public final class Version implements Comparable<Version> {
  public static final Version INITIAL = new Version(0L);

  private final long value;

  private Version(long value) {
    this.value = value;
  }

  @JsonCreator
  public static Version of(long value) {
    if (value < 0) {
      throw new IllegalArgumentException("Version must not be negative: " + value);
    }
    return value == 0 ? INITIAL : new Version(value);
  }

  public Version next() {
    return new Version(Math.addExact(value, 1L));
  }

  public boolean isInitial() {
    return value == 0;
  }

  @JsonValue
  public long value() {
    return value;
  }

  @Override
  public int compareTo(Version other) {
    return Long.compare(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Version other && value == other.value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return "v" + value;
  }
}
