package com.acme.brewbucks.ids;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.Objects;

/**
 * An {@link UntypedId} tagged with the entity kind it identifies.
 *
 * <p>The text form is {@code <prefix>.<26 base32hex chars>}. Equality, hashing and ordering look at
 * the underlying value only; the type parameter keeps identifiers of different entities apart at
 * compile time.
 *
 * <p>When read from JSON into a field declared as {@code Id<SomeEntity>}, the prefix must be the
 * one {@code SomeEntity} declares; see {@link IdDeserializer}.
 *
 * @param <T> the identified entity, annotated with {@link EntityPrefix}
 */
@JsonDeserialize(using = IdDeserializer.class)
public final class Id<T> implements Comparable<Id<T>> {
  public static final char DIVIDER = '.';

  private static final String ANY_PREFIX = "<entity prefix>";

  private final String prefix;
  private final UntypedId value;

  private Id(String prefix, UntypedId value) {
    this.prefix = prefix;
    this.value = value;
  }

  public static <T> Id<T> of(Class<T> entity, UntypedId value) {
    Objects.requireNonNull(value, "value");
    return new Id<>(Entities.prefixOf(entity), value);
  }

  public static <T> Id<T> hashed(Class<T> entity, String seed) {
    return of(entity, UntypedId.hashed(seed));
  }

  /** Hashes another identifier's bytes, giving a stable companion identifier for it. */
  public static <T> Id<T> hashed(Class<T> entity, Id<?> seed) {
    return of(entity, UntypedId.hashed(seed.untyped().toBytes()));
  }

  /**
   * Parses the text form of an identifier of the given entity.
   *
   * @throws InvalidPrefixException if the text names another entity
   * @throws UnparseableIdException if the text is malformed
   */
  public static <T> Id<T> parse(Class<T> entity, String text) {
    String expected = Entities.prefixOf(entity);
    Id<T> id = decode(text, expected);
    if (!id.prefix.equals(expected)) {
      throw new InvalidPrefixException(text, expected, id.prefix);
    }
    return id;
  }

  /** Parses any identifier text, keeping whatever prefix it carries. */
  public static <T> Id<T> fromText(String text) {
    return decode(text, ANY_PREFIX);
  }

  private static <T> Id<T> decode(String text, String expectedPrefix) {
    Objects.requireNonNull(text, "text");
    int divider = text.indexOf(DIVIDER);
    if (divider < 0) {
      throw new UnparseableIdException(
          text, UnparseableIdException.Defect.MISSING_DIVIDER, "no '" + DIVIDER + "' found");
    }
    String prefix = text.substring(0, divider);
    if (prefix.isEmpty()) {
      throw new InvalidPrefixException(text, expectedPrefix, prefix);
    }
    return new Id<>(prefix, UntypedId.parse(text.substring(divider + 1)));
  }

  public String prefix() {
    return prefix;
  }

  public UntypedId untyped() {
    return value;
  }

  public Instant timestamp() {
    return value.timestamp();
  }

  public long random() {
    return value.random();
  }

  @Override
  public int compareTo(Id<T> other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Id<?> other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @JsonValue
  @Override
  public String toString() {
    return prefix + DIVIDER + value;
  }
}
