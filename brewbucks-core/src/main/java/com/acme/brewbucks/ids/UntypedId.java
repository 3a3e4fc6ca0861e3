package com.acme.brewbucks.ids;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * A 128-bit time-ordered identifier: a 64-bit millisecond stamp followed by 64 random bits.
 *
 * <p>The text form is the big-endian bytes in lowercase base32hex, always {@value
 * #ENCODED_LENGTH} characters, so lexical order of the text matches numeric order of the value.
 */
public record UntypedId(long stamp, long random) implements Comparable<UntypedId> {
  public static final int BYTE_LENGTH = 16;
  public static final int ENCODED_LENGTH = 26;

  /** Hashed identifiers keep their stamp below 2^30 seconds after the epoch. */
  static final long HASHED_STAMP_LIMIT_MILLIS = (1L << 30) * 1000L;

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final byte[] STAMP_KEY = "brewbucks.id.stamp".getBytes(StandardCharsets.UTF_8);
  private static final byte[] RANDOM_KEY = "brewbucks.id.random".getBytes(StandardCharsets.UTF_8);

  /** Derives a stable identifier from a seed; equal seeds always give equal identifiers. */
  public static UntypedId hashed(String seed) {
    Objects.requireNonNull(seed, "seed");
    return hashed(seed.getBytes(StandardCharsets.UTF_8));
  }

  public static UntypedId hashed(byte[] seed) {
    Objects.requireNonNull(seed, "seed");
    long stamp = Long.remainderUnsigned(keyedHash(STAMP_KEY, seed), HASHED_STAMP_LIMIT_MILLIS);
    return new UntypedId(stamp, keyedHash(RANDOM_KEY, seed));
  }

  /**
   * @throws UnparseableIdException if the text is not exactly {@value #ENCODED_LENGTH} lowercase
   *     base32hex characters
   */
  public static UntypedId parse(String text) {
    Objects.requireNonNull(text, "text");
    if (text.length() != ENCODED_LENGTH) {
      throw new UnparseableIdException(
          text,
          UnparseableIdException.Defect.WRONG_LENGTH,
          "expected " + ENCODED_LENGTH + " characters but got " + text.length());
    }
    byte[] bytes;
    try {
      bytes = Base32Hex.decode(text);
    } catch (IllegalArgumentException e) {
      throw new UnparseableIdException(
          text, UnparseableIdException.Defect.BAD_ENCODING, e.getMessage(), e);
    }
    return fromBytes(bytes);
  }

  public static UntypedId fromBytes(byte[] bytes) {
    if (bytes.length != BYTE_LENGTH) {
      throw new IllegalArgumentException(
          "Identifier needs " + BYTE_LENGTH + " bytes, got " + bytes.length);
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    return new UntypedId(buffer.getLong(), buffer.getLong());
  }

  public byte[] toBytes() {
    return ByteBuffer.allocate(BYTE_LENGTH).putLong(stamp).putLong(random).array();
  }

  public Instant timestamp() {
    return Instant.ofEpochMilli(stamp);
  }

  public <T> Id<T> typed(Class<T> entity) {
    return Id.of(entity, this);
  }

  @Override
  public int compareTo(UntypedId other) {
    int byStamp = Long.compareUnsigned(stamp, other.stamp);
    return byStamp != 0 ? byStamp : Long.compareUnsigned(random, other.random);
  }

  @Override
  public String toString() {
    return Base32Hex.encode(toBytes());
  }

  private static long keyedHash(byte[] key, byte[] seed) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return ByteBuffer.wrap(mac.doFinal(seed)).getLong();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(HMAC_ALGORITHM + " is not available", e);
    }
  }
}
