package com.acme.brewbucks.ids;

/**
 * Lowercase base32hex (RFC 4648 "extended hex" alphabet) without padding.
 *
 * <p>Decoding is strict: characters outside the lowercase alphabet and non-zero trailing bits are
 * rejected, so every accepted text is the exact encoding of the bytes it decodes to.
 */
final class Base32Hex {
  private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuv";
  private static final int BITS_PER_CHAR = 5;

  private Base32Hex() {
    // Utility class - no instantiation
  }

  static int encodedLength(int byteLength) {
    return (byteLength * 8 + BITS_PER_CHAR - 1) / BITS_PER_CHAR;
  }

  static String encode(byte[] bytes) {
    StringBuilder out = new StringBuilder(encodedLength(bytes.length));
    int buffer = 0;
    int bits = 0;
    for (byte b : bytes) {
      buffer = (buffer << 8) | (b & 0xff);
      bits += 8;
      while (bits >= BITS_PER_CHAR) {
        out.append(ALPHABET.charAt((buffer >>> (bits - BITS_PER_CHAR)) & 0x1f));
        bits -= BITS_PER_CHAR;
      }
    }
    if (bits > 0) {
      out.append(ALPHABET.charAt((buffer << (BITS_PER_CHAR - bits)) & 0x1f));
    }
    return out.toString();
  }

  /**
   * @throws IllegalArgumentException if the text contains a character outside the alphabet or
   *     carries non-zero padding bits
   */
  static byte[] decode(String text) {
    byte[] out = new byte[text.length() * BITS_PER_CHAR / 8];
    int buffer = 0;
    int bits = 0;
    int index = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      int value = ALPHABET.indexOf(c);
      if (value < 0) {
        throw new IllegalArgumentException(
            String.format("Invalid base32hex character '%s' at position %d", c, i));
      }
      buffer = (buffer << BITS_PER_CHAR) | value;
      bits += BITS_PER_CHAR;
      if (bits >= 8) {
        out[index++] = (byte) (buffer >>> (bits - 8));
        bits -= 8;
      }
    }
    if ((buffer & ((1 << bits) - 1)) != 0) {
      throw new IllegalArgumentException("Non-zero trailing bits in base32hex text");
    }
    return out;
  }
}
