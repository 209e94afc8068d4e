package com.codeheadsystems.pds.identity.crypto;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58btc with the multibase {@code z} prefix, as used by {@code did:key}.
 */
public class Multibase {

  private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
  private static final BigInteger BASE = BigInteger.valueOf(58);
  private static final int[] INDEXES = new int[128];

  static {
    Arrays.fill(INDEXES, -1);
    for (int i = 0; i < ALPHABET.length(); i++) {
      INDEXES[ALPHABET.charAt(i)] = i;
    }
  }

  private Multibase() {
  }

  /**
   * Encodes bytes as base58btc without the multibase prefix.
   *
   * @param input the input
   * @return the base58 string
   */
  public static String base58Encode(byte[] input) {
    if (input.length == 0) {
      return "";
    }
    int zeros = 0;
    while (zeros < input.length && input[zeros] == 0) {
      zeros++;
    }
    StringBuilder sb = new StringBuilder();
    BigInteger value = new BigInteger(1, input);
    while (value.signum() > 0) {
      BigInteger[] divRem = value.divideAndRemainder(BASE);
      sb.append(ALPHABET.charAt(divRem[1].intValue()));
      value = divRem[0];
    }
    for (int i = 0; i < zeros; i++) {
      sb.append(ALPHABET.charAt(0));
    }
    return sb.reverse().toString();
  }

  /**
   * Decodes a base58btc string without the multibase prefix.
   *
   * @param input the input
   * @return the decoded bytes
   * @throws IllegalArgumentException if the input has a character outside the alphabet
   */
  public static byte[] base58Decode(String input) {
    if (input.isEmpty()) {
      return new byte[0];
    }
    BigInteger value = BigInteger.ZERO;
    int zeros = 0;
    boolean leading = true;
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      int digit = c < 128 ? INDEXES[c] : -1;
      if (digit < 0) {
        throw new IllegalArgumentException("Invalid base58 character: " + c);
      }
      if (leading && digit == 0) {
        zeros++;
      } else {
        leading = false;
      }
      value = value.multiply(BASE).add(BigInteger.valueOf(digit));
    }
    byte[] magnitude = value.signum() == 0 ? new byte[0] : value.toByteArray();
    // BigInteger may add a sign byte
    int start = magnitude.length > 1 && magnitude[0] == 0 ? 1 : 0;
    byte[] out = new byte[zeros + magnitude.length - start];
    System.arraycopy(magnitude, start, out, zeros, magnitude.length - start);
    return out;
  }

  /**
   * Encodes bytes as multibase base58btc ({@code z...}).
   *
   * @param input the input
   * @return the multibase string
   */
  public static String encodeBase58btc(byte[] input) {
    return "z" + base58Encode(input);
  }

  /**
   * Decodes a multibase base58btc string.
   *
   * @param multibase the multibase string, starting with {@code z}
   * @return the decoded bytes
   * @throws IllegalArgumentException if the prefix is not {@code z}
   */
  public static byte[] decodeBase58btc(String multibase) {
    if (multibase == null || !multibase.startsWith("z")) {
      throw new IllegalArgumentException("Unsupported multibase encoding: " + multibase);
    }
    return base58Decode(multibase.substring(1));
  }
}
