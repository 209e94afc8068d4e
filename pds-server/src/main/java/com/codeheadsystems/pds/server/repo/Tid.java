package com.codeheadsystems.pds.server.repo;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Timestamp identifier: 13 sortable base32 characters encoding microseconds since the epoch
 * (53 bits) followed by a 10 bit clock id. Revisions of repository commits are TIDs.
 *
 * @param micros  microseconds since the epoch
 * @param clockId disambiguates generators, 0 to 1023
 */
public record Tid(long micros, int clockId) implements Comparable<Tid> {

  private static final String ALPHABET = "234567abcdefghijklmnopqrstuvwxyz";
  private static final long MAX_MICROS = (1L << 53) - 1;
  private static final int MAX_CLOCK_ID = (1 << 10) - 1;
  private static final int CLOCK_ID = new SecureRandom().nextInt(MAX_CLOCK_ID + 1);
  private static final AtomicLong LAST_MICROS = new AtomicLong();

  /**
   * Instantiates a new Tid.
   */
  public Tid {
    if (micros < 0 || micros > MAX_MICROS) {
      throw new IllegalArgumentException("TID timestamp out of range: " + micros);
    }
    if (clockId < 0 || clockId > MAX_CLOCK_ID) {
      throw new IllegalArgumentException("TID clock id out of range: " + clockId);
    }
  }

  /**
   * Generates the next TID for this process. Successive calls never return the same or a
   * smaller value, even when the clock stalls or steps back.
   *
   * @param now the current time
   * @return the TID
   */
  public static Tid next(final Instant now) {
    final long nowMicros = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000;
    final long micros = LAST_MICROS.updateAndGet(last -> Math.max(last + 1, nowMicros));
    return new Tid(micros, CLOCK_ID);
  }

  @Override
  public int compareTo(final Tid o) {
    return toString().compareTo(o.toString());
  }

  @Override
  public String toString() {
    return encode(micros, 11) + encode(clockId, 2);
  }

  private static String encode(long value, final int width) {
    final char[] chars = new char[width];
    for (int i = width - 1; i >= 0; i--) {
      chars[i] = ALPHABET.charAt((int) (value & 31));
      value >>>= 5;
    }
    return new String(chars);
  }
}
