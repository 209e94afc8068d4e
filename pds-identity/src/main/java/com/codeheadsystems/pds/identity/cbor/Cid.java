package com.codeheadsystems.pds.identity.cbor;

import com.codeheadsystems.pds.identity.crypto.DidKeys;
import com.google.common.io.BaseEncoding;
import java.util.Arrays;

/**
 * A version 1 content identifier over a SHA-256 multihash.
 * <p>
 * Backed by a byte array, so equality is defined over the contents rather than identity;
 * this makes it safe to use as a map key.
 */
public final class Cid {

  /**
   * Multicodec for DAG-CBOR blocks.
   */
  public static final int DAG_CBOR = 0x71;

  /**
   * Multicodec for raw blocks.
   */
  public static final int RAW = 0x55;

  private static final int VERSION = 0x01;
  private static final int SHA2_256 = 0x12;
  private static final int DIGEST_LENGTH = 0x20;
  private static final BaseEncoding BASE32 = BaseEncoding.base32().lowerCase().omitPadding();

  private final byte[] bytes;

  private Cid(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Computes the CID of a DAG-CBOR encoded block.
   *
   * @param block the encoded block
   * @return the cid
   */
  public static Cid forDagCbor(byte[] block) {
    return of(DAG_CBOR, DidKeys.sha256(block));
  }

  /**
   * Builds a CID from a codec and a SHA-256 digest.
   *
   * @param codec  the multicodec, {@link #DAG_CBOR} or {@link #RAW}
   * @param digest the 32 byte digest
   * @return the cid
   */
  public static Cid of(int codec, byte[] digest) {
    if (digest.length != DIGEST_LENGTH) {
      throw new IllegalArgumentException("Expected a 32 byte sha-256 digest, got " + digest.length);
    }
    byte[] out = new byte[4 + digest.length];
    out[0] = VERSION;
    out[1] = (byte) codec;
    out[2] = SHA2_256;
    out[3] = DIGEST_LENGTH;
    System.arraycopy(digest, 0, out, 4, digest.length);
    return new Cid(out);
  }

  /**
   * Reads a CID from its binary form.
   *
   * @param bytes the binary cid
   * @return the cid
   * @throws IllegalArgumentException if the bytes are not a CIDv1 sha-256 cid
   */
  public static Cid fromBytes(byte[] bytes) {
    if (bytes.length != 36 || bytes[0] != VERSION || bytes[2] != SHA2_256 || bytes[3] != DIGEST_LENGTH) {
      throw new IllegalArgumentException("Unsupported cid bytes");
    }
    if (bytes[1] != DAG_CBOR && bytes[1] != RAW) {
      throw new IllegalArgumentException("Unsupported cid codec: " + bytes[1]);
    }
    return new Cid(bytes.clone());
  }

  /**
   * Parses the base32 string form ({@code b...}).
   *
   * @param value the string form
   * @return the cid
   * @throws IllegalArgumentException if the value is not a base32 CIDv1
   */
  public static Cid parse(String value) {
    if (value == null || !value.startsWith("b")) {
      throw new IllegalArgumentException("Unsupported cid encoding: " + value);
    }
    return fromBytes(BASE32.decode(value.substring(1)));
  }

  /**
   * Gets a copy of the binary form.
   *
   * @return the bytes
   */
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Gets the content codec.
   *
   * @return the codec
   */
  public int codec() {
    return bytes[1] & 0xff;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Cid other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "b" + BASE32.encode(bytes);
  }
}
