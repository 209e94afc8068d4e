package com.codeheadsystems.pds.identity.crypto;

/**
 * A signing key whose public half is addressable as a {@code did:key}.
 */
public interface Keypair {

  /**
   * The curve this key lives on.
   *
   * @return the key type
   */
  KeyType keyType();

  /**
   * The public key rendered as {@code did:key:z...}.
   *
   * @return the did:key
   */
  String did();

  /**
   * Signs the SHA-256 digest of the given bytes, returning a 64 byte compact low-S signature.
   *
   * @param data the bytes to sign
   * @return the signature
   */
  byte[] sign(byte[] data);
}
