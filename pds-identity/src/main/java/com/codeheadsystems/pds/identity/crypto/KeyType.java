package com.codeheadsystems.pds.identity.crypto;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;

/**
 * The elliptic curves a repository or rotation key may live on, with the multicodec prefix
 * used when the public key is rendered as a {@code did:key}.
 */
public enum KeyType {

  /**
   * secp256k1, the curve used by default for node and user keys.
   */
  SECP256K1("secp256k1", "ES256K", new byte[]{(byte) 0xe7, 0x01}),

  /**
   * NIST P-256.
   */
  P256("secp256r1", "ES256", new byte[]{(byte) 0x80, 0x24});

  private final String curveName;
  private final String jwtAlg;
  private final byte[] multicodecPrefix;
  private final ECDomainParameters domain;

  KeyType(String curveName, String jwtAlg, byte[] multicodecPrefix) {
    this.curveName = curveName;
    this.jwtAlg = jwtAlg;
    this.multicodecPrefix = multicodecPrefix;
    X9ECParameters params = CustomNamedCurves.getByName(curveName);
    this.domain = new ECDomainParameters(params.getCurve(), params.getG(), params.getN(), params.getH());
  }

  /**
   * Gets the curve name as known to BouncyCastle.
   *
   * @return the curve name
   */
  public String curveName() {
    return curveName;
  }

  /**
   * Gets the JOSE algorithm name for signatures on this curve.
   *
   * @return the jwt alg
   */
  public String jwtAlg() {
    return jwtAlg;
  }

  /**
   * Gets a copy of the two byte multicodec prefix.
   *
   * @return the multicodec prefix
   */
  public byte[] multicodecPrefix() {
    return multicodecPrefix.clone();
  }

  /**
   * Gets the curve domain parameters.
   *
   * @return the domain
   */
  public ECDomainParameters domain() {
    return domain;
  }

  /**
   * Finds the key type whose multicodec prefix starts the given bytes.
   *
   * @param prefixed multicodec-prefixed key bytes
   * @return the key type
   * @throws IllegalArgumentException if no key type matches
   */
  public static KeyType fromMulticodec(byte[] prefixed) {
    for (KeyType type : values()) {
      if (prefixed.length > 2
          && prefixed[0] == type.multicodecPrefix[0]
          && prefixed[1] == type.multicodecPrefix[1]) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported key type");
  }
}
