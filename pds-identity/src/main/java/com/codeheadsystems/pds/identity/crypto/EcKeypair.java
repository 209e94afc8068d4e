package com.codeheadsystems.pds.identity.crypto;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

/**
 * An ECDSA keypair on secp256k1 or P-256.
 * <p>
 * Signatures are deterministic (RFC 6979 nonces), computed over the SHA-256 digest of the
 * message, normalised to low-S and encoded as the 64 byte concatenation {@code r || s}.
 */
public class EcKeypair implements Keypair {

  private final KeyType keyType;
  private final BigInteger privateKey;
  private final byte[] publicKeyCompressed;
  private final String did;

  private EcKeypair(KeyType keyType, BigInteger privateKey) {
    ECDomainParameters domain = keyType.domain();
    if (privateKey.signum() <= 0 || privateKey.compareTo(domain.getN()) >= 0) {
      throw new IllegalArgumentException("Private key out of range for " + keyType);
    }
    this.keyType = keyType;
    this.privateKey = privateKey;
    ECPoint publicPoint = domain.getG().multiply(privateKey).normalize();
    this.publicKeyCompressed = publicPoint.getEncoded(true);
    this.did = DidKeys.formatDidKey(keyType, publicKeyCompressed);
  }

  /**
   * Generates a new random keypair.
   *
   * @param keyType the curve
   * @param random  the source of randomness
   * @return the keypair
   */
  public static EcKeypair generate(KeyType keyType, SecureRandom random) {
    BigInteger n = keyType.domain().getN();
    BigInteger d = BigIntegers.createRandomInRange(BigInteger.ONE, n.subtract(BigInteger.ONE), random);
    return new EcKeypair(keyType, d);
  }

  /**
   * Restores a keypair from its hex encoded private scalar.
   *
   * @param keyType the curve
   * @param hex     the private key as hex
   * @return the keypair
   */
  public static EcKeypair fromPrivateKeyHex(KeyType keyType, String hex) {
    return new EcKeypair(keyType, new BigInteger(1, HexFormat.of().parseHex(hex)));
  }

  @Override
  public KeyType keyType() {
    return keyType;
  }

  @Override
  public String did() {
    return did;
  }

  /**
   * Gets a copy of the SEC1 compressed public key.
   *
   * @return the compressed public key
   */
  public byte[] publicKeyCompressed() {
    return publicKeyCompressed.clone();
  }

  /**
   * Exports the private scalar as 32 bytes of hex.
   *
   * @return the private key hex
   */
  public String privateKeyHex() {
    return HexFormat.of().formatHex(BigIntegers.asUnsignedByteArray(32, privateKey));
  }

  @Override
  public byte[] sign(byte[] data) {
    ECDomainParameters domain = keyType.domain();
    ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
    signer.init(true, new ECPrivateKeyParameters(privateKey, domain));
    BigInteger[] rs = signer.generateSignature(DidKeys.sha256(data));
    BigInteger r = rs[0];
    BigInteger s = rs[1];
    BigInteger halfN = domain.getN().shiftRight(1);
    if (s.compareTo(halfN) > 0) {
      s = domain.getN().subtract(s);
    }
    byte[] out = new byte[64];
    System.arraycopy(BigIntegers.asUnsignedByteArray(32, r), 0, out, 0, 32);
    System.arraycopy(BigIntegers.asUnsignedByteArray(32, s), 0, out, 32, 32);
    return out;
  }

  @Override
  public String toString() {
    return "EcKeypair{" + did + "}";
  }
}
