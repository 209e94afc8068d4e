package com.codeheadsystems.pds.identity.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Formatting, parsing and signature verification for {@code did:key} identifiers.
 */
public class DidKeys {

  /**
   * The did:key method prefix.
   */
  public static final String DID_KEY_PREFIX = "did:key:";

  private DidKeys() {
  }

  /**
   * A parsed did:key.
   *
   * @param keyType             the curve
   * @param publicKeyCompressed the SEC1 compressed public key
   */
  public record ParsedDidKey(KeyType keyType, byte[] publicKeyCompressed) {
  }

  /**
   * Renders a compressed public key as a did:key.
   *
   * @param keyType             the curve
   * @param publicKeyCompressed the SEC1 compressed public key
   * @return the did:key
   */
  public static String formatDidKey(KeyType keyType, byte[] publicKeyCompressed) {
    return DID_KEY_PREFIX + formatMultikey(keyType, publicKeyCompressed);
  }

  /**
   * Renders a compressed public key as a multibase multikey, as found in DID documents.
   *
   * @param keyType             the curve
   * @param publicKeyCompressed the SEC1 compressed public key
   * @return the multikey
   */
  public static String formatMultikey(KeyType keyType, byte[] publicKeyCompressed) {
    byte[] prefix = keyType.multicodecPrefix();
    byte[] prefixed = new byte[prefix.length + publicKeyCompressed.length];
    System.arraycopy(prefix, 0, prefixed, 0, prefix.length);
    System.arraycopy(publicKeyCompressed, 0, prefixed, prefix.length, publicKeyCompressed.length);
    return Multibase.encodeBase58btc(prefixed);
  }

  /**
   * Parses a did:key.
   *
   * @param didKey the did:key
   * @return the key type and compressed public key
   * @throws IllegalArgumentException if the value is not a supported did:key
   */
  public static ParsedDidKey parseDidKey(String didKey) {
    if (didKey == null || !didKey.startsWith(DID_KEY_PREFIX)) {
      throw new IllegalArgumentException("Incorrect prefix for did:key: " + didKey);
    }
    return parseMultikey(didKey.substring(DID_KEY_PREFIX.length()));
  }

  /**
   * Parses a multibase multikey.
   *
   * @param multikey the multikey
   * @return the key type and compressed public key
   * @throws IllegalArgumentException if the value is not a supported multikey
   */
  public static ParsedDidKey parseMultikey(String multikey) {
    byte[] prefixed = Multibase.decodeBase58btc(multikey);
    KeyType keyType = KeyType.fromMulticodec(prefixed);
    byte[] key = Arrays.copyOfRange(prefixed, 2, prefixed.length);
    // Throws on points that are not on the curve
    keyType.domain().getCurve().decodePoint(key);
    return new ParsedDidKey(keyType, key);
  }

  /**
   * Verifies a compact low-S signature made by {@link Keypair#sign(byte[])}.
   *
   * @param didKey    the signer's did:key
   * @param data      the signed bytes
   * @param signature the 64 byte signature
   * @return true if the signature is valid
   */
  public static boolean verifySignature(String didKey, byte[] data, byte[] signature) {
    if (signature == null || signature.length != 64) {
      return false;
    }
    ParsedDidKey parsed = parseDidKey(didKey);
    ECDomainParameters domain = parsed.keyType().domain();
    BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
    BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
    if (s.compareTo(domain.getN().shiftRight(1)) > 0) {
      return false;
    }
    ECPoint q = domain.getCurve().decodePoint(parsed.publicKeyCompressed());
    ECDSASigner verifier = new ECDSASigner();
    verifier.init(false, new ECPublicKeyParameters(q, domain));
    return verifier.verifySignature(sha256(data), r, s);
  }

  /**
   * SHA-256 of the given bytes.
   *
   * @param data the data
   * @return the digest
   */
  public static byte[] sha256(byte[] data) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(data, 0, data.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
