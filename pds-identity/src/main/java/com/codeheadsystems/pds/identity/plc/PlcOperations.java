package com.codeheadsystems.pds.identity.plc;

import com.codeheadsystems.pds.identity.cbor.Cid;
import com.codeheadsystems.pds.identity.cbor.DagCbor;
import com.codeheadsystems.pds.identity.crypto.DidKeys;
import com.codeheadsystems.pds.identity.crypto.Keypair;
import com.google.common.io.BaseEncoding;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Builds, signs and checks PLC operations.
 * <p>
 * The signature covers the DAG-CBOR encoding of the operation without {@code sig}. A DID is
 * {@code did:plc:} followed by the first 24 characters of the lower case base32 SHA-256 of
 * the signed genesis operation, so it is fully determined by the operation's content.
 */
public class PlcOperations {

  /**
   * The did:plc method prefix.
   */
  public static final String DID_PLC_PREFIX = "did:plc:";

  /**
   * Scheme prefix used for handles in {@code alsoKnownAs}.
   */
  public static final String AT_URI_PREFIX = "at://";

  private static final int DID_SUFFIX_LENGTH = 24;
  private static final BaseEncoding BASE32 = BaseEncoding.base32().lowerCase().omitPadding();
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64URL_DECODER = Base64.getUrlDecoder();

  private PlcOperations() {
  }

  /**
   * Formats and signs a genesis operation.
   *
   * @param signingKey   the repo signing key as a did:key
   * @param rotationKeys rotation did:keys, highest priority first
   * @param handle       the handle, without {@code at://}
   * @param pds          the hosting server url
   * @param signer       a key from {@code rotationKeys}
   * @return the DID and the signed operation
   */
  public static PlcCreateResult createOp(String signingKey,
                                         List<String> rotationKeys,
                                         String handle,
                                         String pds,
                                         Keypair signer) {
    PlcOperation unsigned = new PlcOperation(
        PlcOperation.TYPE,
        List.copyOf(rotationKeys),
        Map.of("atproto", signingKey),
        List.of(ensureAtPrefix(handle)),
        Map.of("atproto_pds", PlcService.pds(pds)),
        null,
        null);
    PlcOperation signed = sign(unsigned, signer);
    return new PlcCreateResult(didForGenesis(signed), signed);
  }

  /**
   * Signs an operation.
   *
   * @param unsigned the operation; any existing signature is ignored
   * @param signer   the rotation key
   * @return the signed copy
   */
  public static PlcOperation sign(PlcOperation unsigned, Keypair signer) {
    byte[] sig = signer.sign(DagCbor.encode(unsigned.toUnsignedMap()));
    return unsigned.withSig(B64URL.encodeToString(sig));
  }

  /**
   * Derives the DID created by a signed genesis operation.
   *
   * @param signedGenesis the operation
   * @return the did:plc
   */
  public static String didForGenesis(PlcOperation signedGenesis) {
    byte[] hash = DidKeys.sha256(DagCbor.encode(signedGenesis.toSignedMap()));
    return DID_PLC_PREFIX + BASE32.encode(hash).substring(0, DID_SUFFIX_LENGTH);
  }

  /**
   * The CID of a signed operation, as referenced by the next operation's {@code prev}.
   *
   * @param signed the operation
   * @return the cid
   */
  public static Cid cid(PlcOperation signed) {
    return Cid.forDagCbor(DagCbor.encode(signed.toSignedMap()));
  }

  /**
   * Finds which of the allowed keys signed the operation.
   *
   * @param signed      the operation
   * @param allowedKeys did:keys permitted to sign it
   * @return true if any allowed key produced the signature
   */
  public static boolean verifySignature(PlcOperation signed, List<String> allowedKeys) {
    if (signed.sig() == null) {
      return false;
    }
    final byte[] sig;
    try {
      sig = B64URL_DECODER.decode(signed.sig());
    } catch (IllegalArgumentException e) {
      return false;
    }
    byte[] data = DagCbor.encode(signed.toUnsignedMap());
    for (String key : allowedKeys) {
      if (DidKeys.verifySignature(key, data, sig)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Adds {@code at://} to a handle that does not already carry it.
   *
   * @param handle the handle
   * @return the at-uri
   */
  public static String ensureAtPrefix(String handle) {
    return handle.startsWith(AT_URI_PREFIX) ? handle : AT_URI_PREFIX + handle;
  }
}
