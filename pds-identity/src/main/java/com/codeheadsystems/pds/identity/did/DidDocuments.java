package com.codeheadsystems.pds.identity.did;

import com.codeheadsystems.pds.identity.crypto.DidKeys;
import com.codeheadsystems.pds.identity.crypto.KeyType;
import com.codeheadsystems.pds.identity.crypto.Multibase;
import com.codeheadsystems.pds.identity.plc.PlcDocumentData;
import com.codeheadsystems.pds.identity.plc.PlcOperations;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Extracts atproto fields from W3C DID documents.
 * <ul>
 *   <li>handle: the first {@code at://} entry of {@code alsoKnownAs}</li>
 *   <li>signing key: the {@code #atproto} verification method, either {@code Multikey} or one
 *   of the legacy {@code EcdsaSecp256k1VerificationKey2019} /
 *   {@code EcdsaSecp256r1VerificationKey2019} types</li>
 *   <li>pds: the {@code #atproto_pds} service of type {@code AtprotoPersonalDataServer}</li>
 * </ul>
 */
public class DidDocuments {

  private static final String MULTIKEY = "Multikey";
  private static final String LEGACY_K256 = "EcdsaSecp256k1VerificationKey2019";
  private static final String LEGACY_P256 = "EcdsaSecp256r1VerificationKey2019";

  private DidDocuments() {
  }

  /**
   * Extracts the atproto data from a document.
   *
   * @param document the DID document
   * @return the data
   * @throws DidResolutionException if any of the atproto fields is missing or malformed
   */
  public static AtprotoData toAtprotoData(final JsonNode document) {
    final String did = document.path("id").asText(null);
    if (did == null) {
      throw new DidResolutionException("DID document has no id");
    }
    final String signingKey = signingKey(did, document)
        .orElseThrow(() -> new DidResolutionException("Could not parse signingKey from doc: " + did));
    final String handle = handle(document)
        .orElseThrow(() -> new DidResolutionException("Could not parse handle from doc: " + did));
    final String pds = pds(did, document)
        .orElseThrow(() -> new DidResolutionException("Could not parse pds from doc: " + did));
    return new AtprotoData(did, signingKey, handle, pds);
  }

  /**
   * Converts PLC document data to atproto data.
   *
   * @param data the PLC data
   * @return the atproto data
   * @throws DidResolutionException if any of the atproto fields is missing
   */
  public static AtprotoData fromPlcData(final PlcDocumentData data) {
    if (data.signingKey() == null || data.handle() == null || data.pds() == null) {
      throw new DidResolutionException("Incomplete atproto data for " + data.did());
    }
    return new AtprotoData(data.did(), data.signingKey(), data.handle(), data.pds());
  }

  static Optional<String> handle(final JsonNode document) {
    for (JsonNode aka : document.path("alsoKnownAs")) {
      final String value = aka.asText("");
      if (value.startsWith(PlcOperations.AT_URI_PREFIX)) {
        return Optional.of(value.substring(PlcOperations.AT_URI_PREFIX.length()));
      }
    }
    return Optional.empty();
  }

  static Optional<String> signingKey(final String did, final JsonNode document) {
    for (JsonNode method : document.path("verificationMethod")) {
      if (!matchesId(did, method.path("id").asText(""), "#atproto")) {
        continue;
      }
      final String multibase = method.path("publicKeyMultibase").asText(null);
      if (multibase == null) {
        return Optional.empty();
      }
      try {
        return Optional.of(switch (method.path("type").asText("")) {
          case MULTIKEY -> multikey(multibase);
          case LEGACY_K256 -> legacyKey(KeyType.SECP256K1, multibase);
          case LEGACY_P256 -> legacyKey(KeyType.P256, multibase);
          default -> throw new DidResolutionException("Unsupported verification method type for " + did);
        });
      } catch (IllegalArgumentException e) {
        throw new DidResolutionException("Malformed signing key in doc: " + did, e);
      }
    }
    return Optional.empty();
  }

  static Optional<String> pds(final String did, final JsonNode document) {
    for (JsonNode service : document.path("service")) {
      if (matchesId(did, service.path("id").asText(""), "#atproto_pds")
          && "AtprotoPersonalDataServer".equals(service.path("type").asText())
          && service.path("serviceEndpoint").isTextual()) {
        return Optional.of(service.path("serviceEndpoint").asText());
      }
    }
    return Optional.empty();
  }

  private static String multikey(final String multibase) {
    DidKeys.parseMultikey(multibase);
    return DidKeys.DID_KEY_PREFIX + multibase;
  }

  private static String legacyKey(final KeyType keyType, final String multibase) {
    final byte[] raw = Multibase.decodeBase58btc(multibase);
    final byte[] compressed = keyType.domain().getCurve().decodePoint(raw).getEncoded(true);
    return DidKeys.formatDidKey(keyType, compressed);
  }

  private static boolean matchesId(final String did, final String id, final String fragment) {
    return id.equals(fragment) || id.equals(did + fragment);
  }
}
