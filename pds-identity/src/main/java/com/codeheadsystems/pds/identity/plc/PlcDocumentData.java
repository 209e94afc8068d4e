package com.codeheadsystems.pds.identity.plc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * The current state of a did:plc document, as served by {@code GET /{did}/data}.
 *
 * @param did                 the did
 * @param rotationKeys        rotation did:keys
 * @param verificationMethods verification methods by name
 * @param alsoKnownAs         at-uris
 * @param services            services by name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlcDocumentData(@JsonProperty("did") String did,
                              @JsonProperty("rotationKeys") List<String> rotationKeys,
                              @JsonProperty("verificationMethods") Map<String, String> verificationMethods,
                              @JsonProperty("alsoKnownAs") List<String> alsoKnownAs,
                              @JsonProperty("services") Map<String, PlcService> services) {

  /**
   * Builds the document data resulting from an operation.
   *
   * @param did the did
   * @param op  the latest operation
   * @return the data
   */
  public static PlcDocumentData fromOperation(String did, PlcOperation op) {
    return new PlcDocumentData(did, op.rotationKeys(), op.verificationMethods(), op.alsoKnownAs(), op.services());
  }

  /**
   * The atproto signing key.
   *
   * @return the did:key, or null
   */
  @JsonIgnore
  public String signingKey() {
    return verificationMethods == null ? null : verificationMethods.get("atproto");
  }

  /**
   * The first {@code at://} handle, without the prefix.
   *
   * @return the handle, or null
   */
  @JsonIgnore
  public String handle() {
    if (alsoKnownAs == null) {
      return null;
    }
    return alsoKnownAs.stream()
        .filter(aka -> aka.startsWith(PlcOperations.AT_URI_PREFIX))
        .map(aka -> aka.substring(PlcOperations.AT_URI_PREFIX.length()))
        .findFirst()
        .orElse(null);
  }

  /**
   * The hosting server endpoint.
   *
   * @return the url, or null
   */
  @JsonIgnore
  public String pds() {
    if (services == null) {
      return null;
    }
    PlcService service = services.get("atproto_pds");
    return service == null ? null : service.endpoint();
  }
}
