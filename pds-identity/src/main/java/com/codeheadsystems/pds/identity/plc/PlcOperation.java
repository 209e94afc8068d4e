package com.codeheadsystems.pds.identity.plc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A PLC document operation.
 * <p>
 * {@code prev} is null for the genesis operation that creates a DID. {@code sig} is null
 * until the operation has been signed by a rotation key.
 *
 * @param type                always {@code plc_operation}
 * @param rotationKeys        did:keys allowed to sign later operations, highest priority first
 * @param verificationMethods verification methods by name; {@code atproto} is the repo signing key
 * @param alsoKnownAs         {@code at://} handle uris
 * @param services            services by name; {@code atproto_pds} is the hosting server
 * @param prev                cid of the previous operation, or null
 * @param sig                 base64url signature, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record PlcOperation(@JsonProperty("type") String type,
                           @JsonProperty("rotationKeys") List<String> rotationKeys,
                           @JsonProperty("verificationMethods") Map<String, String> verificationMethods,
                           @JsonProperty("alsoKnownAs") List<String> alsoKnownAs,
                           @JsonProperty("services") Map<String, PlcService> services,
                           @JsonProperty("prev") String prev,
                           @JsonProperty("sig") String sig) {

  /**
   * The operation type for document updates and creation.
   */
  public static final String TYPE = "plc_operation";

  /**
   * Returns a copy carrying the given signature.
   *
   * @param signature the base64url signature
   * @return the signed operation
   */
  public PlcOperation withSig(String signature) {
    return new PlcOperation(type, rotationKeys, verificationMethods, alsoKnownAs, services, prev, signature);
  }

  /**
   * Whether this operation creates a DID.
   *
   * @return true for a genesis operation
   */
  @JsonIgnore
  public boolean isGenesis() {
    return prev == null;
  }

  /**
   * The operation without {@code sig}, as the map that gets signed.
   *
   * @return the unsigned map
   */
  public Map<String, Object> toUnsignedMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", type);
    map.put("rotationKeys", rotationKeys);
    map.put("verificationMethods", verificationMethods);
    map.put("alsoKnownAs", alsoKnownAs);
    Map<String, Object> serviceMap = new LinkedHashMap<>();
    services.forEach((name, service) -> serviceMap.put(name, service.toMap()));
    map.put("services", serviceMap);
    map.put("prev", prev);
    return map;
  }

  /**
   * The full operation including {@code sig}, as the map whose hash identifies it.
   *
   * @return the signed map
   * @throws IllegalStateException if the operation is unsigned
   */
  public Map<String, Object> toSignedMap() {
    if (sig == null) {
      throw new IllegalStateException("Operation is not signed");
    }
    Map<String, Object> map = toUnsignedMap();
    map.put("sig", sig);
    return map;
  }
}
