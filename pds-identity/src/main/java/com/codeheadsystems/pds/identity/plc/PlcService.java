package com.codeheadsystems.pds.identity.plc;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A service entry of a PLC operation.
 *
 * @param type     the service type, e.g. {@code AtprotoPersonalDataServer}
 * @param endpoint the service url
 */
public record PlcService(@JsonProperty("type") String type,
                         @JsonProperty("endpoint") String endpoint) {

  /**
   * Service type of a personal data server.
   */
  public static final String ATPROTO_PDS_TYPE = "AtprotoPersonalDataServer";

  /**
   * A personal data server entry.
   *
   * @param endpoint the public url
   * @return the service
   */
  public static PlcService pds(String endpoint) {
    return new PlcService(ATPROTO_PDS_TYPE, endpoint);
  }

  Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", type);
    map.put("endpoint", endpoint);
    return map;
  }
}
