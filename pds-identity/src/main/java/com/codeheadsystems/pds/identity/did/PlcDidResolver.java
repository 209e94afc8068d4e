package com.codeheadsystems.pds.identity.did;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Resolves did:plc documents from {@code GET {plcUrl}/{did}}.
 */
public class PlcDidResolver extends BaseDidResolver {

  private final String plcUrl;

  /**
   * Instantiates a new Plc did resolver.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param plcUrl       base url of the directory
   * @param timeout      per-request timeout
   * @param cache        the cache, or null
   */
  public PlcDidResolver(final HttpClient httpClient,
                        final ObjectMapper objectMapper,
                        final String plcUrl,
                        final Duration timeout,
                        final DidCache cache) {
    super(httpClient, objectMapper, timeout, cache);
    this.plcUrl = plcUrl.endsWith("/") ? plcUrl.substring(0, plcUrl.length() - 1) : plcUrl;
  }

  @Override
  protected URI documentUri(final String did) {
    return URI.create(plcUrl + "/" + URLEncoder.encode(did, StandardCharsets.UTF_8));
  }
}
