package com.codeheadsystems.pds.identity.did;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Resolves did:web documents from {@code https://{host}/.well-known/did.json}.
 * <p>
 * Only host-level did:web identifiers are supported. {@code localhost} hosts are fetched
 * over plain http.
 */
public class WebDidResolver extends BaseDidResolver {

  /**
   * The did:web method prefix.
   */
  public static final String DID_WEB_PREFIX = "did:web:";

  /**
   * Instantiates a new Web did resolver.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param timeout      per-request timeout
   * @param cache        the cache, or null
   */
  public WebDidResolver(final HttpClient httpClient,
                        final ObjectMapper objectMapper,
                        final Duration timeout,
                        final DidCache cache) {
    super(httpClient, objectMapper, timeout, cache);
  }

  @Override
  protected URI documentUri(final String did) {
    if (!did.startsWith(DID_WEB_PREFIX)) {
      throw new DidResolutionException("Not a did:web: " + did);
    }
    final String suffix = did.substring(DID_WEB_PREFIX.length());
    if (suffix.isEmpty() || suffix.contains(":")) {
      throw new DidResolutionException("Unsupported did:web: " + did);
    }
    final String host = URLDecoder.decode(suffix, StandardCharsets.UTF_8);
    final String scheme = host.equals("localhost") || host.startsWith("localhost:") ? "http" : "https";
    try {
      return URI.create(scheme + "://" + host + "/.well-known/did.json");
    } catch (IllegalArgumentException e) {
      throw new DidResolutionException("Invalid did:web host: " + did, e);
    }
  }
}
