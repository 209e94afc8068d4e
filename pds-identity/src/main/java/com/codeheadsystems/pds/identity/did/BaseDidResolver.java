package com.codeheadsystems.pds.identity.did;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared fetch, cache and sanity checks for method-specific resolvers.
 */
public abstract class BaseDidResolver {
  private static final Logger log = LoggerFactory.getLogger(BaseDidResolver.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration timeout;
  private final DidCache cache;

  /**
   * Instantiates a new Base did resolver.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param timeout      per-request timeout
   * @param cache        the cache, or null to always fetch
   */
  protected BaseDidResolver(final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final Duration timeout,
                            final DidCache cache) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.timeout = timeout;
    this.cache = cache;
  }

  /**
   * The url the document of this DID is served from.
   *
   * @param did the did
   * @return the url
   * @throws DidResolutionException if the DID cannot be mapped to a url
   */
  protected abstract URI documentUri(String did);

  /**
   * Resolves a DID document.
   *
   * @param did the did
   * @return the document, or empty if the DID positively does not exist
   * @throws DidResolutionException on network failure or a malformed document
   */
  public Optional<JsonNode> resolve(final String did) {
    if (cache != null) {
      final Optional<JsonNode> cached = cache.get(did);
      if (cached.isPresent()) {
        log.trace("resolve({}): cache hit", did);
        return cached;
      }
    }
    final Optional<JsonNode> document = resolveNoCheck(did);
    if (document.isEmpty()) {
      return document;
    }
    final JsonNode id = document.get().get("id");
    if (id == null || !did.equals(id.asText())) {
      throw new DidResolutionException("DID document id does not match requested did: " + did);
    }
    if (cache != null) {
      cache.put(did, document.get());
    }
    return document;
  }

  /**
   * Fetches the document without caching or id checks.
   *
   * @param did the did
   * @return the document, or empty on HTTP 404
   */
  protected Optional<JsonNode> resolveNoCheck(final String did) {
    final URI uri = documentUri(did);
    log.debug("resolveNoCheck(did={}, uri={})", did, uri);
    try {
      final HttpRequest request = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(timeout)
          .header("Accept", "application/json")
          .GET()
          .build();
      final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() == 404) {
        return Optional.empty();
      }
      if (response.statusCode() >= 400) {
        throw new DidResolutionException("HTTP " + response.statusCode() + " resolving " + did);
      }
      return Optional.of(objectMapper.readTree(response.body()));
    } catch (IOException e) {
      throw new DidResolutionException("Failed to resolve " + did, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DidResolutionException("Interrupted resolving " + did, e);
    }
  }
}
