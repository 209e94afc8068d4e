package com.codeheadsystems.pds.identity.did;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;

/**
 * Bounded, time-limited cache of resolved DID documents.
 */
public class DidCache {

  private final Cache<String, JsonNode> cache;

  /**
   * Instantiates a new Did cache.
   *
   * @param ttl         how long a document is served before it is resolved again
   * @param maximumSize the maximum number of documents held
   */
  public DidCache(final Duration ttl, final long maximumSize) {
    this.cache = Caffeine.newBuilder()
        .expireAfterWrite(ttl)
        .maximumSize(maximumSize)
        .build();
  }

  /**
   * Gets a cached document.
   *
   * @param did the did
   * @return the document, or empty if absent or expired
   */
  public Optional<JsonNode> get(final String did) {
    return Optional.ofNullable(cache.getIfPresent(did));
  }

  /**
   * Caches a document.
   *
   * @param did      the did
   * @param document the document
   */
  public void put(final String did, final JsonNode document) {
    cache.put(did, document);
  }

  /**
   * Drops a cached document.
   *
   * @param did the did
   */
  public void invalidate(final String did) {
    cache.invalidate(did);
  }
}
