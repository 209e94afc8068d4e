package com.codeheadsystems.pds.identity.handle;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves external handles through {@code {scheme}://{handle}/.well-known/atproto-did}.
 * <p>
 * Any failure to reach the domain, or a response that is not a single DID, is reported as
 * "no DID" rather than as an error: the caller only cares whether the handle proves the
 * claimed DID.
 */
@Singleton
public class WellKnownHandleResolver implements ExternalHandleResolver {

  private static final Logger log = LoggerFactory.getLogger(WellKnownHandleResolver.class);
  private static final String WELL_KNOWN_PATH = "/.well-known/atproto-did";

  private final HttpClient httpClient;
  private final Duration timeout;

  /**
   * Instantiates a new Well known handle resolver.
   *
   * @param httpClient the http client
   * @param timeout    per-request timeout
   */
  @Inject
  public WellKnownHandleResolver(final HttpClient httpClient, final Duration timeout) {
    this.httpClient = httpClient;
    this.timeout = timeout;
  }

  @Override
  public Optional<String> resolve(final String scheme, final String handle) {
    log.trace("resolve(scheme={}, handle={})", scheme, handle);
    final URI uri;
    try {
      uri = URI.create(scheme + "://" + handle + WELL_KNOWN_PATH);
    } catch (IllegalArgumentException e) {
      log.debug("Handle {} does not form a valid url: {}", handle, e.getMessage());
      return Optional.empty();
    }
    try {
      final HttpRequest request = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(timeout)
          .GET()
          .build();
      final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        log.debug("Handle {} well-known lookup returned HTTP {}", handle, response.statusCode());
        return Optional.empty();
      }
      final String did = response.body() == null ? "" : response.body().trim();
      if (!did.startsWith("did:") || did.contains("\n")) {
        log.debug("Handle {} well-known lookup returned no did", handle);
        return Optional.empty();
      }
      return Optional.of(did);
    } catch (IOException e) {
      log.debug("Handle {} well-known lookup failed: {}", handle, e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Handle {} well-known lookup interrupted", handle);
      return Optional.empty();
    }
  }
}
