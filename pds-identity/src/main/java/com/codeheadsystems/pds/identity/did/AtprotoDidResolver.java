package com.codeheadsystems.pds.identity.did;

import com.codeheadsystems.pds.identity.plc.PlcOperations;
import com.fasterxml.jackson.databind.JsonNode;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DidResolver} for the did:plc and did:web methods.
 */
@Singleton
public class AtprotoDidResolver implements DidResolver {
  private static final Logger log = LoggerFactory.getLogger(AtprotoDidResolver.class);

  private final PlcDidResolver plcResolver;
  private final WebDidResolver webResolver;

  /**
   * Instantiates a new Atproto did resolver.
   *
   * @param plcResolver the did:plc resolver
   * @param webResolver the did:web resolver
   */
  @Inject
  public AtprotoDidResolver(final PlcDidResolver plcResolver, final WebDidResolver webResolver) {
    this.plcResolver = plcResolver;
    this.webResolver = webResolver;
  }

  @Override
  public AtprotoData resolveAtprotoData(final String did) {
    log.debug("resolveAtprotoData(did={})", did);
    final BaseDidResolver resolver;
    if (did.startsWith(PlcOperations.DID_PLC_PREFIX)) {
      resolver = plcResolver;
    } else if (did.startsWith(WebDidResolver.DID_WEB_PREFIX)) {
      resolver = webResolver;
    } else {
      throw new DidResolutionException("Unsupported did method: " + did);
    }
    final JsonNode document = resolver.resolve(did)
        .orElseThrow(() -> new DidResolutionException("Could not resolve DID: " + did));
    return DidDocuments.toAtprotoData(document);
  }
}
