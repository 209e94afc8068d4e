package com.codeheadsystems.pds.identity.handle;

import java.util.Optional;

/**
 * Resolves a handle on a domain this service does not serve to the DID it claims.
 */
public interface ExternalHandleResolver {

  /**
   * Resolves the handle.
   *
   * @param scheme {@code https} in production, {@code http} for local development
   * @param handle the normalized handle
   * @return the DID the handle's domain declares, or empty if it declares none
   */
  Optional<String> resolve(String scheme, String handle);
}
