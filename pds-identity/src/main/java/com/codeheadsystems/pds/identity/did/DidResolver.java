package com.codeheadsystems.pds.identity.did;

/**
 * Resolves a DID to the fields a personal data server needs from its document.
 */
public interface DidResolver {

  /**
   * Resolves the DID.
   *
   * @param did the did
   * @return the atproto data
   * @throws DidResolutionException if the DID is unknown, unreachable, or lacks an atproto
   *                                signing key, handle or service endpoint
   */
  AtprotoData resolveAtprotoData(String did);
}
