package com.codeheadsystems.pds.server.store;

import java.util.Optional;

/**
 * Storage for issued refresh tokens.
 */
public interface RefreshTokenStore {

  /**
   * Records a refresh token.
   *
   * @param payload the token record
   */
  void grant(RefreshTokenPayload payload);

  /**
   * Reads a refresh token record.
   *
   * @param id the jti
   * @return the record
   */
  Optional<RefreshTokenPayload> find(String id);
}
