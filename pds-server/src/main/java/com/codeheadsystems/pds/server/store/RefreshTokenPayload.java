package com.codeheadsystems.pds.server.store;

import java.time.Instant;

/**
 * The durable record of an issued refresh token.
 *
 * @param id        the token's jti
 * @param did       the DID it was issued to
 * @param expiresAt expiry
 */
public record RefreshTokenPayload(String id, String did, Instant expiresAt) {
}
