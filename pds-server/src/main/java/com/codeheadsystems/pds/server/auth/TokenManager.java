package com.codeheadsystems.pds.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.pds.server.store.RefreshTokenPayload;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies session JWTs.
 * <p>
 * Tokens are signed with HMAC-SHA256 and scoped: access tokens carry
 * {@value #ACCESS_SCOPE}, refresh tokens carry {@value #REFRESH_SCOPE} and a random JTI that
 * the caller records with the refresh token store. Issuing a token has no side effects.
 */
public class TokenManager {

  /**
   * Scope claim of access tokens.
   */
  public static final String ACCESS_SCOPE = "com.atproto.access";

  /**
   * Scope claim of refresh tokens.
   */
  public static final String REFRESH_SCOPE = "com.atproto.refresh";

  /**
   * Default access token lifetime.
   */
  public static final Duration DEFAULT_ACCESS_TTL = Duration.ofHours(2);

  /**
   * Default refresh token lifetime.
   */
  public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(90);

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);
  private static final String SCOPE_CLAIM = "scope";

  private final Algorithm algorithm;
  private final JWTVerifier accessVerifier;
  private final String issuer;
  private final Duration accessTtl;
  private final Duration refreshTtl;
  private final Clock clock;

  /**
   * Creates a new TokenManager.
   *
   * @param secret     HMAC-SHA256 signing secret
   * @param issuer     JWT issuer claim
   * @param accessTtl  access token lifetime
   * @param refreshTtl refresh token lifetime
   * @param clock      time source for issuing and verifying
   */
  public TokenManager(byte[] secret, String issuer, Duration accessTtl, Duration refreshTtl, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.accessVerifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(issuer)
        .withClaim(SCOPE_CLAIM, ACCESS_SCOPE))
        .build(clock);
    this.issuer = issuer;
    this.accessTtl = accessTtl;
    this.refreshTtl = refreshTtl;
    this.clock = clock;
  }

  /**
   * An issued access token.
   *
   * @param jwt       the signed token
   * @param did       the subject
   * @param expiresAt expiry
   */
  public record AccessToken(String jwt, String did, Instant expiresAt) {
  }

  /**
   * An issued refresh token and the record to store for it.
   *
   * @param jwt     the signed token
   * @param payload what the refresh token store keeps
   */
  public record RefreshToken(String jwt, RefreshTokenPayload payload) {
  }

  /**
   * Issues an access token for a DID.
   *
   * @param did the subject
   * @return the token
   */
  public AccessToken createAccessToken(String did) {
    Instant now = clock.instant();
    Instant expiresAt = now.plus(accessTtl);
    String jwt = JWT.create()
        .withIssuer(issuer)
        .withSubject(did)
        .withClaim(SCOPE_CLAIM, ACCESS_SCOPE)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued access token for {}", did);
    return new AccessToken(jwt, did, expiresAt);
  }

  /**
   * Issues a refresh token for a DID.
   *
   * @param did the subject
   * @return the token and its record
   */
  public RefreshToken createRefreshToken(String did) {
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant();
    Instant expiresAt = now.plus(refreshTtl);
    String jwt = JWT.create()
        .withIssuer(issuer)
        .withSubject(did)
        .withJWTId(jti)
        .withClaim(SCOPE_CLAIM, REFRESH_SCOPE)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued refresh token jti={} for {}", jti, did);
    return new RefreshToken(jwt, new RefreshTokenPayload(jti, did, expiresAt));
  }

  /**
   * Verifies an access token.
   *
   * @param token JWT string
   * @return the DID it was issued to, empty if invalid, expired or not an access token
   */
  public Optional<String> verifyAccessToken(String token) {
    try {
      DecodedJWT decoded = accessVerifier.verify(token);
      return Optional.ofNullable(decoded.getSubject());
    } catch (JWTVerificationException e) {
      log.debug("Access token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
