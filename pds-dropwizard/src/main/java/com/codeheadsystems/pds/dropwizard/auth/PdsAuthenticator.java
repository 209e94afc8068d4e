package com.codeheadsystems.pds.dropwizard.auth;

import com.codeheadsystems.pds.server.auth.TokenManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates access tokens using {@link TokenManager}.
 * Refresh tokens are not accepted.
 */
public class PdsAuthenticator implements Authenticator<String, PdsPrincipal> {

  private final TokenManager tokenManager;

  /**
   * Instantiates a new Pds authenticator.
   *
   * @param tokenManager the token manager
   */
  public PdsAuthenticator(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  public Optional<PdsPrincipal> authenticate(String token) throws AuthenticationException {
    return tokenManager.verifyAccessToken(token).map(PdsPrincipal::new);
  }
}
