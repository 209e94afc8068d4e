package com.codeheadsystems.pds.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing the account behind an access token.
 *
 * @param did the account DID from the token subject
 */
public record PdsPrincipal(String did) implements Principal {

  @Override
  public String getName() {
    return did;
  }
}
