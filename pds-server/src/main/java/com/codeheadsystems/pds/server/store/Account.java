package com.codeheadsystems.pds.server.store;

import java.time.Instant;

/**
 * A registered account.
 *
 * @param did          the account DID
 * @param handle       the normalized handle
 * @param email        the lower-cased email
 * @param passwordHash the stored password hash
 * @param createdAt    registration time
 * @param takedownRef  moderation reference when the account is taken down, otherwise null
 */
public record Account(String did,
                      String handle,
                      String email,
                      String passwordHash,
                      Instant createdAt,
                      String takedownRef) {

  /**
   * Whether the account has been taken down.
   *
   * @return true if soft deleted
   */
  public boolean isTakenDown() {
    return takedownRef != null;
  }

  @Override
  public String toString() {
    return "Account{did=" + did + ", handle=" + handle + "}";
  }
}
