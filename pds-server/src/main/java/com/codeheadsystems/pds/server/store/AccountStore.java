package com.codeheadsystems.pds.server.store;

import com.codeheadsystems.pds.server.exception.UserAlreadyExistsException;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage for account rows. Handles, emails and DIDs are each unique across the node.
 */
public interface AccountStore {

  /**
   * Inserts a new account.
   *
   * @param email        lower-cased email
   * @param handle       normalized handle
   * @param did          the DID
   * @param passwordHash the password hash
   * @param now          creation time
   * @throws UserAlreadyExistsException if the handle, email or DID is already registered
   */
  void registerUser(String email, String handle, String did, String passwordHash, Instant now);

  /**
   * Looks up an account by handle or DID.
   *
   * @param handleOrDid        a handle, or a DID when it starts with {@code did:}
   * @param includeSoftDeleted whether taken down accounts are returned
   * @return the account
   */
  Optional<Account> getAccount(String handleOrDid, boolean includeSoftDeleted);

  /**
   * Looks up an account by email.
   *
   * @param email              lower-cased email
   * @param includeSoftDeleted whether taken down accounts are returned
   * @return the account
   */
  Optional<Account> getAccountByEmail(String email, boolean includeSoftDeleted);

  /**
   * Sets or clears the takedown reference of an account.
   *
   * @param did         the DID
   * @param takedownRef the reference, or null to restore the account
   * @return true if the account exists
   */
  boolean updateTakedown(String did, String takedownRef);
}
