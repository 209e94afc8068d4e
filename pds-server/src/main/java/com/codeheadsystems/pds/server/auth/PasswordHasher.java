package com.codeheadsystems.pds.server.auth;

/**
 * One-way, salted password hashing.
 */
public interface PasswordHasher {

  /**
   * Hashes a password with a fresh salt.
   *
   * @param password the password
   * @return the encoded salt and hash
   */
  String hash(String password);

  /**
   * Checks a password against a stored hash.
   *
   * @param password the candidate password
   * @param stored   a value produced by {@link #hash(String)}
   * @return true on match
   */
  boolean verify(String password, String stored);
}
