package com.codeheadsystems.pds.server.exception;

/**
 * Thrown by an account store when a handle, email or DID is already registered. The store
 * does not say which.
 */
public class UserAlreadyExistsException extends RuntimeException {

  /**
   * Instantiates a new User already exists exception.
   */
  public UserAlreadyExistsException() {
    super("User already exists");
  }
}
