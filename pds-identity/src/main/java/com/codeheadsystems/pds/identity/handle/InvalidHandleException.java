package com.codeheadsystems.pds.identity.handle;

/**
 * Thrown when a handle is syntactically invalid or breaks a service length rule.
 */
public class InvalidHandleException extends RuntimeException {

  /**
   * Instantiates a new Invalid handle exception.
   *
   * @param message the message
   */
  public InvalidHandleException(final String message) {
    super(message);
  }
}
