package com.codeheadsystems.pds.identity.handle;

/**
 * Thrown when a handle does not end in any of the domains the service hands out.
 */
public class UnsupportedDomainException extends RuntimeException {

  /**
   * Instantiates a new Unsupported domain exception.
   *
   * @param message the message
   */
  public UnsupportedDomainException(final String message) {
    super(message);
  }
}
