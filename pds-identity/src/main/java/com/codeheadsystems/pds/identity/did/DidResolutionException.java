package com.codeheadsystems.pds.identity.did;

/**
 * Thrown when a DID cannot be resolved to a usable atproto document.
 */
public class DidResolutionException extends RuntimeException {

  /**
   * Instantiates a new Did resolution exception.
   *
   * @param message the message
   */
  public DidResolutionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Did resolution exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DidResolutionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
