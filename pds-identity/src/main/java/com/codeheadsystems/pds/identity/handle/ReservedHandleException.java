package com.codeheadsystems.pds.identity.handle;

/**
 * Thrown when a handle is well formed but reserved by the service.
 */
public class ReservedHandleException extends RuntimeException {

  /**
   * Instantiates a new Reserved handle exception.
   *
   * @param message the message
   */
  public ReservedHandleException(final String message) {
    super(message);
  }
}
