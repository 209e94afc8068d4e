package com.codeheadsystems.pds.server.exception;

/**
 * A registration refused because of the caller's input. Never retryable without changing
 * the request.
 */
public class RegistrationException extends RuntimeException {

  private final RegistrationError error;

  /**
   * Instantiates a new Registration exception.
   *
   * @param error   the error kind
   * @param message the caller-facing message
   */
  public RegistrationException(final RegistrationError error, final String message) {
    super(message);
    this.error = error;
  }

  /**
   * Instantiates a new Registration exception.
   *
   * @param error   the error kind
   * @param message the caller-facing message
   * @param cause   the cause
   */
  public RegistrationException(final RegistrationError error, final String message, final Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  /**
   * Gets the error kind.
   *
   * @return the error
   */
  public RegistrationError getError() {
    return error;
  }
}
