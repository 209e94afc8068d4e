package com.codeheadsystems.pds.server.exception;

/**
 * Unclassified storage failure.
 */
public class DatabaseException extends RuntimeException {

  /**
   * Instantiates a new Database exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DatabaseException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
