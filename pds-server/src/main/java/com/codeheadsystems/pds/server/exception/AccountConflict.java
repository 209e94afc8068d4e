package com.codeheadsystems.pds.server.exception;

/**
 * Which unique column a rejected account insert collided with.
 */
public enum AccountConflict {
  HANDLE(RegistrationError.HANDLE_TAKEN, "Handle already taken: "),
  EMAIL(RegistrationError.EMAIL_TAKEN, "Email already taken: "),
  DID(RegistrationError.DID_TAKEN, "DID already registered: ");

  private final RegistrationError error;
  private final String messagePrefix;

  AccountConflict(RegistrationError error, String messagePrefix) {
    this.error = error;
    this.messagePrefix = messagePrefix;
  }

  /**
   * Builds the caller-facing exception for this conflict.
   *
   * @param value the handle, email or DID that collided
   * @return the exception
   */
  public RegistrationException toException(final String value) {
    return new RegistrationException(error, messagePrefix + value);
  }
}
