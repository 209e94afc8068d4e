package com.codeheadsystems.pds.identity.plc;

/**
 * Thrown when the PLC registry cannot be reached or rejects a request.
 */
public class PlcClientException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new Plc client exception for a transport failure.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PlcClientException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /**
   * Instantiates a new Plc client exception for an HTTP error status.
   *
   * @param message    the message
   * @param statusCode the status code
   */
  public PlcClientException(final String message, final int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * Gets the HTTP status returned by the registry, or -1 if no response was received.
   *
   * @return the status code
   */
  public int getStatusCode() {
    return statusCode;
  }
}
