package com.codeheadsystems.pds.server.exception;

/**
 * Caller-facing reasons a registration is refused, with the XRPC error name each one is
 * reported under.
 */
public enum RegistrationError {
  INVALID_INVITE_CODE("InvalidInviteCode"),
  INVALID_HANDLE("InvalidHandle"),
  HANDLE_UNAVAILABLE("HandleNotAvailable"),
  UNSUPPORTED_DOMAIN("UnsupportedDomain"),
  HANDLE_MISMATCH("InvalidRequest"),
  UNRESOLVABLE_DID("UnresolvableDid"),
  INCOMPATIBLE_DID_DOC("InvalidDidDoc"),
  HANDLE_TAKEN("InvalidRequest"),
  EMAIL_TAKEN("InvalidRequest"),
  DID_TAKEN("InvalidRequest"),
  INVALID_REQUEST("InvalidRequest");

  private final String xrpcName;

  RegistrationError(String xrpcName) {
    this.xrpcName = xrpcName;
  }

  /**
   * Gets the XRPC error name.
   *
   * @return the xrpc name
   */
  public String xrpcName() {
    return xrpcName;
  }
}
