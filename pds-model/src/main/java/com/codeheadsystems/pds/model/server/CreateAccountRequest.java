package com.codeheadsystems.pds.model.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * Wire model for {@code com.atproto.server.createAccount}.
 * <p>
 * {@code did} is only supplied by callers migrating an existing identity onto this server;
 * {@code inviteCode} is only required when the server gates registration behind invites;
 * {@code recoveryKey} is a {@code did:key} the caller wants placed ahead of the server's own
 * rotation keys when a new {@code did:plc} is minted.
 *
 * @param email       the account email, unique on this server
 * @param password    the plaintext password, hashed before it is stored
 * @param handle      the requested handle, normalized by the server
 * @param did         optional pre-existing DID to adopt
 * @param inviteCode  optional invite code
 * @param recoveryKey optional caller-held rotation key for a minted DID
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateAccountRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password,
    @JsonProperty("handle") String handle,
    @JsonProperty("did") String did,
    @JsonProperty("inviteCode") String inviteCode,
    @JsonProperty("recoveryKey") String recoveryKey) {

  /**
   * Convenience constructor for the common case of a new identity without a recovery key.
   */
  public CreateAccountRequest(String email, String password, String handle, String inviteCode) {
    this(email, password, handle, null, inviteCode, null);
  }

  public Optional<String> didOptional() {
    return blankToEmpty(did);
  }

  public Optional<String> inviteCodeOptional() {
    return blankToEmpty(inviteCode);
  }

  public Optional<String> recoveryKeyOptional() {
    return blankToEmpty(recoveryKey);
  }

  private static Optional<String> blankToEmpty(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }

  // Never print the password.
  @Override
  public String toString() {
    return "CreateAccountRequest[email=" + email + ", handle=" + handle + ", did=" + did
        + ", inviteCode=" + inviteCode + ", recoveryKey=" + recoveryKey + "]";
  }
}
