package com.codeheadsystems.pds.model.server;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned by {@code com.atproto.server.createAccount}.
 *
 * @param handle     the normalized handle bound to the account
 * @param did        the account DID, minted or adopted
 * @param accessJwt  short-lived access token for the new session
 * @param refreshJwt long-lived refresh token for the new session
 */
public record CreateAccountResponse(
    @JsonProperty("handle") String handle,
    @JsonProperty("did") String did,
    @JsonProperty("accessJwt") String accessJwt,
    @JsonProperty("refreshJwt") String refreshJwt) {
}
