package com.codeheadsystems.pds.model.server;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned by {@code com.atproto.server.getSession}.
 *
 * @param handle the account handle
 * @param did    the account DID
 * @param email  the account email
 */
public record GetSessionResponse(
    @JsonProperty("handle") String handle,
    @JsonProperty("did") String did,
    @JsonProperty("email") String email) {
}
