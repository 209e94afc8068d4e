package com.codeheadsystems.pds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every XRPC endpoint on failure.
 *
 * @param error   machine-readable error name, e.g. {@code InvalidInviteCode}
 * @param message human-readable detail
 */
public record XrpcError(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message) {
}
