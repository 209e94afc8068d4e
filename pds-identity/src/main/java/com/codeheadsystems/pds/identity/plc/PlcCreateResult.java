package com.codeheadsystems.pds.identity.plc;

/**
 * A signed genesis operation and the DID it will create once submitted.
 *
 * @param did the did:plc
 * @param op  the signed operation
 */
public record PlcCreateResult(String did, PlcOperation op) {
}
