package com.codeheadsystems.pds.identity.did;

/**
 * The atproto-relevant fields of a resolved DID document.
 *
 * @param did        the did
 * @param signingKey the repo signing key as a did:key
 * @param handle     the claimed handle
 * @param pds        the claimed personal data server endpoint
 */
public record AtprotoData(String did, String signingKey, String handle, String pds) {
}
