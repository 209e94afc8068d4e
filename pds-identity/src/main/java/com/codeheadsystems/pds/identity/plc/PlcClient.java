package com.codeheadsystems.pds.identity.plc;

import com.codeheadsystems.pds.identity.crypto.Keypair;
import java.util.List;

/**
 * Client for the PLC identity registry.
 * <p>
 * Operations are formatted locally and only reach the registry through
 * {@link #sendOperation(String, PlcOperation)}, which is not idempotent from the caller's
 * point of view and must not be retried blindly.
 */
public interface PlcClient {

  /**
   * Formats and signs a genesis operation without submitting it.
   *
   * @param signingKey   the repo signing key as a did:key
   * @param rotationKeys rotation did:keys, highest priority first
   * @param handle       the handle
   * @param pds          the hosting server url
   * @param signer       the rotation key that signs the operation
   * @return the DID and the operation
   */
  default PlcCreateResult createOperation(String signingKey,
                                          List<String> rotationKeys,
                                          String handle,
                                          String pds,
                                          Keypair signer) {
    return PlcOperations.createOp(signingKey, rotationKeys, handle, pds, signer);
  }

  /**
   * Submits a signed operation.
   *
   * @param did the DID the operation applies to
   * @param op  the signed operation
   * @throws PlcClientException if the registry is unreachable or rejects the operation
   */
  void sendOperation(String did, PlcOperation op);

  /**
   * Fetches the current document data.
   *
   * @param did the did:plc
   * @return the data
   * @throws PlcClientException if the registry is unreachable or does not know the DID
   */
  PlcDocumentData getDocumentData(String did);
}
