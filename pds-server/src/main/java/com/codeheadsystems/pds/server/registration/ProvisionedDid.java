package com.codeheadsystems.pds.server.registration;

import com.codeheadsystems.pds.identity.plc.PlcOperation;
import java.util.Optional;

/**
 * The DID an account will be registered under.
 *
 * @param did       the DID
 * @param pendingOp a signed genesis operation still to be submitted, or null when the DID
 *                  already exists
 */
public record ProvisionedDid(String did, PlcOperation pendingOp) {

  public Optional<PlcOperation> pendingOperation() {
    return Optional.ofNullable(pendingOp);
  }
}
