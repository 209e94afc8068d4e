package com.codeheadsystems.pds.server.registration;

import static com.codeheadsystems.pds.server.exception.RegistrationError.INCOMPATIBLE_DID_DOC;
import static com.codeheadsystems.pds.server.exception.RegistrationError.INVALID_REQUEST;
import static com.codeheadsystems.pds.server.exception.RegistrationError.UNRESOLVABLE_DID;

import com.codeheadsystems.pds.identity.crypto.DidKeys;
import com.codeheadsystems.pds.identity.crypto.Keypair;
import com.codeheadsystems.pds.identity.did.AtprotoData;
import com.codeheadsystems.pds.identity.did.DidResolutionException;
import com.codeheadsystems.pds.identity.did.DidResolver;
import com.codeheadsystems.pds.identity.plc.PlcClient;
import com.codeheadsystems.pds.identity.plc.PlcClientException;
import com.codeheadsystems.pds.identity.plc.PlcCreateResult;
import com.codeheadsystems.pds.identity.plc.PlcDocumentData;
import com.codeheadsystems.pds.identity.plc.PlcOperations;
import com.codeheadsystems.pds.server.ServiceConfig;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the DID of a new account.
 * <p>
 * Without a caller DID a {@code did:plc} genesis operation is formatted and signed, but not
 * submitted. With a caller DID the existing document must already name this node's handle,
 * endpoint and signing key, and for {@code did:plc} also list this node's rotation key.
 * Neither path writes anything.
 */
public class DidProvisioner {

  private static final Logger log = LoggerFactory.getLogger(DidProvisioner.class);

  private final ServiceConfig config;
  private final Keypair repoSigningKey;
  private final Keypair plcRotationKey;
  private final PlcClient plcClient;
  private final DidResolver didResolver;

  /**
   * Instantiates a new Did provisioner.
   *
   * @param config         node policy
   * @param repoSigningKey the node's repository signing key
   * @param plcRotationKey the node's PLC rotation key
   * @param plcClient      the PLC registry
   * @param didResolver    resolver for caller DIDs
   */
  public DidProvisioner(final ServiceConfig config,
                        final Keypair repoSigningKey,
                        final Keypair plcRotationKey,
                        final PlcClient plcClient,
                        final DidResolver didResolver) {
    this.config = config;
    this.repoSigningKey = repoSigningKey;
    this.plcRotationKey = plcRotationKey;
    this.plcClient = plcClient;
    this.didResolver = didResolver;
  }

  /**
   * Provisions the DID for a validated handle.
   *
   * @param handle      the normalized handle
   * @param callerDid   the DID the caller is bringing, or null to mint one
   * @param recoveryKey a did:key to put first in the rotation keys of a minted DID, or null
   * @return the DID and, when minted, the operation to submit
   * @throws RegistrationException with {@code UNRESOLVABLE_DID} or {@code INCOMPATIBLE_DID_DOC}
   *                               for an unusable caller DID, or {@code INVALID_REQUEST} for a
   *                               malformed recovery key
   */
  public ProvisionedDid provision(final String handle, final String callerDid, final String recoveryKey) {
    return callerDid == null ? mint(handle, recoveryKey) : adopt(handle, callerDid);
  }

  private ProvisionedDid mint(final String handle, final String recoveryKey) {
    final List<String> rotationKeys = new ArrayList<>();
    if (recoveryKey != null) {
      try {
        DidKeys.parseDidKey(recoveryKey);
      } catch (IllegalArgumentException e) {
        throw new RegistrationException(INVALID_REQUEST, "Invalid recovery key: " + e.getMessage(), e);
      }
      rotationKeys.add(recoveryKey);
    }
    if (config.recoveryKey() != null) {
      rotationKeys.add(config.recoveryKey());
    }
    rotationKeys.add(plcRotationKey.did());
    final PlcCreateResult created = plcClient.createOperation(
        repoSigningKey.did(), rotationKeys, handle, config.publicUrl(), plcRotationKey);
    log.debug("Formatted genesis operation for {} as {}", handle, created.did());
    return new ProvisionedDid(created.did(), created.op());
  }

  private ProvisionedDid adopt(final String handle, final String did) {
    final AtprotoData data;
    try {
      data = didResolver.resolveAtprotoData(did);
    } catch (DidResolutionException e) {
      log.info("Could not resolve caller DID {}: {}", did, e.getMessage());
      throw new RegistrationException(UNRESOLVABLE_DID, e.getMessage(), e);
    }
    if (!repoSigningKey.did().equals(data.signingKey())) {
      throw incompatible("did document signingKey did not match service signingKey: " + repoSigningKey.did());
    }
    if (!handle.equals(data.handle())) {
      throw incompatible("did document handle did not match requested handle");
    }
    if (!config.publicUrl().equals(data.pds())) {
      throw incompatible("did document AtprotoPersonalDataServer did not match service publicUrl: "
          + config.publicUrl());
    }
    if (did.startsWith(PlcOperations.DID_PLC_PREFIX)) {
      final PlcDocumentData plcData;
      try {
        plcData = plcClient.getDocumentData(did);
      } catch (PlcClientException e) {
        log.info("Could not read PLC data for caller DID {}: {}", did, e.getMessage());
        throw new RegistrationException(UNRESOLVABLE_DID, "Could not resolve DID: " + did, e);
      }
      if (!plcData.rotationKeys().contains(plcRotationKey.did())) {
        throw incompatible("did document rotationKeys did not include service rotationKey: "
            + plcRotationKey.did());
      }
    }
    log.debug("Adopting existing DID {} for {}", did, handle);
    return new ProvisionedDid(did, null);
  }

  private RegistrationException incompatible(final String message) {
    return new RegistrationException(INCOMPATIBLE_DID_DOC, message);
  }
}
