package com.codeheadsystems.pds.server;

import com.codeheadsystems.pds.identity.crypto.Keypair;
import com.codeheadsystems.pds.identity.did.DidResolver;
import com.codeheadsystems.pds.identity.handle.ExternalHandleResolver;
import com.codeheadsystems.pds.identity.plc.PlcClient;
import com.codeheadsystems.pds.server.auth.PasswordHasher;
import com.codeheadsystems.pds.server.auth.TokenManager;
import com.codeheadsystems.pds.server.db.Database;
import com.codeheadsystems.pds.server.repo.RepoManager;
import java.time.Clock;

/**
 * Everything account provisioning depends on, passed explicitly so tests can substitute any
 * collaborator.
 *
 * @param config                 node policy
 * @param repoSigningKey         key that signs repository commits; becomes each DID's signing key
 * @param plcRotationKey         this node's rotation key on the PLC registry
 * @param plcClient              PLC registry client
 * @param didResolver            resolver for caller-supplied DIDs
 * @param externalHandleResolver resolver for handles on domains this node does not serve
 * @param database               transactional store
 * @param passwordHasher         password hashing
 * @param tokenManager           session token issuer
 * @param repoManager            repository initialisation
 * @param clock                  time source
 */
public record ServiceContext(ServiceConfig config,
                             Keypair repoSigningKey,
                             Keypair plcRotationKey,
                             PlcClient plcClient,
                             DidResolver didResolver,
                             ExternalHandleResolver externalHandleResolver,
                             Database database,
                             PasswordHasher passwordHasher,
                             TokenManager tokenManager,
                             RepoManager repoManager,
                             Clock clock) {
}
