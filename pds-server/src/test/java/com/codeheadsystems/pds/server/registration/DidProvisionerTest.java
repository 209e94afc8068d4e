package com.codeheadsystems.pds.server.registration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.pds.identity.crypto.EcKeypair;
import com.codeheadsystems.pds.identity.crypto.KeyType;
import com.codeheadsystems.pds.identity.did.AtprotoData;
import com.codeheadsystems.pds.identity.did.DidResolver;
import com.codeheadsystems.pds.identity.plc.InMemoryPlcClient;
import com.codeheadsystems.pds.identity.plc.PlcClient;
import com.codeheadsystems.pds.identity.plc.PlcCreateResult;
import com.codeheadsystems.pds.identity.plc.PlcOperation;
import com.codeheadsystems.pds.identity.plc.PlcOperations;
import com.codeheadsystems.pds.server.ServiceConfig;
import com.codeheadsystems.pds.server.TestServiceContexts;
import com.codeheadsystems.pds.server.exception.RegistrationError;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DidProvisionerTest {

  private static final String HANDLE = "alice.example";

  private EcKeypair repoSigningKey;
  private EcKeypair plcRotationKey;
  private EcKeypair userKey;
  private InMemoryPlcClient registry;
  private DidProvisioner provisioner;

  @BeforeEach
  void setUp() {
    repoSigningKey = EcKeypair.generate(KeyType.SECP256K1, TestServiceContexts.RANDOM);
    plcRotationKey = EcKeypair.generate(KeyType.SECP256K1, TestServiceContexts.RANDOM);
    userKey = EcKeypair.generate(KeyType.P256, TestServiceContexts.RANDOM);
    registry = new InMemoryPlcClient();
    provisioner = new DidProvisioner(TestServiceContexts.config(true), repoSigningKey, plcRotationKey,
        registry, registry);
  }

  private static RegistrationError errorOf(Throwable t) {
    return ((RegistrationException) t).getError();
  }

  /**
   * Registers a DID directly with the registry, as a user migrating in would have.
   */
  private String existingDid(String signingKey, List<String> rotationKeys, String handle, String pds) {
    PlcCreateResult created = PlcOperations.createOp(signingKey, rotationKeys, handle, pds, userKey);
    registry.sendOperation(created.did(), created.op());
    return created.did();
  }

  // ── Minting ──────────────────────────────────────────────────────────────

  @Test
  void provision_noCallerDid_formatsGenesisWithoutSubmitting() {
    ProvisionedDid provisioned = provisioner.provision(HANDLE, null, null);

    assertThat(provisioned.did()).startsWith(PlcOperations.DID_PLC_PREFIX);
    PlcOperation op = provisioned.pendingOperation().orElseThrow();
    assertThat(op.isGenesis()).isTrue();
    assertThat(PlcOperations.didForGenesis(op)).isEqualTo(provisioned.did());
    assertThat(op.rotationKeys()).containsExactly(plcRotationKey.did());
    assertThat(op.verificationMethods()).containsEntry("atproto", repoSigningKey.did());
    assertThat(op.alsoKnownAs()).containsExactly("at://" + HANDLE);
    assertThat(op.services().get("atproto_pds").endpoint()).isEqualTo(TestServiceContexts.PUBLIC_URL);
    assertThat(PlcOperations.verifySignature(op, List.of(plcRotationKey.did()))).isTrue();
    assertThat(registry.operationLog(provisioned.did())).isEmpty();
  }

  @Test
  void provision_sameInputsTwice_sameDid() {
    assertThat(provisioner.provision(HANDLE, null, null).did())
        .isEqualTo(provisioner.provision(HANDLE, null, null).did());
  }

  @Test
  void provision_recoveryKeys_orderedCallerThenServiceThenNode() {
    String serviceRecovery = EcKeypair.generate(KeyType.SECP256K1, TestServiceContexts.RANDOM).did();
    ServiceConfig base = TestServiceContexts.config(true);
    ServiceConfig config = new ServiceConfig(base.publicUrl(), base.scheme(), base.availableUserDomains(),
        base.reservedHandles(), true, serviceRecovery);
    DidProvisioner withRecovery = new DidProvisioner(config, repoSigningKey, plcRotationKey, registry, registry);

    PlcOperation op = withRecovery.provision(HANDLE, null, userKey.did()).pendingOperation().orElseThrow();

    assertThat(op.rotationKeys()).containsExactly(userKey.did(), serviceRecovery, plcRotationKey.did());
  }

  @Test
  void provision_malformedRecoveryKey_invalidRequest() {
    assertThatThrownBy(() -> provisioner.provision(HANDLE, null, "not-a-did-key"))
        .isInstanceOf(RegistrationException.class)
        .hasMessageStartingWith("Invalid recovery key")
        .satisfies(t -> assertThat(errorOf(t)).isEqualTo(RegistrationError.INVALID_REQUEST));
  }

  // ── Adopting ─────────────────────────────────────────────────────────────

  @Test
  void provision_compatibleCallerDid_adoptedWithoutOperation() {
    String did = existingDid(repoSigningKey.did(), List.of(userKey.did(), plcRotationKey.did()), HANDLE,
        TestServiceContexts.PUBLIC_URL);

    ProvisionedDid provisioned = provisioner.provision(HANDLE, did, null);

    assertThat(provisioned.did()).isEqualTo(did);
    assertThat(provisioned.pendingOperation()).isEmpty();
    assertThat(registry.operationLog(did)).hasSize(1);
  }

  @Test
  void provision_unknownCallerDid_unresolvable() {
    assertThatThrownBy(() -> provisioner.provision(HANDLE, "did:plc:aaaaaaaaaaaaaaaaaaaaaaaa", null))
        .isInstanceOf(RegistrationException.class)
        .satisfies(t -> assertThat(errorOf(t)).isEqualTo(RegistrationError.UNRESOLVABLE_DID));
  }

  @Test
  void provision_signingKeyMismatch_incompatible() {
    String did = existingDid(userKey.did(), List.of(userKey.did(), plcRotationKey.did()), HANDLE,
        TestServiceContexts.PUBLIC_URL);

    assertThatThrownBy(() -> provisioner.provision(HANDLE, did, null))
        .isInstanceOf(RegistrationException.class)
        .hasMessage("did document signingKey did not match service signingKey: " + repoSigningKey.did())
        .satisfies(t -> assertThat(errorOf(t)).isEqualTo(RegistrationError.INCOMPATIBLE_DID_DOC));
  }

  @Test
  void provision_handleMismatch_incompatible() {
    String did = existingDid(repoSigningKey.did(), List.of(userKey.did(), plcRotationKey.did()),
        "bob.example", TestServiceContexts.PUBLIC_URL);

    assertThatThrownBy(() -> provisioner.provision(HANDLE, did, null))
        .isInstanceOf(RegistrationException.class)
        .hasMessage("did document handle did not match requested handle");
  }

  @Test
  void provision_endpointMismatch_incompatible() {
    String did = existingDid(repoSigningKey.did(), List.of(userKey.did(), plcRotationKey.did()), HANDLE,
        "https://elsewhere.example");

    assertThatThrownBy(() -> provisioner.provision(HANDLE, did, null))
        .isInstanceOf(RegistrationException.class)
        .hasMessage("did document AtprotoPersonalDataServer did not match service publicUrl: "
            + TestServiceContexts.PUBLIC_URL)
        .satisfies(t -> assertThat(errorOf(t)).isEqualTo(RegistrationError.INCOMPATIBLE_DID_DOC));
  }

  @Test
  void provision_nodeRotationKeyMissing_incompatible() {
    String did = existingDid(repoSigningKey.did(), List.of(userKey.did()), HANDLE,
        TestServiceContexts.PUBLIC_URL);

    assertThatThrownBy(() -> provisioner.provision(HANDLE, did, null))
        .isInstanceOf(RegistrationException.class)
        .hasMessage("did document rotationKeys did not include service rotationKey: " + plcRotationKey.did())
        .satisfies(t -> assertThat(errorOf(t)).isEqualTo(RegistrationError.INCOMPATIBLE_DID_DOC));
  }

  @Test
  void provision_didWeb_skipsRotationKeyCheck() {
    DidResolver resolver = mock(DidResolver.class);
    PlcClient plcClient = mock(PlcClient.class);
    String did = "did:web:alice.example";
    when(resolver.resolveAtprotoData(did))
        .thenReturn(new AtprotoData(did, repoSigningKey.did(), HANDLE, TestServiceContexts.PUBLIC_URL));
    DidProvisioner webProvisioner = new DidProvisioner(TestServiceContexts.config(true), repoSigningKey,
        plcRotationKey, plcClient, resolver);

    ProvisionedDid provisioned = webProvisioner.provision(HANDLE, did, null);

    assertThat(provisioned.did()).isEqualTo(did);
    assertThat(provisioned.pendingOperation()).isEmpty();
    verify(resolver).resolveAtprotoData(anyString());
    verifyNoInteractions(plcClient);
  }
}
