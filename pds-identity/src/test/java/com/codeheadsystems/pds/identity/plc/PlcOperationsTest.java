package com.codeheadsystems.pds.identity.plc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.pds.identity.crypto.EcKeypair;
import com.codeheadsystems.pds.identity.crypto.KeyType;
import java.security.SecureRandom;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlcOperationsTest {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final String PDS = "https://pds.test";

  private EcKeypair rotationKey;
  private EcKeypair signingKey;
  private String recoveryKey;

  @BeforeEach
  void setUp() {
    rotationKey = EcKeypair.generate(KeyType.SECP256K1, RANDOM);
    signingKey = EcKeypair.generate(KeyType.SECP256K1, RANDOM);
    recoveryKey = EcKeypair.generate(KeyType.SECP256K1, RANDOM).did();
  }

  @Test
  void createOp_buildsGenesisOperation() {
    PlcCreateResult result = PlcOperations.createOp(
        signingKey.did(), List.of(recoveryKey, rotationKey.did()), "alice.test", PDS, rotationKey);
    PlcOperation op = result.op();

    assertThat(op.type()).isEqualTo("plc_operation");
    assertThat(op.rotationKeys()).containsExactly(recoveryKey, rotationKey.did());
    assertThat(op.verificationMethods()).containsEntry("atproto", signingKey.did());
    assertThat(op.alsoKnownAs()).containsExactly("at://alice.test");
    assertThat(op.services().get("atproto_pds")).isEqualTo(new PlcService("AtprotoPersonalDataServer", PDS));
    assertThat(op.prev()).isNull();
    assertThat(op.isGenesis()).isTrue();
    assertThat(op.sig()).isNotBlank().doesNotContain("=");
  }

  @Test
  void createOp_didIsDerivedFromOperation() {
    PlcCreateResult result = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did()), "alice.test", PDS, rotationKey);

    assertThat(result.did()).matches("did:plc:[a-z2-7]{24}");
    assertThat(result.did()).isEqualTo(PlcOperations.didForGenesis(result.op()));
  }

  @Test
  void createOp_sameInputs_sameDid() {
    PlcCreateResult first = PlcOperations.createOp(
        signingKey.did(), List.of(recoveryKey, rotationKey.did()), "alice.test", PDS, rotationKey);
    PlcCreateResult second = PlcOperations.createOp(
        signingKey.did(), List.of(recoveryKey, rotationKey.did()), "alice.test", PDS, rotationKey);

    assertThat(second.did()).isEqualTo(first.did());
    assertThat(second.op()).isEqualTo(first.op());
  }

  @Test
  void createOp_rotationKeyOrderChangesDid() {
    PlcCreateResult first = PlcOperations.createOp(
        signingKey.did(), List.of(recoveryKey, rotationKey.did()), "alice.test", PDS, rotationKey);
    PlcCreateResult swapped = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did(), recoveryKey), "alice.test", PDS, rotationKey);

    assertThat(swapped.did()).isNotEqualTo(first.did());
  }

  @Test
  void createOp_differentHandle_differentDid() {
    PlcCreateResult alice = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did()), "alice.test", PDS, rotationKey);
    PlcCreateResult bob = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did()), "bob.test", PDS, rotationKey);

    assertThat(bob.did()).isNotEqualTo(alice.did());
  }

  @Test
  void verifySignature_acceptsSignerOnly() {
    PlcOperation op = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did()), "alice.test", PDS, rotationKey).op();

    assertThat(PlcOperations.verifySignature(op, op.rotationKeys())).isTrue();
    assertThat(PlcOperations.verifySignature(op, List.of(signingKey.did()))).isFalse();
  }

  @Test
  void verifySignature_tamperedOperation_fails() {
    PlcOperation op = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did()), "alice.test", PDS, rotationKey).op();
    PlcOperation tampered = new PlcOperation(op.type(), op.rotationKeys(), op.verificationMethods(),
        List.of("at://mallory.test"), op.services(), op.prev(), op.sig());

    assertThat(PlcOperations.verifySignature(tampered, op.rotationKeys())).isFalse();
  }

  @Test
  void verifySignature_unsigned_fails() {
    PlcOperation op = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did()), "alice.test", PDS, rotationKey).op();

    assertThat(PlcOperations.verifySignature(op.withSig(null), op.rotationKeys())).isFalse();
    assertThat(PlcOperations.verifySignature(op.withSig("%%%"), op.rotationKeys())).isFalse();
  }

  @Test
  void toSignedMap_unsigned_throws() {
    PlcOperation op = PlcOperations.createOp(
        signingKey.did(), List.of(rotationKey.did()), "alice.test", PDS, rotationKey).op();

    assertThatThrownBy(() -> op.withSig(null).toSignedMap()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void ensureAtPrefix_isIdempotent() {
    assertThat(PlcOperations.ensureAtPrefix("alice.test")).isEqualTo("at://alice.test");
    assertThat(PlcOperations.ensureAtPrefix("at://alice.test")).isEqualTo("at://alice.test");
  }
}
