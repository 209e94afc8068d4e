package com.codeheadsystems.pds.identity.handle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class HandleRulesTest {

  private static final List<String> DOMAINS = List.of(".test", ".bsky.example");

  // ─── Syntax ───────────────────────────────────────────────────────────────

  @Test
  void normalizeAndEnsureValid_lowercases() {
    assertThat(HandleRules.normalizeAndEnsureValid("Alice.Example")).isEqualTo("alice.example");
  }

  @ParameterizedTest
  @ValueSource(strings = {"alice.test", "a.co", "xn--ls8h.example", "john-doe.bsky.example", "1337.com"})
  void normalizeAndEnsureValid_acceptsValidHandles(String handle) {
    assertThat(HandleRules.normalizeAndEnsureValid(handle)).isEqualTo(handle);
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
      "alice_b.test|Disallowed characters in handle",
      "alice b.test|Disallowed characters in handle",
      "alice|Handle domain needs at least two parts",
      "alice..test|Handle parts can not be empty",
      ".alice.test|Handle parts can not be empty",
      "-alice.test|Handle parts can not start or end with hyphens",
      "alice-.test|Handle parts can not start or end with hyphens",
      "alice.1test|Handle final component (TLD) must start with ASCII letter"
  })
  void normalizeAndEnsureValid_rejectsMalformed(String handle, String message) {
    assertThatThrownBy(() -> HandleRules.normalizeAndEnsureValid(handle))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessageContaining(message);
  }

  @Test
  void normalizeAndEnsureValid_labelTooLong() {
    String handle = "a".repeat(64) + ".test";
    assertThatThrownBy(() -> HandleRules.normalizeAndEnsureValid(handle))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessageContaining("Handle part too long");
  }

  @Test
  void normalizeAndEnsureValid_handleTooLong() {
    String label = "a".repeat(63);
    String handle = String.join(".", label, label, label, label) + ".test";
    assertThatThrownBy(() -> HandleRules.normalizeAndEnsureValid(handle))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessageContaining("253 chars max");
  }

  @Test
  void normalizeAndEnsureValid_null() {
    assertThatThrownBy(() -> HandleRules.normalizeAndEnsureValid(null))
        .isInstanceOf(InvalidHandleException.class);
  }

  // ─── Service constraints ──────────────────────────────────────────────────

  @Test
  void ensureServiceConstraints_acceptsServedHandle() {
    HandleRules.ensureServiceConstraints("alice.test", DOMAINS, HandleRules.DEFAULT_RESERVED);
    HandleRules.ensureServiceConstraints("bob.bsky.example", DOMAINS, HandleRules.DEFAULT_RESERVED);
  }

  @Test
  void ensureServiceConstraints_foreignDomain() {
    assertThatThrownBy(() -> HandleRules.ensureServiceConstraints("alice.example", DOMAINS, Set.of()))
        .isInstanceOf(UnsupportedDomainException.class)
        .hasMessage("Not a supported handle domain");
  }

  @Test
  void ensureServiceConstraints_dotInFront() {
    assertThatThrownBy(() -> HandleRules.ensureServiceConstraints("al.ice.test", DOMAINS, Set.of()))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessage("Invalid characters in handle");
  }

  @Test
  void ensureServiceConstraints_tooShort() {
    assertThatThrownBy(() -> HandleRules.ensureServiceConstraints("ab.test", DOMAINS, Set.of()))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessage("Handle too short");
  }

  @Test
  void ensureServiceConstraints_tooLong() {
    String handle = "a".repeat(26) + ".test";
    assertThatThrownBy(() -> HandleRules.ensureServiceConstraints(handle, DOMAINS, Set.of()))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessage("Handle too long");
  }

  @Test
  void ensureServiceConstraints_reserved() {
    assertThatThrownBy(() -> HandleRules.ensureServiceConstraints("admin.test", DOMAINS, HandleRules.DEFAULT_RESERVED))
        .isInstanceOf(ReservedHandleException.class)
        .hasMessage("Reserved handle");
  }
}
