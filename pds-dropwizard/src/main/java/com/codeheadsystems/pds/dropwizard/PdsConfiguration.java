package com.codeheadsystems.pds.dropwizard;

import com.codeheadsystems.pds.identity.handle.HandleRules;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dropwizard configuration for PDS account provisioning.
 * <p>
 * For production, supply {@code repoSigningKeyHex}, {@code plcRotationKeyHex} (hex-encoded
 * secp256k1 private scalars) and {@code jwtSecretHex} so that keys and sessions survive
 * restarts, a {@code databasePath} for the SQLite store and a {@code plcUrl} for the PLC
 * directory. Omitting any of these falls back to random or in-memory values (dev/test only).
 * <p>
 * Generate keys and secrets with: {@code openssl rand -hex 32}
 */
public class PdsConfiguration extends Configuration {

  /**
   * The url this node is reachable at. Written into every new DID document.
   */
  @NotEmpty
  private String publicUrl = "http://localhost:8080";

  /**
   * Scheme used to resolve handles on foreign domains. {@code http} only for local development.
   */
  @NotEmpty
  private String scheme = "https";

  /**
   * Handle suffixes this node hands out, each starting with a period.
   */
  @NotEmpty
  private List<String> availableUserDomains = new ArrayList<>(List.of(".test"));

  /**
   * Handle front parts that cannot be registered.
   */
  private Set<String> reservedHandles = new TreeSet<>(HandleRules.DEFAULT_RESERVED);

  /**
   * Whether registration needs an invite code.
   */
  private boolean inviteRequired = true;

  /**
   * A did:key added as a rotation key to every DID this node creates. Empty for none.
   */
  private String recoveryKey = "";

  /**
   * Base url of the PLC directory. Leave empty for an in-memory registry (dev only: DIDs are
   * never published).
   */
  private String plcUrl = "";

  /**
   * Timeout for PLC, DID document and handle lookups, in seconds.
   */
  @Min(1)
  private long identityTimeoutSeconds = 10;

  /**
   * Path of the SQLite database file. Leave empty for an in-memory database (dev only: all
   * accounts are lost on restart).
   */
  private String databasePath = "";

  /**
   * Hex-encoded secp256k1 private key that signs repository commits. Leave empty for random
   * generation (dev only).
   */
  private String repoSigningKeyHex = "";

  /**
   * Hex-encoded secp256k1 private key this node uses as its PLC rotation key. Leave empty for
   * random generation (dev only: DIDs created earlier can no longer be updated).
   */
  private String plcRotationKeyHex = "";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for session tokens.
   * Leave empty for random generation (dev only: tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "pds";

  /**
   * Access token time-to-live in seconds.
   */
  @Min(1)
  private long accessTokenTtlSeconds = 7200;

  /**
   * Refresh token time-to-live in seconds.
   */
  @Min(1)
  private long refreshTokenTtlSeconds = 7_776_000;

  /**
   * Scrypt CPU/memory cost. Must be a power of two.
   */
  @Min(2)
  private int scryptCost = 16384;

  @JsonProperty
  public String getPublicUrl() {
    return publicUrl;
  }

  @JsonProperty
  public void setPublicUrl(String publicUrl) {
    this.publicUrl = publicUrl;
  }

  @JsonProperty
  public String getScheme() {
    return scheme;
  }

  @JsonProperty
  public void setScheme(String scheme) {
    this.scheme = scheme;
  }

  @JsonProperty
  public List<String> getAvailableUserDomains() {
    return availableUserDomains;
  }

  @JsonProperty
  public void setAvailableUserDomains(List<String> availableUserDomains) {
    this.availableUserDomains = availableUserDomains;
  }

  @JsonProperty
  public Set<String> getReservedHandles() {
    return reservedHandles;
  }

  @JsonProperty
  public void setReservedHandles(Set<String> reservedHandles) {
    this.reservedHandles = reservedHandles;
  }

  @JsonProperty
  public boolean isInviteRequired() {
    return inviteRequired;
  }

  @JsonProperty
  public void setInviteRequired(boolean inviteRequired) {
    this.inviteRequired = inviteRequired;
  }

  @JsonProperty
  public String getRecoveryKey() {
    return recoveryKey;
  }

  @JsonProperty
  public void setRecoveryKey(String recoveryKey) {
    this.recoveryKey = recoveryKey;
  }

  @JsonProperty
  public String getPlcUrl() {
    return plcUrl;
  }

  @JsonProperty
  public void setPlcUrl(String plcUrl) {
    this.plcUrl = plcUrl;
  }

  @JsonProperty
  public long getIdentityTimeoutSeconds() {
    return identityTimeoutSeconds;
  }

  @JsonProperty
  public void setIdentityTimeoutSeconds(long identityTimeoutSeconds) {
    this.identityTimeoutSeconds = identityTimeoutSeconds;
  }

  @JsonProperty
  public String getDatabasePath() {
    return databasePath;
  }

  @JsonProperty
  public void setDatabasePath(String databasePath) {
    this.databasePath = databasePath;
  }

  @JsonProperty
  public String getRepoSigningKeyHex() {
    return repoSigningKeyHex;
  }

  @JsonProperty
  public void setRepoSigningKeyHex(String repoSigningKeyHex) {
    this.repoSigningKeyHex = repoSigningKeyHex;
  }

  @JsonProperty
  public String getPlcRotationKeyHex() {
    return plcRotationKeyHex;
  }

  @JsonProperty
  public void setPlcRotationKeyHex(String plcRotationKeyHex) {
    this.plcRotationKeyHex = plcRotationKeyHex;
  }

  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  @JsonProperty
  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  @JsonProperty
  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  @JsonProperty
  public int getScryptCost() {
    return scryptCost;
  }

  @JsonProperty
  public void setScryptCost(int scryptCost) {
    this.scryptCost = scryptCost;
  }
}
