package com.codeheadsystems.pds.server;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Node-level policy for account provisioning.
 *
 * @param publicUrl            the url this node is reachable at; written into new DID documents
 * @param scheme               {@code https}, or {@code http} for local development
 * @param availableUserDomains handle suffixes this node hands out, each starting with a period
 * @param reservedHandles      handle front parts that cannot be registered
 * @param inviteRequired       whether registration needs an invite code
 * @param recoveryKey          did:key added as a rotation key to every new DID, or null
 */
public record ServiceConfig(String publicUrl,
                            String scheme,
                            List<String> availableUserDomains,
                            Set<String> reservedHandles,
                            boolean inviteRequired,
                            String recoveryKey) {

  /**
   * Instantiates a new Service config.
   */
  public ServiceConfig {
    Objects.requireNonNull(publicUrl, "publicUrl");
    Objects.requireNonNull(scheme, "scheme");
    availableUserDomains = List.copyOf(availableUserDomains);
    reservedHandles = Set.copyOf(reservedHandles);
    for (String domain : availableUserDomains) {
      if (!domain.startsWith(".")) {
        throw new IllegalArgumentException("User domains must start with a period: " + domain);
      }
    }
  }
}
