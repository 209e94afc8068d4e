package com.codeheadsystems.pds.server.registration;

import static com.codeheadsystems.pds.server.exception.RegistrationError.HANDLE_MISMATCH;
import static com.codeheadsystems.pds.server.exception.RegistrationError.HANDLE_UNAVAILABLE;
import static com.codeheadsystems.pds.server.exception.RegistrationError.INVALID_HANDLE;
import static com.codeheadsystems.pds.server.exception.RegistrationError.UNSUPPORTED_DOMAIN;

import com.codeheadsystems.pds.identity.handle.ExternalHandleResolver;
import com.codeheadsystems.pds.identity.handle.HandleRules;
import com.codeheadsystems.pds.identity.handle.InvalidHandleException;
import com.codeheadsystems.pds.identity.handle.ReservedHandleException;
import com.codeheadsystems.pds.identity.handle.UnsupportedDomainException;
import com.codeheadsystems.pds.server.ServiceConfig;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes a requested handle and checks that this node may hand it out.
 * <p>
 * Handles on a domain the node serves must satisfy the node's length and reservation rules.
 * Handles on any other domain are only accepted from callers bringing their own DID, and
 * only when the domain itself points at that DID.
 */
public class HandleValidator {

  private static final Logger log = LoggerFactory.getLogger(HandleValidator.class);

  private final ServiceConfig config;
  private final ExternalHandleResolver externalHandleResolver;

  /**
   * Instantiates a new Handle validator.
   *
   * @param config                 node policy
   * @param externalHandleResolver resolver for handles on foreign domains
   */
  public HandleValidator(final ServiceConfig config, final ExternalHandleResolver externalHandleResolver) {
    this.config = config;
    this.externalHandleResolver = externalHandleResolver;
  }

  /**
   * Validates a handle.
   *
   * @param rawHandle the handle as requested
   * @param callerDid the DID the caller is bringing, or null
   * @return the normalized handle
   * @throws RegistrationException with {@code INVALID_HANDLE}, {@code HANDLE_UNAVAILABLE},
   *                               {@code UNSUPPORTED_DOMAIN} or {@code HANDLE_MISMATCH}
   */
  public String validate(final String rawHandle, final String callerDid) {
    log.debug("validate({})", rawHandle);
    final String handle;
    try {
      handle = HandleRules.normalizeAndEnsureValid(rawHandle);
    } catch (InvalidHandleException e) {
      throw new RegistrationException(INVALID_HANDLE, e.getMessage(), e);
    }
    try {
      HandleRules.ensureServiceConstraints(handle, config.availableUserDomains(), config.reservedHandles());
      return handle;
    } catch (InvalidHandleException e) {
      throw new RegistrationException(INVALID_HANDLE, e.getMessage(), e);
    } catch (ReservedHandleException e) {
      throw new RegistrationException(HANDLE_UNAVAILABLE, e.getMessage(), e);
    } catch (UnsupportedDomainException e) {
      if (callerDid == null) {
        throw new RegistrationException(UNSUPPORTED_DOMAIN, e.getMessage(), e);
      }
      return validateExternal(handle, callerDid);
    }
  }

  private String validateExternal(final String handle, final String callerDid) {
    final boolean matches = externalHandleResolver.resolve(config.scheme(), handle)
        .map(callerDid::equals)
        .orElse(false);
    if (!matches) {
      log.info("External handle {} did not resolve to {}", handle, callerDid);
      throw new RegistrationException(HANDLE_MISMATCH, "External handle did not resolve to DID");
    }
    return handle;
  }
}
