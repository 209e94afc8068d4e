package com.codeheadsystems.pds.server.registration;

import static com.codeheadsystems.pds.server.exception.RegistrationError.INVALID_INVITE_CODE;

import com.codeheadsystems.pds.server.db.Stores;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import com.codeheadsystems.pds.server.store.InviteCode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an invite code still admits a registration.
 * <p>
 * Registration checks twice: once without a lock before any expensive work, and once with
 * {@code lockForUpdate} inside the registration transaction. Only the second check is
 * authoritative. Under the skip-locked discipline a code row held by a concurrent
 * registration reads as unavailable rather than blocking.
 */
public class InviteAdmissionController {

  private static final Logger log = LoggerFactory.getLogger(InviteAdmissionController.class);

  /**
   * Checks a code.
   *
   * @param stores        the stores of the enclosing unit of work
   * @param code          the invite code
   * @param lockForUpdate whether to lock the code row until the transaction ends
   * @throws RegistrationException with {@code INVALID_INVITE_CODE} if the code is unknown,
   *                               disabled, used up or locked by a concurrent registration
   */
  public void checkAvailable(final Stores stores, final String code, final boolean lockForUpdate) {
    final boolean lock = lockForUpdate && stores.supportsRowLocking();
    final Optional<InviteCode> invite = stores.invites().findCode(code, lock);
    final int useCount = stores.invites().countUses(code);
    if (invite.isEmpty() || invite.get().disabled() || invite.get().availableUses() <= useCount) {
      log.info("invalid invite code {} (locked={}, uses={})", code, lock, useCount);
      throw new RegistrationException(INVALID_INVITE_CODE, "Provided invite code not available");
    }
    log.debug("Invite code {} available: {} of {} used", code, useCount, invite.get().availableUses());
  }
}
