package com.codeheadsystems.pds.server.store;

import java.time.Instant;

/**
 * One registration admitted by an invite code.
 *
 * @param code   the code
 * @param usedBy the DID that registered
 * @param usedAt registration time
 */
public record InviteCodeUse(String code, String usedBy, Instant usedAt) {
}
