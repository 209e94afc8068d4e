package com.codeheadsystems.pds.server.store;

import java.time.Instant;

/**
 * An invite code.
 *
 * @param code          the code
 * @param availableUses how many registrations it admits in total
 * @param disabled      whether it has been withdrawn
 * @param forUser       the DID the code was issued to, or {@code admin}
 * @param createdBy     who created it
 * @param createdAt     creation time
 */
public record InviteCode(String code,
                         int availableUses,
                         boolean disabled,
                         String forUser,
                         String createdBy,
                         Instant createdAt) {
}
