package com.codeheadsystems.pds.server.store;

import java.time.Instant;

/**
 * The current head of an account's repository.
 *
 * @param did       the DID
 * @param root      cid of the latest commit
 * @param rev       revision of the latest commit
 * @param indexedAt when the root was written
 */
public record RepoRoot(String did, String root, String rev, Instant indexedAt) {
}
