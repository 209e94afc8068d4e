package com.codeheadsystems.pds.server.store;

import com.codeheadsystems.pds.identity.cbor.Cid;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed block storage and repository heads.
 */
public interface RepoStore {

  /**
   * Stores blocks. Blocks already present are left untouched.
   *
   * @param did    the repository owner
   * @param blocks blocks by cid
   */
  void putBlocks(String did, Map<Cid, byte[]> blocks);

  /**
   * Reads a block.
   *
   * @param cid the cid
   * @return the block bytes
   */
  Optional<byte[]> getBlock(Cid cid);

  /**
   * Creates the root record of a new repository.
   *
   * @param did  the DID
   * @param root the commit cid
   * @param rev  the commit revision
   * @param now  write time
   */
  void createRoot(String did, Cid root, String rev, Instant now);

  /**
   * Reads the root record.
   *
   * @param did the DID
   * @return the root
   */
  Optional<RepoRoot> getRoot(String did);
}
