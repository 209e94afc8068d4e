package com.codeheadsystems.pds.server.repo;

import com.codeheadsystems.pds.identity.cbor.Cid;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A commit and the blocks it introduced.
 *
 * @param commit cid of the signed commit block
 * @param rev    the commit revision (a TID)
 * @param prev   the previous commit, null for the first one
 * @param blocks new blocks, including the commit block
 */
public record CommitData(Cid commit, String rev, Cid prev, Map<Cid, byte[]> blocks) {

  /**
   * Instantiates a new Commit data.
   */
  public CommitData {
    blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
  }

  /**
   * Total size of the new blocks.
   *
   * @return bytes
   */
  public long blockBytes() {
    return blocks.values().stream().mapToLong(b -> b.length).sum();
  }
}
