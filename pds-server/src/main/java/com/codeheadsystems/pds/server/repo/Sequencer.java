package com.codeheadsystems.pds.server.repo;

import com.codeheadsystems.pds.identity.cbor.CarFiles;
import com.codeheadsystems.pds.identity.cbor.Cid;
import com.codeheadsystems.pds.identity.cbor.DagCbor;
import com.codeheadsystems.pds.server.store.SeqEvent;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formats repository events for the sequence log.
 */
public class Sequencer {

  /**
   * Event type of commit events.
   */
  public static final String APPEND = "append";

  /**
   * Commits with more ops than this are sequenced without their ops and blocks.
   */
  public static final int MAX_OPS = 200;

  /**
   * Commits whose new blocks exceed this size are sequenced without their ops and blocks.
   */
  public static final long MAX_BLOCK_BYTES = 1_000_000;

  private Sequencer() {
  }

  /**
   * Builds the {@code append} event for a commit. Oversized commits are flagged
   * {@code tooBig}; their CAR slice then holds only the commit block and no ops are listed.
   *
   * @param did        the repository
   * @param commitData the commit
   * @param ops        the record operations of the commit
   * @param now        sequencing time
   * @return the event, not yet sequenced
   */
  public static SeqEvent formatSeqCommit(final String did,
                                         final CommitData commitData,
                                         final List<CommitOp> ops,
                                         final Instant now) {
    final boolean tooBig = ops.size() > MAX_OPS || commitData.blockBytes() > MAX_BLOCK_BYTES;
    final byte[] carSlice;
    final List<Map<String, Object>> evtOps;
    if (tooBig) {
      final Cid commit = commitData.commit();
      carSlice = CarFiles.write(commit, Map.of(commit, commitData.blocks().get(commit)));
      evtOps = List.of();
    } else {
      carSlice = CarFiles.write(commitData.commit(), commitData.blocks());
      evtOps = ops.stream().map(CommitOp::toMap).toList();
    }

    final Map<String, Object> evt = new LinkedHashMap<>();
    evt.put("rebase", false);
    evt.put("tooBig", tooBig);
    evt.put("repo", did);
    evt.put("commit", commitData.commit());
    evt.put("prev", commitData.prev());
    evt.put("ops", evtOps);
    evt.put("blocks", carSlice);
    evt.put("blobs", List.of());
    return new SeqEvent(null, did, APPEND, DagCbor.encode(evt), now, null);
  }
}
