package com.codeheadsystems.pds.server.repo;

import com.codeheadsystems.pds.identity.cbor.Cid;
import com.codeheadsystems.pds.identity.cbor.DagCbor;
import com.codeheadsystems.pds.identity.crypto.Keypair;
import com.codeheadsystems.pds.server.db.Stores;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates account repositories.
 */
public class RepoManager {

  /**
   * Repository format version written into commits.
   */
  public static final int REPO_VERSION = 2;

  private static final Logger log = LoggerFactory.getLogger(RepoManager.class);

  private final Keypair repoSigningKey;

  /**
   * Instantiates a new Repo manager.
   *
   * @param repoSigningKey signs commits
   */
  public RepoManager(Keypair repoSigningKey) {
    this.repoSigningKey = repoSigningKey;
  }

  /**
   * Writes the first commit of a repository: an empty tree and a signed commit pointing at
   * it. Stores both blocks, records the root and sequences the commit event, all through the
   * given stores so they share the caller's transaction.
   *
   * @param stores the transaction's stores
   * @param did    the repository owner
   * @param writes initial record writes; must be empty
   * @param now    commit time
   * @return the commit
   * @throws IllegalArgumentException if {@code writes} is not empty
   */
  public CommitData createRepo(Stores stores, String did, List<CommitOp> writes, Instant now) {
    log.debug("createRepo({})", did);
    if (!writes.isEmpty()) {
      throw new IllegalArgumentException("Repositories are created empty");
    }
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("e", List.of());
    node.put("l", null);
    DagCbor.Block tree = DagCbor.block(node);

    String rev = Tid.next(now).toString();
    Map<String, Object> commit = new LinkedHashMap<>();
    commit.put("did", did);
    commit.put("version", REPO_VERSION);
    commit.put("data", tree.cid());
    commit.put("rev", rev);
    commit.put("prev", null);
    commit.put("sig", repoSigningKey.sign(DagCbor.encode(commit)));
    DagCbor.Block commitBlock = DagCbor.block(commit);

    Map<Cid, byte[]> blocks = new LinkedHashMap<>();
    blocks.put(tree.cid(), tree.bytes());
    blocks.put(commitBlock.cid(), commitBlock.bytes());
    CommitData commitData = new CommitData(commitBlock.cid(), rev, null, blocks);

    stores.repos().putBlocks(did, blocks);
    stores.repos().createRoot(did, commitBlock.cid(), rev, now);
    long seq = stores.sequencer().sequence(Sequencer.formatSeqCommit(did, commitData, writes, now));
    log.debug("Created repo {} at {} rev={} seq={}", did, commitBlock.cid(), rev, seq);
    return commitData;
  }
}
