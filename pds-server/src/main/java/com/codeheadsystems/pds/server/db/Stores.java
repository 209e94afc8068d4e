package com.codeheadsystems.pds.server.db;

import com.codeheadsystems.pds.server.store.AccountStore;
import com.codeheadsystems.pds.server.store.InviteStore;
import com.codeheadsystems.pds.server.store.RefreshTokenStore;
import com.codeheadsystems.pds.server.store.RepoStore;
import com.codeheadsystems.pds.server.store.SequenceStore;

/**
 * The stores visible to one unit of work. Instances must not escape the unit of work they
 * were handed to.
 */
public interface Stores {

  AccountStore accounts();

  InviteStore invites();

  RepoStore repos();

  RefreshTokenStore refreshTokens();

  SequenceStore sequencer();

  /**
   * Whether {@link InviteStore#findCode(String, boolean)} can lock rows.
   *
   * @return true if row locks are available
   */
  boolean supportsRowLocking();
}
