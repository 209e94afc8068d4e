package com.codeheadsystems.pds.server.db.jdbc;

import com.codeheadsystems.pds.server.db.Stores;
import com.codeheadsystems.pds.server.store.AccountStore;
import com.codeheadsystems.pds.server.store.InviteStore;
import com.codeheadsystems.pds.server.store.RefreshTokenStore;
import com.codeheadsystems.pds.server.store.RepoStore;
import com.codeheadsystems.pds.server.store.SequenceStore;
import java.sql.Connection;

class JdbcStores implements Stores {

  private final boolean inTransaction;
  private final SqlDialect dialect;
  private final JdbcAccountStore accounts;
  private final JdbcInviteStore invites;
  private final JdbcRepoStore repos;
  private final JdbcRefreshTokenStore refreshTokens;
  private final JdbcSequenceStore sequencer;

  JdbcStores(final Connection conn, final SqlDialect dialect, final boolean inTransaction) {
    this.inTransaction = inTransaction;
    this.dialect = dialect;
    this.accounts = new JdbcAccountStore(conn);
    this.invites = new JdbcInviteStore(conn, inTransaction ? dialect.lockClause() : "");
    this.repos = new JdbcRepoStore(conn);
    this.refreshTokens = new JdbcRefreshTokenStore(conn);
    this.sequencer = new JdbcSequenceStore(conn);
  }

  @Override
  public AccountStore accounts() {
    return accounts;
  }

  @Override
  public InviteStore invites() {
    return invites;
  }

  @Override
  public RepoStore repos() {
    return repos;
  }

  @Override
  public RefreshTokenStore refreshTokens() {
    return refreshTokens;
  }

  @Override
  public SequenceStore sequencer() {
    return sequencer;
  }

  @Override
  public boolean supportsRowLocking() {
    return inTransaction && dialect.supportsRowLocking();
  }
}
