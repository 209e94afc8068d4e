package com.codeheadsystems.pds.server.db.jdbc;

import com.codeheadsystems.pds.identity.cbor.Cid;
import com.codeheadsystems.pds.server.exception.DatabaseException;
import com.codeheadsystems.pds.server.store.RepoRoot;
import com.codeheadsystems.pds.server.store.RepoStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

class JdbcRepoStore implements RepoStore {

  private final Connection conn;

  JdbcRepoStore(final Connection conn) {
    this.conn = conn;
  }

  @Override
  public void putBlocks(final String did, final Map<Cid, byte[]> blocks) {
    if (blocks.isEmpty()) {
      return;
    }
    try (PreparedStatement stmt = conn.prepareStatement("""
        INSERT INTO ipld_block (cid, creator, size, content)
        VALUES (?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """)) {
      for (Map.Entry<Cid, byte[]> block : blocks.entrySet()) {
        stmt.setString(1, block.getKey().toString());
        stmt.setString(2, did);
        stmt.setInt(3, block.getValue().length);
        stmt.setBytes(4, block.getValue());
        stmt.addBatch();
      }
      stmt.executeBatch();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to store blocks for " + did, e);
    }
  }

  @Override
  public Optional<byte[]> getBlock(final Cid cid) {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT content FROM ipld_block WHERE cid = ?")) {
      stmt.setString(1, cid.toString());
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? Optional.of(rs.getBytes(1)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to read block " + cid, e);
    }
  }

  @Override
  public void createRoot(final String did, final Cid root, final String rev, final Instant now) {
    try (PreparedStatement stmt = conn.prepareStatement(
        "INSERT INTO repo_root (did, root, rev, indexed_at) VALUES (?, ?, ?, ?)")) {
      stmt.setString(1, did);
      stmt.setString(2, root.toString());
      stmt.setString(3, rev);
      stmt.setString(4, now.toString());
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to create repo root for " + did, e);
    }
  }

  @Override
  public Optional<RepoRoot> getRoot(final String did) {
    try (PreparedStatement stmt = conn.prepareStatement(
        "SELECT did, root, rev, indexed_at FROM repo_root WHERE did = ?")) {
      stmt.setString(1, did);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new RepoRoot(rs.getString(1), rs.getString(2), rs.getString(3),
            Instant.parse(rs.getString(4))));
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to read repo root for " + did, e);
    }
  }
}
