package com.codeheadsystems.pds.server.db.jdbc;

import com.codeheadsystems.pds.server.exception.DatabaseException;
import com.codeheadsystems.pds.server.store.InviteCode;
import com.codeheadsystems.pds.server.store.InviteCodeUse;
import com.codeheadsystems.pds.server.store.InviteStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

class JdbcInviteStore implements InviteStore {

  private final Connection conn;
  private final String lockClause;

  JdbcInviteStore(final Connection conn, final String lockClause) {
    this.conn = conn;
    this.lockClause = lockClause;
  }

  @Override
  public void createCode(final InviteCode code) {
    try (PreparedStatement stmt = conn.prepareStatement("""
        INSERT INTO invite_code (code, available_uses, disabled, for_user, created_by, created_at)
        VALUES (?, ?, ?, ?, ?, ?)
        """)) {
      stmt.setString(1, code.code());
      stmt.setInt(2, code.availableUses());
      stmt.setInt(3, code.disabled() ? 1 : 0);
      stmt.setString(4, code.forUser());
      stmt.setString(5, code.createdBy());
      stmt.setString(6, code.createdAt().toString());
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to create invite code " + code.code(), e);
    }
  }

  @Override
  public boolean disable(final String code) {
    try (PreparedStatement stmt = conn.prepareStatement("UPDATE invite_code SET disabled = 1 WHERE code = ?")) {
      stmt.setString(1, code);
      return stmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new DatabaseException("Failed to disable invite code " + code, e);
    }
  }

  @Override
  public Optional<InviteCode> findCode(final String code, final boolean forUpdate) {
    final String sql = """
        SELECT code, available_uses, disabled, for_user, created_by, created_at
        FROM invite_code
        WHERE code = ?
        """ + (forUpdate ? lockClause : "");
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, code);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new InviteCode(
            rs.getString(1),
            rs.getInt(2),
            rs.getInt(3) != 0,
            rs.getString(4),
            rs.getString(5),
            Instant.parse(rs.getString(6))));
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to read invite code " + code, e);
    }
  }

  @Override
  public int countUses(final String code) {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM invite_code_use WHERE code = ?")) {
      stmt.setString(1, code);
      try (ResultSet rs = stmt.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to count uses of invite code " + code, e);
    }
  }

  @Override
  public void recordUse(final InviteCodeUse use) {
    try (PreparedStatement stmt = conn.prepareStatement(
        "INSERT INTO invite_code_use (code, used_by, used_at) VALUES (?, ?, ?)")) {
      stmt.setString(1, use.code());
      stmt.setString(2, use.usedBy());
      stmt.setString(3, use.usedAt().toString());
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to record use of invite code " + use.code(), e);
    }
  }

  @Override
  public List<InviteCodeUse> listUses(final String code) {
    try (PreparedStatement stmt = conn.prepareStatement("""
        SELECT code, used_by, used_at
        FROM invite_code_use
        WHERE code = ?
        ORDER BY used_at, used_by
        """)) {
      stmt.setString(1, code);
      final List<InviteCodeUse> uses = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          uses.add(new InviteCodeUse(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))));
        }
      }
      return uses;
    } catch (SQLException e) {
      throw new DatabaseException("Failed to list uses of invite code " + code, e);
    }
  }
}
