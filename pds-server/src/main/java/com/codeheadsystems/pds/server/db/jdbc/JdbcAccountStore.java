package com.codeheadsystems.pds.server.db.jdbc;

import com.codeheadsystems.pds.server.exception.DatabaseException;
import com.codeheadsystems.pds.server.exception.UserAlreadyExistsException;
import com.codeheadsystems.pds.server.store.Account;
import com.codeheadsystems.pds.server.store.AccountStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

class JdbcAccountStore implements AccountStore {

  private static final String SELECT_ACCOUNT = """
      SELECT a.did, h.handle, a.email, a.password_scrypt, a.created_at, a.takedown_ref
      FROM user_account a
      JOIN did_handle h ON h.did = a.did
      """;

  private final Connection conn;

  JdbcAccountStore(final Connection conn) {
    this.conn = conn;
  }

  @Override
  public void registerUser(final String email, final String handle, final String did,
                           final String passwordHash, final Instant now) {
    try {
      try (PreparedStatement stmt = conn.prepareStatement("""
          INSERT INTO user_account (did, email, password_scrypt, created_at)
          VALUES (?, ?, ?, ?)
          ON CONFLICT DO NOTHING
          """)) {
        stmt.setString(1, did);
        stmt.setString(2, email);
        stmt.setString(3, passwordHash);
        stmt.setString(4, now.toString());
        if (stmt.executeUpdate() == 0) {
          throw new UserAlreadyExistsException();
        }
      }
      try (PreparedStatement stmt = conn.prepareStatement("""
          INSERT INTO did_handle (did, handle)
          VALUES (?, ?)
          ON CONFLICT DO NOTHING
          """)) {
        stmt.setString(1, did);
        stmt.setString(2, handle);
        if (stmt.executeUpdate() == 0) {
          throw new UserAlreadyExistsException();
        }
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to register user " + did, e);
    }
  }

  @Override
  public Optional<Account> getAccount(final String handleOrDid, final boolean includeSoftDeleted) {
    final String column = handleOrDid.startsWith("did:") ? "a.did" : "h.handle";
    return selectOne(column, handleOrDid, includeSoftDeleted);
  }

  @Override
  public Optional<Account> getAccountByEmail(final String email, final boolean includeSoftDeleted) {
    return selectOne("a.email", email, includeSoftDeleted);
  }

  @Override
  public boolean updateTakedown(final String did, final String takedownRef) {
    try (PreparedStatement stmt = conn.prepareStatement(
        "UPDATE user_account SET takedown_ref = ? WHERE did = ?")) {
      stmt.setString(1, takedownRef);
      stmt.setString(2, did);
      return stmt.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new DatabaseException("Failed to update takedown for " + did, e);
    }
  }

  private Optional<Account> selectOne(final String column, final String value, final boolean includeSoftDeleted) {
    final String sql = SELECT_ACCOUNT + "WHERE " + column + " = ?"
        + (includeSoftDeleted ? "" : " AND a.takedown_ref IS NULL");
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, value);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new Account(
            rs.getString(1),
            rs.getString(2),
            rs.getString(3),
            rs.getString(4),
            Instant.parse(rs.getString(5)),
            rs.getString(6)));
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to read account " + value, e);
    }
  }
}
