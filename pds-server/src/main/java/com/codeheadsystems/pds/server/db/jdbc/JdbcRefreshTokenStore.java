package com.codeheadsystems.pds.server.db.jdbc;

import com.codeheadsystems.pds.server.exception.DatabaseException;
import com.codeheadsystems.pds.server.store.RefreshTokenPayload;
import com.codeheadsystems.pds.server.store.RefreshTokenStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

class JdbcRefreshTokenStore implements RefreshTokenStore {

  private final Connection conn;

  JdbcRefreshTokenStore(final Connection conn) {
    this.conn = conn;
  }

  @Override
  public void grant(final RefreshTokenPayload payload) {
    try (PreparedStatement stmt = conn.prepareStatement(
        "INSERT INTO refresh_token (id, did, expires_at) VALUES (?, ?, ?)")) {
      stmt.setString(1, payload.id());
      stmt.setString(2, payload.did());
      stmt.setString(3, payload.expiresAt().toString());
      stmt.executeUpdate();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to grant refresh token for " + payload.did(), e);
    }
  }

  @Override
  public Optional<RefreshTokenPayload> find(final String id) {
    try (PreparedStatement stmt = conn.prepareStatement(
        "SELECT id, did, expires_at FROM refresh_token WHERE id = ?")) {
      stmt.setString(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new RefreshTokenPayload(rs.getString(1), rs.getString(2),
            Instant.parse(rs.getString(3))));
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to read refresh token", e);
    }
  }
}
