package com.codeheadsystems.pds.server.db.jdbc;

import com.codeheadsystems.pds.server.exception.DatabaseException;
import com.codeheadsystems.pds.server.store.SeqEvent;
import com.codeheadsystems.pds.server.store.SequenceStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

class JdbcSequenceStore implements SequenceStore {

  private final Connection conn;

  JdbcSequenceStore(final Connection conn) {
    this.conn = conn;
  }

  @Override
  public long sequence(final SeqEvent event) {
    try (PreparedStatement stmt = conn.prepareStatement("""
        INSERT INTO repo_seq (did, event_type, event, sequenced_at, invalidated_by)
        VALUES (?, ?, ?, ?, ?)
        RETURNING seq
        """)) {
      stmt.setString(1, event.did());
      stmt.setString(2, event.eventType());
      stmt.setBytes(3, event.event());
      stmt.setString(4, event.sequencedAt().toString());
      if (event.invalidatedBy() == null) {
        stmt.setNull(5, Types.BIGINT);
      } else {
        stmt.setLong(5, event.invalidatedBy());
      }
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          throw new DatabaseException("Failed to sequence event for " + event.did(), null);
        }
        return rs.getLong(1);
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to sequence event for " + event.did(), e);
    }
  }

  @Override
  public List<SeqEvent> listAfter(final long afterSeq, final int limit) {
    try (PreparedStatement stmt = conn.prepareStatement("""
        SELECT seq, did, event_type, event, sequenced_at, invalidated_by
        FROM repo_seq
        WHERE seq > ?
        ORDER BY seq
        LIMIT ?
        """)) {
      stmt.setLong(1, afterSeq);
      stmt.setInt(2, limit);
      final List<SeqEvent> events = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          final long invalidated = rs.getLong(6);
          final Long invalidatedBy = rs.wasNull() ? null : invalidated;
          events.add(new SeqEvent(
              rs.getLong(1),
              rs.getString(2),
              rs.getString(3),
              rs.getBytes(4),
              Instant.parse(rs.getString(5)),
              invalidatedBy));
        }
      }
      return events;
    } catch (SQLException e) {
      throw new DatabaseException("Failed to list events after " + afterSeq, e);
    }
  }
}
