package com.codeheadsystems.pds.server.db.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema for the JDBC stores. Timestamps are ISO-8601 strings; cids are their base32
 * string form.
 */
public final class JdbcSchema {

  private static final Logger log = LoggerFactory.getLogger(JdbcSchema.class);

  private JdbcSchema() {
  }

  /**
   * Creates tables and indexes that do not exist yet. Safe to call repeatedly.
   *
   * @param conn    the connection
   * @param dialect the dialect
   * @throws SQLException if schema creation fails
   */
  public static void initialize(final Connection conn, final SqlDialect dialect) throws SQLException {
    log.debug("Initializing {} schema", dialect);
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("""
          CREATE TABLE IF NOT EXISTS user_account (
              did VARCHAR PRIMARY KEY,
              email VARCHAR NOT NULL UNIQUE,
              password_scrypt VARCHAR NOT NULL,
              created_at VARCHAR NOT NULL,
              takedown_ref VARCHAR
          )
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS did_handle (
              did VARCHAR PRIMARY KEY,
              handle VARCHAR NOT NULL UNIQUE
          )
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS invite_code (
              code VARCHAR PRIMARY KEY,
              available_uses INTEGER NOT NULL,
              disabled INTEGER NOT NULL DEFAULT 0,
              for_user VARCHAR NOT NULL,
              created_by VARCHAR NOT NULL,
              created_at VARCHAR NOT NULL
          )
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS invite_code_use (
              code VARCHAR NOT NULL,
              used_by VARCHAR NOT NULL,
              used_at VARCHAR NOT NULL,
              PRIMARY KEY (code, used_by)
          )
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS refresh_token (
              id VARCHAR PRIMARY KEY,
              did VARCHAR NOT NULL,
              expires_at VARCHAR NOT NULL
          )
          """);

      stmt.execute("""
          CREATE INDEX IF NOT EXISTS refresh_token_did_idx
          ON refresh_token(did)
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS repo_root (
              did VARCHAR PRIMARY KEY,
              root VARCHAR NOT NULL,
              rev VARCHAR NOT NULL,
              indexed_at VARCHAR NOT NULL
          )
          """);

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS ipld_block (
              cid VARCHAR PRIMARY KEY,
              creator VARCHAR NOT NULL,
              size INTEGER NOT NULL,
              content %s NOT NULL
          )
          """.formatted(dialect.binaryType()));

      stmt.execute("""
          CREATE TABLE IF NOT EXISTS repo_seq (
              seq %s,
              did VARCHAR NOT NULL,
              event_type VARCHAR NOT NULL,
              event %s NOT NULL,
              invalidated_by BIGINT,
              sequenced_at VARCHAR NOT NULL
          )
          """.formatted(dialect.serialPrimaryKey(), dialect.binaryType()));

      stmt.execute("""
          CREATE INDEX IF NOT EXISTS repo_seq_did_idx
          ON repo_seq(did)
          """);
    }
    log.debug("Schema initialized");
  }
}
