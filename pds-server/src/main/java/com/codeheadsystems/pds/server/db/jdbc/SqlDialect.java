package com.codeheadsystems.pds.server.db.jdbc;

/**
 * The SQL dialects the JDBC stores speak.
 */
public enum SqlDialect {

  SQLITE("INTEGER PRIMARY KEY AUTOINCREMENT", "BLOB", ""),
  POSTGRES("BIGSERIAL PRIMARY KEY", "BYTEA", " FOR UPDATE SKIP LOCKED");

  private final String serialPrimaryKey;
  private final String binaryType;
  private final String lockClause;

  SqlDialect(final String serialPrimaryKey, final String binaryType, final String lockClause) {
    this.serialPrimaryKey = serialPrimaryKey;
    this.binaryType = binaryType;
    this.lockClause = lockClause;
  }

  /**
   * Column definition of an auto-incrementing 64-bit primary key.
   *
   * @return the definition
   */
  public String serialPrimaryKey() {
    return serialPrimaryKey;
  }

  /**
   * Column type for raw bytes.
   *
   * @return the type
   */
  public String binaryType() {
    return binaryType;
  }

  /**
   * Suffix that locks selected rows, skipping rows locked by other transactions. Empty
   * where the dialect has no row locks.
   *
   * @return the clause
   */
  public String lockClause() {
    return lockClause;
  }

  public boolean supportsRowLocking() {
    return !lockClause.isEmpty();
  }
}
