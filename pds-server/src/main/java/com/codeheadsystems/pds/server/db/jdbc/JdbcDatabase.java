package com.codeheadsystems.pds.server.db.jdbc;

import com.codeheadsystems.pds.server.db.Database;
import com.codeheadsystems.pds.server.db.UnitOfWork;
import com.codeheadsystems.pds.server.exception.DatabaseException;
import java.sql.Connection;
import java.sql.SQLException;
import javax.inject.Inject;
import javax.inject.Singleton;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * {@link Database} over a JDBC {@link DataSource}.
 * <p>
 * Each transaction takes its own connection with auto-commit disabled. SQLite data sources
 * built by {@link #sqliteDataSource(String)} begin transactions with {@code IMMEDIATE}, so
 * writers are serialized and no row locks are needed; PostgreSQL locks invite rows with
 * {@code FOR UPDATE SKIP LOCKED}.
 */
@Singleton
public class JdbcDatabase implements Database {

  private static final Logger log = LoggerFactory.getLogger(JdbcDatabase.class);

  private static final int SQLITE_BUSY_TIMEOUT_MS = 10_000;

  private final DataSource dataSource;
  private final SqlDialect dialect;

  /**
   * Instantiates a new Jdbc database.
   *
   * @param dataSource the data source
   * @param dialect    the dialect it speaks
   */
  @Inject
  public JdbcDatabase(final DataSource dataSource, final SqlDialect dialect) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    log.info("JdbcDatabase({})", dialect);
  }

  /**
   * Builds a SQLite data source for a database file.
   *
   * @param path the database file path
   * @return the data source
   */
  public static DataSource sqliteDataSource(final String path) {
    final SQLiteConfig config = new SQLiteConfig();
    config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
    config.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MS);
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    final SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + path);
    return dataSource;
  }

  /**
   * Creates the schema if needed.
   */
  public void initialize() {
    try (Connection conn = dataSource.getConnection()) {
      JdbcSchema.initialize(conn, dialect);
    } catch (SQLException e) {
      throw new DatabaseException("Failed to initialize schema", e);
    }
  }

  @Override
  public <T> T transaction(final UnitOfWork<T> work) {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        final T result = work.execute(new JdbcStores(conn, dialect, true));
        conn.commit();
        return result;
      } catch (RuntimeException | Error e) {
        rollback(conn, e);
        throw e;
      } catch (SQLException e) {
        rollback(conn, e);
        throw new DatabaseException("Failed to commit transaction", e);
      }
    } catch (SQLException e) {
      throw new DatabaseException("Failed to open transaction", e);
    }
  }

  @Override
  public <T> T read(final UnitOfWork<T> work) {
    try (Connection conn = dataSource.getConnection()) {
      return work.execute(new JdbcStores(conn, dialect, false));
    } catch (SQLException e) {
      throw new DatabaseException("Failed to open connection", e);
    }
  }

  private void rollback(final Connection conn, final Throwable cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      log.warn("Rollback failed: {}", e.getMessage());
      cause.addSuppressed(e);
    }
  }
}
