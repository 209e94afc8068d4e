package com.codeheadsystems.pds.server.db;

import com.codeheadsystems.pds.server.exception.DatabaseException;

/**
 * Entry point to persistent state.
 * <p>
 * Exceptions thrown by the unit of work propagate unchanged after the transaction has been
 * rolled back. Storage failures that are not otherwise classified surface as
 * {@link DatabaseException}.
 */
public interface Database {

  /**
   * Runs work in a transaction. Either every write of the unit of work becomes visible or
   * none does.
   *
   * @param work the work
   * @param <T>  the result type
   * @return the result
   */
  <T> T transaction(UnitOfWork<T> work);

  /**
   * Runs work outside a transaction. Reads see committed state; no locks are taken.
   *
   * @param work the work
   * @param <T>  the result type
   * @return the result
   */
  <T> T read(UnitOfWork<T> work);
}
