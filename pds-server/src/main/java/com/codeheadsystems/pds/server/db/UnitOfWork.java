package com.codeheadsystems.pds.server.db;

/**
 * Work performed against a set of stores.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface UnitOfWork<T> {

  /**
   * Performs the work.
   *
   * @param stores the stores, scoped to the enclosing transaction if there is one
   * @return the result
   */
  T execute(Stores stores);
}
