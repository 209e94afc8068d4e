package com.codeheadsystems.pds.server.store;

import java.util.List;
import java.util.Optional;

/**
 * Storage for invite codes and their uses.
 */
public interface InviteStore {

  /**
   * Creates a code.
   *
   * @param code the code
   */
  void createCode(InviteCode code);

  /**
   * Marks a code as disabled.
   *
   * @param code the code
   * @return true if the code exists
   */
  boolean disable(String code);

  /**
   * Reads a code.
   * <p>
   * With {@code forUpdate} set, and where the store supports row locks, the code row is
   * locked until the enclosing transaction ends. A row already locked by another
   * transaction is skipped and reported as absent.
   *
   * @param code      the code
   * @param forUpdate whether to lock the row
   * @return the code, empty if unknown or locked elsewhere
   */
  Optional<InviteCode> findCode(String code, boolean forUpdate);

  /**
   * Counts the recorded uses of a code.
   *
   * @param code the code
   * @return the use count
   */
  int countUses(String code);

  /**
   * Appends a use.
   *
   * @param use the use
   */
  void recordUse(InviteCodeUse use);

  /**
   * Lists the uses of a code.
   *
   * @param code the code
   * @return the uses, oldest first
   */
  List<InviteCodeUse> listUses(String code);
}
