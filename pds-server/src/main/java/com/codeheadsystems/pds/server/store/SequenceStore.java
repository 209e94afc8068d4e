package com.codeheadsystems.pds.server.store;

import java.util.List;

/**
 * The append-only repository event log that subscribers read from.
 */
public interface SequenceStore {

  /**
   * Appends an event.
   *
   * @param event the event; its {@code seq} is ignored
   * @return the assigned sequence number
   */
  long sequence(SeqEvent event);

  /**
   * Lists events after a position.
   *
   * @param afterSeq exclusive lower bound
   * @param limit    maximum number of events
   * @return events in sequence order
   */
  List<SeqEvent> listAfter(long afterSeq, int limit);
}
