package com.codeheadsystems.pds.server.store;

import java.time.Instant;

/**
 * A row of the repository event log.
 *
 * @param seq           position in the log, null before it is sequenced
 * @param did           the repository
 * @param eventType     {@code append} for commits
 * @param event         DAG-CBOR encoded event body
 * @param sequencedAt   when the event was recorded
 * @param invalidatedBy seq of a later event superseding this one, or null
 */
public record SeqEvent(Long seq,
                       String did,
                       String eventType,
                       byte[] event,
                       Instant sequencedAt,
                       Long invalidatedBy) {

  /**
   * Returns a copy carrying the assigned sequence number.
   *
   * @param seq the seq
   * @return the sequenced event
   */
  public SeqEvent withSeq(long seq) {
    return new SeqEvent(seq, did, eventType, event, sequencedAt, invalidatedBy);
  }
}
