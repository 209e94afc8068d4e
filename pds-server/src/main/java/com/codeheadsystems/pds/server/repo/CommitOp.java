package com.codeheadsystems.pds.server.repo;

import com.codeheadsystems.pds.identity.cbor.Cid;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record operation in a commit.
 *
 * @param action {@code create}, {@code update} or {@code delete}
 * @param path   {@code collection/rkey}
 * @param cid    the record cid, null for deletes
 */
public record CommitOp(String action, String path, Cid cid) {

  Map<String, Object> toMap() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("action", action);
    map.put("path", path);
    map.put("cid", cid);
    return map;
  }
}
