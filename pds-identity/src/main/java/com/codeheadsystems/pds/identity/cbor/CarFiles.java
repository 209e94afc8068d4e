package com.codeheadsystems.pds.identity.cbor;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Map;

/**
 * Writes CAR v1 archives: a DAG-CBOR header naming the root followed by length-prefixed
 * {@code cid || block} sections.
 */
public class CarFiles {

  private CarFiles() {
  }

  /**
   * Writes a CAR file containing the given blocks in iteration order.
   *
   * @param root   the root cid, or null for an archive without roots
   * @param blocks the blocks to include
   * @return the archive bytes
   */
  public static byte[] write(Cid root, Map<Cid, byte[]> blocks) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] header = DagCbor.encode(Map.of(
        "version", 1,
        "roots", root == null ? List.of() : List.of(root)));
    writeVarint(out, header.length);
    out.writeBytes(header);
    for (Map.Entry<Cid, byte[]> entry : blocks.entrySet()) {
      byte[] cid = entry.getKey().bytes();
      byte[] block = entry.getValue();
      writeVarint(out, cid.length + block.length);
      out.writeBytes(cid);
      out.writeBytes(block);
    }
    return out.toByteArray();
  }

  /**
   * Writes an unsigned LEB128 varint.
   *
   * @param out   the destination
   * @param value the non-negative value
   */
  static void writeVarint(ByteArrayOutputStream out, long value) {
    if (value < 0) {
      throw new IllegalArgumentException("varint must be non-negative");
    }
    while ((value & ~0x7FL) != 0) {
      out.write((int) ((value & 0x7F) | 0x80));
      value >>>= 7;
    }
    out.write((int) value);
  }
}
