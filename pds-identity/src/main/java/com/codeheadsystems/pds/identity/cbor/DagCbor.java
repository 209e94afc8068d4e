package com.codeheadsystems.pds.identity.cbor;

import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Deterministic DAG-CBOR encoder.
 * <p>
 * Accepts plain Java values: {@code Map<String, ?>}, {@code Collection}, {@code String},
 * integral numbers, {@code Boolean}, {@code null}, {@code byte[]} and {@link Cid} links.
 * Maps and arrays are written with definite lengths, integers in their shortest form, and
 * map keys ordered by encoded length first and then bytewise. Floating point values are
 * rejected.
 */
public class DagCbor {

  private static final int CID_TAG = 42;

  private static final CBORFactory FACTORY = CBORFactory.builder()
      .enable(CBORGenerator.Feature.WRITE_MINIMAL_INTS)
      .build();

  private static final Comparator<byte[]> KEY_ORDER = Comparator
      .<byte[]>comparingInt(k -> k.length)
      .thenComparing(Arrays::compareUnsigned);

  private DagCbor() {
  }

  /**
   * Encodes a value.
   *
   * @param value the value
   * @return the DAG-CBOR bytes
   * @throws IllegalArgumentException if the value contains an unsupported type
   */
  public static byte[] encode(Object value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (CBORGenerator generator = FACTORY.createGenerator(out)) {
      write(generator, value);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to encode dag-cbor", e);
    }
    return out.toByteArray();
  }

  /**
   * Encodes a value and returns the block together with its CID.
   *
   * @param value the value
   * @return the block
   */
  public static Block block(Object value) {
    byte[] bytes = encode(value);
    return new Block(Cid.forDagCbor(bytes), bytes);
  }

  /**
   * An encoded block and its CID.
   *
   * @param cid   the cid
   * @param bytes the encoded bytes
   */
  public record Block(Cid cid, byte[] bytes) {
  }

  private static void write(CBORGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof byte[] binary) {
      generator.writeBinary(binary);
    } else if (value instanceof Cid cid) {
      // tag 42 payload is the binary cid behind a 0x00 multibase identity prefix
      byte[] raw = cid.bytes();
      byte[] link = new byte[raw.length + 1];
      System.arraycopy(raw, 0, link, 1, raw.length);
      generator.writeTag(CID_TAG);
      generator.writeBinary(link);
    } else if (value instanceof Map<?, ?> map) {
      writeMap(generator, map);
    } else if (value instanceof Collection<?> items) {
      generator.writeStartArray(items, items.size());
      for (Object item : items) {
        write(generator, item);
      }
      generator.writeEndArray();
    } else {
      throw new IllegalArgumentException("Unsupported dag-cbor type: " + value.getClass().getName());
    }
  }

  private static void writeMap(CBORGenerator generator, Map<?, ?> map) throws IOException {
    List<Map.Entry<byte[], Object>> entries = new ArrayList<>(map.size());
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String name)) {
        throw new IllegalArgumentException("dag-cbor map keys must be strings");
      }
      byte[] key = name.getBytes(StandardCharsets.UTF_8);
      entries.add(new AbstractMap.SimpleImmutableEntry<byte[], Object>(key, entry.getValue()));
    }
    entries.sort(Map.Entry.comparingByKey(KEY_ORDER));
    generator.writeStartObject(map, entries.size());
    for (Map.Entry<byte[], Object> entry : entries) {
      generator.writeFieldName(new String(entry.getKey(), StandardCharsets.UTF_8));
      write(generator, entry.getValue());
    }
    generator.writeEndObject();
  }
}
