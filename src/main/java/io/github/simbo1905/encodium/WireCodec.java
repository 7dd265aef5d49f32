// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Objects;

/// Walks a schema's fields in order to write and read chunked messages. Nested records reuse the static
/// `writeRecord`/`readRecord` entry points through [FieldType.RecordType].
final class WireCodec implements Pickler {
  private final Schema schema;
  private final CompatibilityMode compatibilityMode;

  WireCodec(Schema schema, CompatibilityMode compatibilityMode) {
    this.schema = Objects.requireNonNull(schema);
    this.compatibilityMode = Objects.requireNonNull(compatibilityMode);
    LOGGER.fine(() -> "Created pickler for " + schema.name() + " with compatibility mode " + compatibilityMode);
  }

  @Override
  public Schema schema() {
    return schema;
  }

  @Override
  public byte[] serialize(RecordInstance record) {
    final var buffer = ByteBuffer.allocate(sizeOf(record));
    serialize(buffer, record);
    assert !buffer.hasRemaining() : "sizeOf disagrees with bytes written for " + schema.name();
    return buffer.array();
  }

  @Override
  public int serialize(ByteBuffer buffer, RecordInstance record) {
    Objects.requireNonNull(buffer);
    expectSchema(record);
    final int start = buffer.position();
    writeRecord(buffer, record);
    return buffer.position() - start;
  }

  @Override
  public RecordInstance deserialize(byte[] bytes) {
    Objects.requireNonNull(bytes);
    return deserialize(ByteBuffer.wrap(bytes));
  }

  @Override
  public RecordInstance deserialize(ByteBuffer buffer) {
    Objects.requireNonNull(buffer);
    return readRecord(schema, buffer, compatibilityMode);
  }

  @Override
  public int sizeOf(RecordInstance record) {
    expectSchema(record);
    return sizeOfRecord(record);
  }

  private void expectSchema(RecordInstance record) {
    Objects.requireNonNull(record);
    if (record.schema() != schema) {
      throw new IllegalArgumentException("Expected a record of " + schema.name() + " but got " +
          record.schema().name());
    }
  }

  static int sizeOfRecord(RecordInstance record) {
    final var fields = record.schema().fields();
    int size = 1;
    for (int i = 0; i < fields.size(); i++) {
      size += chunkSize(fields.get(i).type(), record.valueAt(i));
    }
    return size;
  }

  static void writeRecord(ByteBuffer buffer, RecordInstance record) {
    final var recordSchema = record.schema();
    final var fields = recordSchema.fields();
    final int startPosition = buffer.position();
    buffer.put(FORMAT_MARKER);
    for (int i = 0; i < fields.size(); i++) {
      writeChunk(buffer, fields.get(i).type(), record.valueAt(i));
    }
    final int endPosition = buffer.position();
    LOGGER.fine(() -> String.format("[%s.writeRecord] Wrote %d bytes for %d fields from @%d to @%d",
        recordSchema.name(), endPosition - startPosition, fields.size(), startPosition, endPosition));
  }

  /// Reads the marker and every remaining chunk, pairs chunks with fields by position and constructs the record
  /// through the normal validation pipeline.
  static @NotNull RecordInstance readRecord(Schema schema, ByteBuffer buffer, CompatibilityMode compatibilityMode) {
    final int startPosition = buffer.position();
    if (!buffer.hasRemaining()) {
      throw new ValidationException.TruncatedData(schema.name() + " message is empty, expected format marker 0x01");
    }
    final byte marker = buffer.get();
    if (marker != FORMAT_MARKER) {
      throw new ValidationException.MalformedData(schema.name() + " message starts with 0x" +
          HexFormat.of().toHexDigits(marker) + " instead of format marker 0x01");
    }
    final var chunks = Chunks.split(buffer);
    final var fields = schema.fields();

    if (chunks.size() != fields.size()) {
      if (compatibilityMode != CompatibilityMode.ENABLED) {
        final String problem = String.format("%s message has %d chunks but the schema has %d fields",
            schema.name(), chunks.size(), fields.size());
        if (chunks.size() < fields.size()) {
          throw new ValidationException.TruncatedData(problem);
        }
        throw new ValidationException.MalformedData(problem);
      }
      LOGGER.info(() -> String.format("[%s.readRecord] %d chunks for %d fields, compatibility mode is ENABLED so %s",
          schema.name(), chunks.size(), fields.size(),
          chunks.size() < fields.size() ? "missing fields are absent" : "extra chunks are ignored"));
    }

    final var values = new HashMap<String, Object>();
    final int paired = Math.min(chunks.size(), fields.size());
    for (int i = 0; i < paired; i++) {
      final var chunk = chunks.get(i);
      if (chunk == null) {
        continue;
      }
      final var spec = fields.get(i);
      try {
        values.put(spec.name(), spec.type().read(chunk, compatibilityMode));
      } catch (ValidationException e) {
        throw e.prependPath(spec.name());
      }
      if (chunk.hasRemaining()) {
        throw new ValidationException.MalformedData(chunk.remaining() + " unread bytes in " +
            spec.type().describe() + " payload").prependPath(spec.name());
      }
    }
    LOGGER.fine(() -> String.format("[%s.readRecord] Read %d chunks from @%d to @%d",
        schema.name(), chunks.size(), startPosition, buffer.position()));
    return RecordEngine.construct(schema, values);
  }

  @SuppressWarnings("unchecked")
  private static <T> int chunkSize(FieldType<T> type, Object value) {
    return Chunks.sizeOf(type, (T) value);
  }

  @SuppressWarnings("unchecked")
  private static <T> void writeChunk(ByteBuffer buffer, FieldType<T> type, Object value) {
    Chunks.write(buffer, type, (T) value);
  }

  @Override
  public String toString() {
    return "WireCodec{schema=" + schema.name() + ", compatibilityMode=" + compatibilityMode + "}";
  }
}
