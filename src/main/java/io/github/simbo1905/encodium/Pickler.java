// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.encodium;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface for the No Framework Encodium wire codec.
///
/// A message is the format marker `0x01` followed by one chunk per field of the schema, in field order. A chunk is
/// the absence marker `0x00` or a length prefix (see [LengthPrefix]) followed by the field payload. There is no
/// header, checksum or schema identifier: both sides must agree on the schema out of band.
public sealed interface Pickler permits WireCodec {

  Logger LOGGER = Logger.getLogger(Pickler.class.getName());

  /// The only format marker this codec reads or writes.
  byte FORMAT_MARKER = 0x01;

  /// Creates a pickler for a schema. The [CompatibilityMode] is read from the system property at this point.
  static Pickler forSchema(@NotNull Schema schema) {
    Objects.requireNonNull(schema, "Schema must not be null");
    return new WireCodec(schema, CompatibilityMode.current());
  }

  Schema schema();

  /// Serialize a record into a new array of exactly [#sizeOf(RecordInstance)] bytes
  byte[] serialize(RecordInstance record);

  /// Serialize a record to a ByteBuffer
  /// @param buffer The buffer to write to
  /// @param record The record to serialize
  /// @return The number of bytes written
  int serialize(ByteBuffer buffer, RecordInstance record);

  /// Deserialize a record from a whole message
  RecordInstance deserialize(byte[] bytes);

  /// Deserialize a record from all remaining bytes of the buffer
  /// @param buffer The buffer to read from; it is exhausted afterwards
  /// @return The validated record
  RecordInstance deserialize(ByteBuffer buffer);

  /// Exact number of bytes the record serializes to
  int sizeOf(RecordInstance record);
}
