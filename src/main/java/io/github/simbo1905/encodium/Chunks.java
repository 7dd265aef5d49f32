// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static io.github.simbo1905.encodium.Pickler.LOGGER;

/// Chunk framing shared by records and lists. A chunk is either the absence marker `0x00` or a length prefix
/// followed by that many payload bytes.
final class Chunks {

  static final byte ABSENT = 0x00;

  private Chunks() {
  }

  static <T> int sizeOf(FieldType<T> type, T value) {
    if (value == null) {
      return 1;
    }
    final int payload = type.sizeOf(value);
    return LengthPrefix.sizeOf(payload) + payload;
  }

  static <T> void write(ByteBuffer buffer, FieldType<T> type, T value) {
    if (value == null) {
      LOGGER.finer(() -> "Writing ABSENT chunk at position " + buffer.position());
      buffer.put(ABSENT);
      return;
    }
    final int payload = type.sizeOf(value);
    LengthPrefix.encode(buffer, payload);
    final int start = buffer.position();
    type.write(buffer, value);
    assert buffer.position() - start == payload :
        type.kind() + " wrote " + (buffer.position() - start) + " bytes but sized " + payload;
    LOGGER.finer(() -> "Wrote " + type.kind() + " chunk of " + payload + " bytes at position " + start);
  }

  /// Splits the remaining bytes into chunks. An absent chunk is returned as `null`, a present one as a read-only
  /// slice holding exactly its payload. The buffer is left exhausted.
  static @NotNull List<ByteBuffer> split(ByteBuffer buffer) {
    final var chunks = new ArrayList<ByteBuffer>();
    while (buffer.hasRemaining()) {
      final int prefixPosition = buffer.position();
      final long length = LengthPrefix.decode(buffer);
      if (length == 0) {
        chunks.add(null);
        continue;
      }
      if (length > buffer.remaining()) {
        throw new ValidationException.TruncatedData("chunk at position " + prefixPosition + " declares " + length +
            " bytes but only " + buffer.remaining() + " remain");
      }
      final int start = buffer.position();
      chunks.add(buffer.slice(start, (int) length).asReadOnlyBuffer());
      buffer.position(start + (int) length);
    }
    LOGGER.finer(() -> "Split " + chunks.size() + " chunks ending at position " + buffer.position());
    return chunks;
  }
}
