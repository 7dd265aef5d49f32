// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.nio.ByteBuffer;

import static io.github.simbo1905.encodium.Pickler.LOGGER;

/// The length-of-length encoding that frames every chunk.
///
/// Lengths up to `0xF9` are a single byte. Larger lengths are written as `0xF9 + k` followed by the `k` minimal
/// big-endian bytes of the length, with `k` at most six.
final class LengthPrefix {

  /// Largest length that is written as a single byte.
  static final int MAX_SINGLE_BYTE = 0xF9;

  static final int MAX_LENGTH_BYTES = 6;

  private LengthPrefix() {
  }

  /// Number of bytes [#encode(ByteBuffer, long)] will write for the given length.
  static int sizeOf(long length) {
    if (length < 0) {
      throw new IllegalArgumentException("Length must not be negative: " + length);
    }
    if (length <= MAX_SINGLE_BYTE) {
      return 1;
    }
    return 1 + lengthBytes(length);
  }

  static void encode(ByteBuffer buffer, long length) {
    if (length < 0) {
      throw new IllegalArgumentException("Length must not be negative: " + length);
    }
    if (length <= MAX_SINGLE_BYTE) {
      buffer.put((byte) length);
      return;
    }
    final int k = lengthBytes(length);
    final int position = buffer.position();
    buffer.put((byte) (MAX_SINGLE_BYTE + k));
    for (int shift = (k - 1) * 8; shift >= 0; shift -= 8) {
      buffer.put((byte) (length >>> shift));
    }
    LOGGER.finer(() -> "Wrote length " + length + " using " + k + " length bytes at position " + position);
  }

  static byte[] encode(long length) {
    final var buffer = ByteBuffer.allocate(sizeOf(length));
    encode(buffer, length);
    return buffer.array();
  }

  /// Reads one length prefix and advances the buffer past it.
  /// @throws ValidationException.TruncatedData if the buffer ends inside the prefix
  static long decode(ByteBuffer buffer) {
    if (!buffer.hasRemaining()) {
      throw new ValidationException.TruncatedData("expected a length prefix at position " + buffer.position());
    }
    final int first = Byte.toUnsignedInt(buffer.get());
    if (first <= MAX_SINGLE_BYTE) {
      return first;
    }
    final int k = first - MAX_SINGLE_BYTE;
    if (buffer.remaining() < k) {
      throw new ValidationException.TruncatedData("length prefix needs " + k + " bytes but only " +
          buffer.remaining() + " remain");
    }
    long length = 0;
    for (int i = 0; i < k; i++) {
      length = (length << 8) | Byte.toUnsignedInt(buffer.get());
    }
    return length;
  }

  private static int lengthBytes(long length) {
    final int k = (Long.SIZE - Long.numberOfLeadingZeros(length) + 7) >>> 3;
    if (k > MAX_LENGTH_BYTES) {
      throw new ValidationException.LengthTooLarge("length " + length + " needs " + k +
          " length bytes, the limit is " + MAX_LENGTH_BYTES);
    }
    return k;
  }
}
