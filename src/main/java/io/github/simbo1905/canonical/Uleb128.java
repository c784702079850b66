// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import static io.github.simbo1905.canonical.PicklerException.Kind.LENGTH_OVERFLOW;
import static io.github.simbo1905.canonical.PicklerException.Kind.NON_CANONICAL_LENGTH;

/// Unsigned LEB128 for lengths and variant tags: seven payload bits per byte, least significant group
/// first, high bit set on every byte but the last. Only the shortest encoding of a value is accepted
/// and values are limited to 32 bits.
final class Uleb128 {
  /// A u32 needs at most five groups of seven bits
  static final int MAX_BYTES = 5;
  static final long MAX_U32 = 0xFFFF_FFFFL;

  private Uleb128() {
  }

  /// Writes a non-negative int
  /// @param buffer the buffer to write to
  /// @param value  the value to write to the buffer
  /// @return the number of bytes written
  static int putInt(WriteBuffer buffer, int value) {
    if (value < 0) {
      throw new IllegalArgumentException("ULEB128 value must be non-negative, got: " + value);
    }
    int count = 1;
    while ((value & ~0x7F) != 0) {
      buffer.put((byte) ((value & 0x7F) | 0x80));
      value >>>= 7;
      count++;
    }
    buffer.put((byte) value);
    return count;
  }

  /// Read a canonical ULEB128 value that fits in 32 unsigned bits
  /// @param buffer the buffer to read from
  /// @return the value read, between 0 and 2^32 - 1
  static long getU32(ReadBuffer buffer) {
    final int start = buffer.position();
    long value = 0;
    for (int i = 0; i < MAX_BYTES; i++) {
      final int b = buffer.get() & 0xFF;
      value |= (long) (b & 0x7F) << (7 * i);
      if ((b & 0x80) == 0) {
        if (i > 0 && b == 0) {
          throw buffer.error(NON_CANONICAL_LENGTH, start,
              "ULEB128 of " + (i + 1) + " bytes has a redundant trailing zero group");
        }
        if (value > MAX_U32) {
          throw buffer.error(LENGTH_OVERFLOW, start, "ULEB128 value " + value + " does not fit in 32 bits");
        }
        return value;
      }
    }
    throw buffer.error(LENGTH_OVERFLOW, start, "ULEB128 longer than " + MAX_BYTES + " bytes");
  }

  /// Counts the number of bytes needed to encode the given value
  static int sizeOf(int value) {
    if (value < 0) {
      throw new IllegalArgumentException("ULEB128 value must be non-negative, got: " + value);
    }
    int length = 1;
    while ((value & ~0x7F) != 0) {
      value >>>= 7;
      length++;
    }
    return length;
  }
}
