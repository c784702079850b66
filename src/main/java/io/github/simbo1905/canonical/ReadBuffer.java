// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import static io.github.simbo1905.canonical.PicklerException.Kind.*;

/// Position tracked little-endian byte source with bounds checking. One instance serves exactly one
/// decode call: it owns the cursor, the nesting depth counter and the limits for that call.
final class ReadBuffer {
  private final ByteBuffer buffer;
  private final int maxDepth;
  private final int maxLength;
  private int depth;

  private ReadBuffer(ByteBuffer buffer, PicklerConfig config) {
    this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
    this.maxDepth = config.maxDepth();
    this.maxLength = config.maxLength();
  }

  /// Read the bytes between the source's position and its limit. The source itself is not moved.
  static ReadBuffer wrap(ByteBuffer source, PicklerConfig config) {
    Objects.requireNonNull(source, "source buffer must not be null");
    return new ReadBuffer(source.slice(), Objects.requireNonNull(config));
  }

  static ReadBuffer wrap(byte[] bytes, PicklerConfig config) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    return new ReadBuffer(ByteBuffer.wrap(bytes), Objects.requireNonNull(config));
  }

  int position() {
    return buffer.position();
  }

  int remaining() {
    return buffer.remaining();
  }

  boolean hasRemaining() {
    return buffer.hasRemaining();
  }

  byte get() {
    require(Byte.BYTES);
    return buffer.get();
  }

  short getShort() {
    require(Short.BYTES);
    return buffer.getShort();
  }

  int getInt() {
    require(Integer.BYTES);
    return buffer.getInt();
  }

  long getLong() {
    require(Long.BYTES);
    return buffer.getLong();
  }

  /// Fresh copy of the next `length` bytes
  byte[] getBytes(int length) {
    require(length);
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  /// Fresh copy of bytes already consumed between two absolute positions
  byte[] copyRange(int from, int to) {
    final byte[] bytes = new byte[to - from];
    buffer.get(from, bytes);
    return bytes;
  }

  /// Read a length prefix and check it against the configured maximum
  int getLength() {
    final int start = position();
    final long length = Uleb128.getU32(this);
    if (length > maxLength) {
      throw error(LENGTH_OVERFLOW, start, "length " + length + " exceeds the maximum of " + maxLength);
    }
    return (int) length;
  }

  /// Read an enum variant tag
  long getVariantTag() {
    return Uleb128.getU32(this);
  }

  /// Called on entry to a named definition
  void enter(String name) {
    if (++depth > maxDepth) {
      throw error(RECURSION_LIMIT_EXCEEDED, position(),
          "nesting of " + name + " exceeds the maximum depth of " + maxDepth);
    }
  }

  void exit() {
    depth--;
  }

  int depth() {
    return depth;
  }

  PicklerException error(PicklerException.Kind kind, int position, String message) {
    return new PicklerException(kind, position, message);
  }

  private void require(int length) {
    if (buffer.remaining() < length) {
      throw error(UNEXPECTED_END_OF_INPUT, position(),
          "need " + length + " bytes but only " + buffer.remaining() + " remain");
    }
  }
}
