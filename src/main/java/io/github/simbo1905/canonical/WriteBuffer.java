// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/// Position tracked little-endian byte sink. A growable buffer never runs out of room. A buffer
/// over a caller supplied [ByteBuffer] fails with [PicklerException.Kind#SINK_EXHAUSTED] once full
/// and only moves the caller's position when [#commit()] is called after a complete write.
final class WriteBuffer {
  static final int DEFAULT_CAPACITY = 64;

  private final ByteBuffer target;
  private final Nesting nesting;
  private ByteBuffer buffer;

  private WriteBuffer(ByteBuffer target, ByteBuffer buffer, Nesting nesting) {
    this.target = target;
    this.nesting = Objects.requireNonNull(nesting);
    this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
  }

  static WriteBuffer growable(int initialCapacity, Nesting nesting) {
    return new WriteBuffer(null, ByteBuffer.allocate(Math.max(initialCapacity, 1)), nesting);
  }

  static WriteBuffer growable(int initialCapacity) {
    return growable(initialCapacity, Nesting.of(PicklerConfig.DEFAULT));
  }

  static WriteBuffer growable() {
    return growable(DEFAULT_CAPACITY);
  }

  /// Write into the remaining space of the target starting at its current position
  static WriteBuffer wrap(ByteBuffer target, Nesting nesting) {
    Objects.requireNonNull(target, "target buffer must not be null");
    if (target.isReadOnly()) {
      throw new IllegalArgumentException("target buffer is read only");
    }
    return new WriteBuffer(target, target.slice(), nesting);
  }

  static WriteBuffer wrap(ByteBuffer target) {
    return wrap(target, Nesting.of(PicklerConfig.DEFAULT));
  }

  /// Depth of named definitions entered by the write in progress. Scratch buffers for map keys share it.
  Nesting nesting() {
    return nesting;
  }

  /// Bytes written so far
  int position() {
    return buffer.position();
  }

  WriteBuffer put(byte value) {
    ensure(Byte.BYTES);
    buffer.put(value);
    return this;
  }

  WriteBuffer putShort(short value) {
    ensure(Short.BYTES);
    buffer.putShort(value);
    return this;
  }

  WriteBuffer putInt(int value) {
    ensure(Integer.BYTES);
    buffer.putInt(value);
    return this;
  }

  WriteBuffer putLong(long value) {
    ensure(Long.BYTES);
    buffer.putLong(value);
    return this;
  }

  WriteBuffer putBytes(byte[] bytes) {
    ensure(bytes.length);
    buffer.put(bytes);
    return this;
  }

  /// Copy of everything written so far
  byte[] toByteArray() {
    return Arrays.copyOf(buffer.array(), buffer.position());
  }

  /// Advance the caller's buffer past the bytes written into it
  int commit() {
    final int written = buffer.position();
    if (target != null) {
      target.position(target.position() + written);
    }
    return written;
  }

  private void ensure(int needed) {
    if (buffer.remaining() >= needed) {
      return;
    }
    if (target != null) {
      throw new PicklerException(PicklerException.Kind.SINK_EXHAUSTED, buffer.position(),
          "need " + needed + " more bytes but only " + buffer.remaining() + " remain of " + buffer.capacity());
    }
    final long required = (long) buffer.position() + needed;
    if (required > Integer.MAX_VALUE - 8) {
      throw new PicklerException(PicklerException.Kind.SINK_EXHAUSTED, buffer.position(),
          "encoding would exceed the maximum array size");
    }
    final int capacity = (int) Math.min(Integer.MAX_VALUE - 8, Math.max(required, (long) buffer.capacity() * 2));
    final ByteBuffer grown = ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
    buffer.flip();
    grown.put(buffer);
    buffer = grown;
  }
}
