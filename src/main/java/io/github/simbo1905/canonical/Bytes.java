// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/// Immutable byte blob with value equality. Java arrays compare by identity which breaks record
/// equality and map keys, so `BYTES` values are carried in this wrapper.
public final class Bytes {
  public static final Bytes EMPTY = new Bytes(new byte[0]);

  private final byte[] bytes;

  private Bytes(byte[] bytes) {
    this.bytes = bytes;
  }

  /// Copy the given array
  public static Bytes of(byte... bytes) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    return bytes.length == 0 ? EMPTY : new Bytes(bytes.clone());
  }

  /// Adopt an array the caller will never touch again
  static Bytes wrap(byte[] bytes) {
    return bytes.length == 0 ? EMPTY : new Bytes(bytes);
  }

  public int length() {
    return bytes.length;
  }

  public byte get(int index) {
    return bytes[index];
  }

  public byte[] toByteArray() {
    return bytes.clone();
  }

  /// Package access to the backing array for writers. Never mutate.
  byte[] unsafeArray() {
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof Bytes other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Bytes[" + HexFormat.of().formatHex(bytes) + "]";
  }
}
