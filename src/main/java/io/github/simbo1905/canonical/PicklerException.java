// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.Objects;

/// Raised when bytes are not the canonical encoding of a value of the expected shape, or when a
/// fixed size sink runs out of room. Every failure is fatal to the enclosing call.
public final class PicklerException extends RuntimeException {

  /// The reason a decode (or a capped encode) failed
  public enum Kind {
    UNEXPECTED_END_OF_INPUT,
    INVALID_BOOLEAN,
    INVALID_CHAR,
    INVALID_OPTION_TAG,
    UNKNOWN_VARIANT_TAG,
    NON_CANONICAL_LENGTH,
    LENGTH_OVERFLOW,
    INVALID_UTF8,
    MAP_NOT_CANONICALLY_ORDERED,
    DUPLICATE_KEY,
    TRAILING_DATA,
    RECURSION_LIMIT_EXCEEDED,
    SINK_EXHAUSTED
  }

  private final Kind kind;
  private final int position;

  PicklerException(Kind kind, int position, String message) {
    super(kind + " at position " + position + ": " + message);
    this.kind = Objects.requireNonNull(kind);
    this.position = position;
  }

  PicklerException(Kind kind, int position, String message, Throwable cause) {
    super(kind + " at position " + position + ": " + message, cause);
    this.kind = Objects.requireNonNull(kind);
    this.position = position;
  }

  public Kind kind() {
    return kind;
  }

  /// Offset relative to the start of the pickled bytes where the problem was detected
  public int position() {
    return position;
  }
}
