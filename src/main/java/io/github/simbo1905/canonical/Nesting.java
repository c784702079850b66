// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

/// Depth counter for one serialize or sizeOf call. Writing a value walks the same named definitions
/// that reading it does, so the write side honours the same `maxDepth` and an in-memory value that
/// could never be decoded is refused before it can exhaust the stack.
final class Nesting {
  private final int maxDepth;
  private int depth;

  Nesting(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  static Nesting of(PicklerConfig config) {
    return new Nesting(config.maxDepth());
  }

  /// @throws IllegalArgumentException if entering the definition goes past the maximum depth
  void enter(String name) {
    if (++depth > maxDepth) {
      depth--;
      throw new IllegalArgumentException("Value nesting of " + name + " exceeds the maximum depth of " + maxDepth);
    }
  }

  void exit() {
    depth--;
  }

  int depth() {
    return depth;
  }
}
