// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Shared helpers for asserting on exact bytes and on decode failures
final class PicklerAssertions {
  static final HexFormat HEX = HexFormat.of();

  private PicklerAssertions() {
  }

  static byte[] hex(String hex) {
    return HEX.parseHex(hex.replace(" ", ""));
  }

  static String hex(byte[] bytes) {
    return HEX.formatHex(bytes);
  }

  static void assertFails(ThrowingCallable call, PicklerException.Kind kind, int position) {
    assertThatThrownBy(call)
        .isInstanceOfSatisfying(PicklerException.class, e -> {
          org.assertj.core.api.Assertions.assertThat(e.kind()).isEqualTo(kind);
          org.assertj.core.api.Assertions.assertThat(e.position()).isEqualTo(position);
        });
  }

  static void assertFails(ThrowingCallable call, PicklerException.Kind kind) {
    assertThatThrownBy(call)
        .isInstanceOfSatisfying(PicklerException.class, e ->
            org.assertj.core.api.Assertions.assertThat(e.kind()).isEqualTo(kind));
  }
}
