// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.function.Function;

interface Reader extends Function<ReadBuffer, Object> {

  /// Read a value from the buffer
  default Object read(ReadBuffer buffer) {
    return apply(buffer);
  }
}
