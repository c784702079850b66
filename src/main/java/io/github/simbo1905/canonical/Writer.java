// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.function.BiConsumer;

interface Writer extends BiConsumer<WriteBuffer, Object> {

  /// Write a value to the buffer
  default void write(WriteBuffer buffer, Object value) {
    accept(buffer, value);
  }
}
