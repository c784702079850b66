// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.function.ToIntBiFunction;

interface Sizer extends ToIntBiFunction<Nesting, Object> {

  /// Exact number of bytes the value encodes to
  default int sizeOf(Nesting nesting, Object value) {
    return applyAsInt(nesting, value);
  }
}
