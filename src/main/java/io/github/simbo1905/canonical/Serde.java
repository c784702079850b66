// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.Objects;

/// Writer, reader and sizer for one shape, built once when the pickler is constructed
record Serde(
    Writer writer,
    Reader reader,
    Sizer sizer
) {
  Serde {
    Objects.requireNonNull(writer, "writer must not be null");
    Objects.requireNonNull(reader, "reader must not be null");
    Objects.requireNonNull(sizer, "sizer must not be null");
  }
}
