// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Shape driven value of a [TypeDef.EnumDef]: the active variant tag and its field values.
public record Variant(int tag, List<Object> fields) {
  public Variant {
    if (tag < 0) {
      throw new IllegalArgumentException("Variant tag must be non-negative, got: " + tag);
    }
    fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
  }

  public static Variant of(int tag, Object... fields) {
    return new Variant(tag, Arrays.asList(fields));
  }

  public Object get(int index) {
    return fields.get(index);
  }
}
