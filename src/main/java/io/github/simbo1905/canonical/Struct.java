// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Shape driven value of a [TypeDef.StructDef]: the field values in declaration order.
public record Struct(List<Object> fields) {
  /// Every unit struct decodes to this instance
  public static final Struct UNIT = new Struct(List.of());

  public Struct {
    fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
  }

  public static Struct of(Object... fields) {
    return fields.length == 0 ? UNIT : new Struct(Arrays.asList(fields));
  }

  public Object get(int index) {
    return fields.get(index);
  }

  public int size() {
    return fields.size();
  }
}
