// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.Objects;

/// Binds an enum definition of unit variants to a Java enum. The tag is the constant's ordinal.
final class EnumConstantBinding implements Binding.EnumBinding {
  private static final Object[] NO_FIELDS = new Object[0];

  final Class<?> enumClass;
  final Object[] constants;

  EnumConstantBinding(Class<?> enumClass) {
    this.enumClass = Objects.requireNonNull(enumClass);
    if (!enumClass.isEnum()) {
      throw new IllegalArgumentException("Class must be an enum: " + enumClass);
    }
    this.constants = enumClass.getEnumConstants();
  }

  @Override
  public int tag(Object value) {
    Objects.requireNonNull(value, "enum constant must not be null");
    if (!enumClass.isInstance(value)) {
      throw new IllegalArgumentException("Expected " + enumClass + " but got " + value.getClass());
    }
    return ((Enum<?>) value).ordinal();
  }

  @Override
  public Object[] fields(Object value) {
    return NO_FIELDS;
  }

  @Override
  public Object construct(int tag, Object[] fields) {
    assert fields.length == 0 : "Enum constants carry no fields";
    return constants[tag];
  }

  @Override
  public String toString() {
    return "EnumConstantBinding{enumClass=" + enumClass + "}";
  }
}
