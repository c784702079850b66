// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.Arrays;

/// Connects a named definition to the Java objects that represent its values. The codec only ever
/// sees field arrays and variant tags; a binding takes values apart for writing and puts them back
/// together after reading.
sealed interface Binding permits Binding.StructBinding, Binding.EnumBinding {

  /// Binding for a [TypeDef.StructDef]
  non-sealed interface StructBinding extends Binding {
    /// Field values in declaration order
    /// @throws IllegalArgumentException if the value is not of the bound type
    Object[] fields(Object value);

    Object construct(Object[] fields);
  }

  /// Binding for a [TypeDef.EnumDef]
  non-sealed interface EnumBinding extends Binding {
    /// Tag of the active variant
    /// @throws IllegalArgumentException if the value is not of the bound type
    int tag(Object value);

    /// Field values of the active variant in declaration order
    Object[] fields(Object value);

    Object construct(int tag, Object[] fields);
  }

  /// Binds struct definitions to [Struct] values
  StructBinding STRUCTS = new StructBinding() {
    @Override
    public Object[] fields(Object value) {
      return Companion.expect(value, Struct.class, "struct").fields().toArray();
    }

    @Override
    public Object construct(Object[] fields) {
      return fields.length == 0 ? Struct.UNIT : new Struct(Arrays.asList(fields));
    }

    @Override
    public String toString() {
      return "StructBinding[Struct]";
    }
  };

  /// Binds enum definitions to [Variant] values
  EnumBinding VARIANTS = new EnumBinding() {
    @Override
    public int tag(Object value) {
      return Companion.expect(value, Variant.class, "enum").tag();
    }

    @Override
    public Object[] fields(Object value) {
      return ((Variant) value).fields().toArray();
    }

    @Override
    public Object construct(int tag, Object[] fields) {
      return new Variant(tag, Arrays.asList(fields));
    }

    @Override
    public String toString() {
      return "EnumBinding[Variant]";
    }
  };
}
