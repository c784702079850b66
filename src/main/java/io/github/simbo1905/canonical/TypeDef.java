// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/// Named definitions that [Shape.NamedNode] references resolve to. A struct is an ordered product of
/// fields. An enum is a closed set of variants keyed by a stable integer tag, each carrying its own
/// product of fields.
public sealed interface TypeDef permits TypeDef.StructDef, TypeDef.EnumDef {

  String name();

  /// Names of all definitions referenced by the fields of this definition
  Stream<String> referencedNames();

  String toTreeString();

  /// A named field within a struct or an enum variant. Names are informational only, they never reach the wire.
  record Field(String name, Shape shape) {
    public Field {
      Objects.requireNonNull(name, "Field name cannot be null");
      Objects.requireNonNull(shape, "Field shape cannot be null");
    }

    String toTreeString() {
      return name + ":" + shape.toTreeString();
    }
  }

  /// Struct with named fields in declaration order
  static StructDef struct(String name, Field... fields) {
    return new StructDef(name, List.of(fields));
  }

  /// Struct with no fields. Encodes to nothing.
  static StructDef unitStruct(String name) {
    return new StructDef(name, List.of());
  }

  /// Struct wrapping exactly one value
  static StructDef newTypeStruct(String name, Shape shape) {
    return new StructDef(name, List.of(new Field("value", shape)));
  }

  /// Struct with positional fields named `field0`, `field1` and so on
  static StructDef tupleStruct(String name, Shape... shapes) {
    return new StructDef(name, positional(shapes));
  }

  static Field field(String name, Shape shape) {
    return new Field(name, shape);
  }

  private static List<Field> positional(Shape... shapes) {
    return IntStream.range(0, shapes.length)
        .mapToObj(i -> new Field("field" + i, shapes[i]))
        .toList();
  }

  record StructDef(String name, List<Field> fields) implements TypeDef {
    public StructDef {
      Objects.requireNonNull(name, "Struct name cannot be null");
      fields = List.copyOf(Objects.requireNonNull(fields, "Struct fields cannot be null"));
    }

    public List<Shape> shapes() {
      return fields.stream().map(Field::shape).toList();
    }

    @Override
    public Stream<String> referencedNames() {
      return fields.stream().flatMap(f -> f.shape().referencedNames());
    }

    @Override
    public String toTreeString() {
      return fields.stream().map(Field::toTreeString).collect(Collectors.joining(",", "STRUCT " + name + "(", ")"));
    }
  }

  /// One alternative of an enum
  record VariantDef(String name, List<Field> fields) {
    public VariantDef {
      Objects.requireNonNull(name, "Variant name cannot be null");
      fields = List.copyOf(Objects.requireNonNull(fields, "Variant fields cannot be null"));
    }

    public static VariantDef unit(String name) {
      return new VariantDef(name, List.of());
    }

    public static VariantDef newType(String name, Shape shape) {
      return new VariantDef(name, List.of(new Field("value", shape)));
    }

    public static VariantDef tuple(String name, Shape... shapes) {
      return new VariantDef(name, positional(shapes));
    }

    public static VariantDef struct(String name, Field... fields) {
      return new VariantDef(name, List.of(fields));
    }

    public List<Shape> shapes() {
      return fields.stream().map(Field::shape).toList();
    }

    String toTreeString() {
      return fields.stream().map(Field::toTreeString).collect(Collectors.joining(",", name + "(", ")"));
    }
  }

  record EnumDef(String name, SortedMap<Integer, VariantDef> variants) implements TypeDef {
    public EnumDef {
      Objects.requireNonNull(name, "Enum name cannot be null");
      Objects.requireNonNull(variants, "Enum variants cannot be null");
      variants.keySet().stream().filter(tag -> tag == null || tag < 0).findAny().ifPresent(tag -> {
        throw new IllegalArgumentException("Enum " + name + " has an invalid variant tag: " + tag);
      });
      variants.values().forEach(v -> Objects.requireNonNull(v, "Enum " + name + " has a null variant"));
      variants = Collections.unmodifiableSortedMap(new TreeMap<>(variants));
    }

    /// Variants tagged 0, 1, 2 ... in the order given
    public static EnumDef of(String name, VariantDef... variants) {
      final SortedMap<Integer, VariantDef> tagged = new TreeMap<>();
      IntStream.range(0, variants.length).forEach(i -> tagged.put(i, variants[i]));
      return new EnumDef(name, tagged);
    }

    public Optional<VariantDef> variant(int tag) {
      return Optional.ofNullable(variants.get(tag));
    }

    @Override
    public Stream<String> referencedNames() {
      return variants.values().stream().flatMap(v -> v.fields().stream()).flatMap(f -> f.shape().referencedNames());
    }

    @Override
    public String toTreeString() {
      return variants.entrySet().stream()
          .map(e -> e.getKey() + "=" + e.getValue().toTreeString())
          .collect(Collectors.joining("|", "ENUM " + name + "(", ")"));
    }
  }
}
