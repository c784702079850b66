// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Structural description of a value: the shape tells the codec how to read and write it.
/// All nodes are nested within this interface. Named struct and enum definitions live in a
/// [Registry] and are referenced with [NamedNode], which is what allows recursive shapes.
public sealed interface Shape permits
    Shape.PrimitiveNode, Shape.UnitNode, Shape.StringNode, Shape.BytesNode,
    Shape.SeqNode, Shape.OptionNode, Shape.MapNode, Shape.SetNode,
    Shape.TupleNode, Shape.ArrayNode, Shape.NamedNode {

  Shape BOOL = new PrimitiveNode(PrimitiveType.BOOL);
  Shape U8 = new PrimitiveNode(PrimitiveType.U8);
  Shape U16 = new PrimitiveNode(PrimitiveType.U16);
  Shape U32 = new PrimitiveNode(PrimitiveType.U32);
  Shape U64 = new PrimitiveNode(PrimitiveType.U64);
  Shape U128 = new PrimitiveNode(PrimitiveType.U128);
  Shape I8 = new PrimitiveNode(PrimitiveType.I8);
  Shape I16 = new PrimitiveNode(PrimitiveType.I16);
  Shape I32 = new PrimitiveNode(PrimitiveType.I32);
  Shape I64 = new PrimitiveNode(PrimitiveType.I64);
  Shape I128 = new PrimitiveNode(PrimitiveType.I128);
  Shape F32 = new PrimitiveNode(PrimitiveType.F32);
  Shape F64 = new PrimitiveNode(PrimitiveType.F64);
  Shape CHAR = new PrimitiveNode(PrimitiveType.CHAR);
  Shape UNIT = new UnitNode();
  Shape STRING = new StringNode();
  Shape BYTES = new BytesNode();

  static Shape seq(Shape element) {
    return new SeqNode(element);
  }

  static Shape option(Shape wrapped) {
    return new OptionNode(wrapped);
  }

  static Shape map(Shape key, Shape value) {
    return new MapNode(key, value);
  }

  static Shape set(Shape key) {
    return new SetNode(key);
  }

  static Shape tuple(Shape... elements) {
    return new TupleNode(List.of(elements));
  }

  static Shape array(Shape element, int size) {
    return new ArrayNode(element, size);
  }

  static Shape named(String name) {
    return new NamedNode(name);
  }

  /// Names of the definitions this shape refers to directly or through containers
  default Stream<String> referencedNames() {
    if (this instanceof NamedNode named) {
      return Stream.of(named.name());
    } else if (this instanceof SeqNode seq) {
      return seq.element().referencedNames();
    } else if (this instanceof OptionNode option) {
      return option.wrapped().referencedNames();
    } else if (this instanceof MapNode map) {
      return Stream.concat(map.key().referencedNames(), map.value().referencedNames());
    } else if (this instanceof SetNode set) {
      return set.key().referencedNames();
    } else if (this instanceof TupleNode tuple) {
      return tuple.elements().stream().flatMap(Shape::referencedNames);
    } else if (this instanceof ArrayNode array) {
      return array.element().referencedNames();
    }
    return Stream.empty();
  }

  /// Helper method to get a string representation for debugging
  /// Example: SEQ(STRING) or MAP(STRING,I32)
  String toTreeString();

  /// Fixed width scalar kinds. Java has no unsigned integers so the unsigned kinds are carried in the
  /// signed box of the same width and read as unsigned bits, e.g. U64 max is `-1L`.
  enum PrimitiveType {
    BOOL(1, Boolean.class),
    U8(1, Byte.class),
    U16(2, Short.class),
    U32(4, Integer.class),
    U64(8, Long.class),
    U128(16, java.math.BigInteger.class),
    I8(1, Byte.class),
    I16(2, Short.class),
    I32(4, Integer.class),
    I64(8, Long.class),
    I128(16, java.math.BigInteger.class),
    F32(4, Float.class),
    F64(8, Double.class),
    CHAR(4, Integer.class);

    private final int width;
    private final Class<?> javaType;

    PrimitiveType(int width, Class<?> javaType) {
      this.width = width;
      this.javaType = javaType;
    }

    /// Encoded width in bytes
    public int width() {
      return width;
    }

    /// The boxed Java type that values of this kind decode to
    public Class<?> javaType() {
      return javaType;
    }
  }

  /// Leaf node for fixed width scalars
  record PrimitiveNode(PrimitiveType type) implements Shape {
    public PrimitiveNode {
      Objects.requireNonNull(type, "Primitive type cannot be null");
    }

    @Override
    public String toTreeString() {
      return type.name();
    }
  }

  /// The anonymous zero-field product
  record UnitNode() implements Shape {
    @Override
    public String toTreeString() {
      return "UNIT";
    }
  }

  /// UTF-8 string with a length prefix
  record StringNode() implements Shape {
    @Override
    public String toTreeString() {
      return "STRING";
    }
  }

  /// Raw byte blob with a length prefix
  record BytesNode() implements Shape {
    @Override
    public String toTreeString() {
      return "BYTES";
    }
  }

  /// Container node for variable length sequences - has one child (element type)
  record SeqNode(Shape element) implements Shape {
    public SeqNode {
      Objects.requireNonNull(element, "Sequence element shape cannot be null");
    }

    @Override
    public String toTreeString() {
      return "SEQ(" + element.toTreeString() + ")";
    }
  }

  /// Container node for optionals - has one child (wrapped type)
  record OptionNode(Shape wrapped) implements Shape {
    public OptionNode {
      Objects.requireNonNull(wrapped, "Option wrapped shape cannot be null");
    }

    @Override
    public String toTreeString() {
      return "OPTION(" + wrapped.toTreeString() + ")";
    }
  }

  /// Container node for maps - has two children (key type, value type)
  record MapNode(Shape key, Shape value) implements Shape {
    public MapNode {
      Objects.requireNonNull(key, "Map key shape cannot be null");
      Objects.requireNonNull(value, "Map value shape cannot be null");
    }

    @Override
    public String toTreeString() {
      return "MAP(" + key.toTreeString() + "," + value.toTreeString() + ")";
    }
  }

  /// Container node for sets - a map with the values elided
  record SetNode(Shape key) implements Shape {
    public SetNode {
      Objects.requireNonNull(key, "Set key shape cannot be null");
    }

    @Override
    public String toTreeString() {
      return "SET(" + key.toTreeString() + ")";
    }
  }

  /// Anonymous product. Fields are written back to back with no framing.
  record TupleNode(List<Shape> elements) implements Shape {
    public TupleNode {
      elements = List.copyOf(Objects.requireNonNull(elements, "Tuple element shapes cannot be null"));
    }

    @Override
    public String toTreeString() {
      return elements.stream().map(Shape::toTreeString).collect(Collectors.joining(",", "TUPLE(", ")"));
    }
  }

  /// Fixed size array. The size belongs to the shape so nothing but the elements is written.
  record ArrayNode(Shape element, int size) implements Shape {
    public ArrayNode {
      Objects.requireNonNull(element, "Array element shape cannot be null");
      if (size < 0) {
        throw new IllegalArgumentException("Array size must be non-negative, got: " + size);
      }
    }

    @Override
    public String toTreeString() {
      return "ARRAY(" + element.toTreeString() + ";" + size + ")";
    }
  }

  /// Reference to a struct or enum definition held in a [Registry]
  record NamedNode(String name) implements Shape {
    public NamedNode {
      Objects.requireNonNull(name, "Type name cannot be null");
      if (name.isBlank()) {
        throw new IllegalArgumentException("Type name cannot be blank");
      }
    }

    @Override
    public String toTreeString() {
      return name;
    }
  }
}
