// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface of the canonical pickler. A pickler is built once for a root [Shape] and then
/// turns values into their single canonical byte encoding and back. Any two equal values pickle to
/// identical bytes, and only canonical bytes are accepted when unpickling.
///
/// Picklers hold no mutable state and may be shared between threads.
public sealed interface Pickler<T> permits ShapePickler {

  Logger LOGGER = Logger.getLogger(Pickler.class.getName());

  /// Serialize a value to a fresh array holding exactly its canonical bytes
  /// @param value The value to serialize
  /// @return The canonical encoding
  /// @throws IllegalArgumentException if the value does not fit the shape or nests named definitions
  ///         deeper than [PicklerConfig#maxDepth()]
  byte[] serialize(T value);

  /// Serialize a value into a caller supplied buffer starting at its position. On success the position
  /// is advanced past the bytes written. If the buffer runs out of room a [PicklerException] of kind
  /// [PicklerException.Kind#SINK_EXHAUSTED] is thrown and the position is left unchanged.
  /// @param buffer The buffer to write to
  /// @param value The value to serialize
  /// @return The number of bytes written
  int serialize(ByteBuffer buffer, T value);

  /// Deserialize a value that must occupy the whole array
  /// @param bytes The canonical encoding
  /// @return The decoded value
  /// @throws PicklerException if the bytes are not the canonical encoding of a value of the shape
  T deserialize(byte[] bytes);

  /// Deserialize a value that must occupy everything from the buffer's position to its limit.
  /// On success the position is moved to the limit. On failure the position is left unchanged.
  /// @param buffer The buffer to read from
  /// @return The decoded value
  T deserialize(ByteBuffer buffer);

  /// Exact number of bytes [#serialize(Object)] would produce. Fails in the same way serialize does.
  /// @param value The value to size
  /// @return The encoded size in bytes
  int sizeOf(T value);

  /// The root shape this pickler encodes
  Shape shape();

  /// The definitions named by the root shape
  Registry registry();

  /// The depth and length limits in force
  PicklerConfig config();

  /// Create a pickler for an explicit shape. Values are the plain Java types listed on [Shape.PrimitiveType]
  /// along with [Struct] for struct definitions and [Variant] for enum definitions.
  /// @param root The root shape
  /// @param registry The definitions the shape refers to
  /// @return A pickler using limits from the system properties
  static Pickler<Object> forShape(Shape root, Registry registry) {
    return forShape(root, registry, PicklerConfig.current());
  }

  /// Create a pickler for an explicit shape with explicit decode limits
  static Pickler<Object> forShape(Shape root, Registry registry, PicklerConfig config) {
    Objects.requireNonNull(root, "Shape must not be null");
    Objects.requireNonNull(registry, "Registry must not be null");
    Objects.requireNonNull(config, "Config must not be null");
    registry.validateRoot(root);
    final Serde serde = Companion.createSerde(root, registry,
        name -> registry.get(name) instanceof TypeDef.StructDef ? Binding.STRUCTS : Binding.VARIANTS);
    return new ShapePickler<>(Object.class, root, registry, config, serde);
  }

  /// Create a pickler for a record, enum or sealed interface of records
  /// @param clazz The root class
  /// @return A pickler using limits from the system properties
  static <T> Pickler<T> forClass(Class<T> clazz) {
    return forClass(clazz, PicklerConfig.current());
  }

  /// Create a pickler for a record, enum or sealed interface of records with explicit decode limits
  static <T> Pickler<T> forClass(Class<T> clazz, PicklerConfig config) {
    Objects.requireNonNull(config, "Config must not be null");
    final RecordShapes shapes = RecordShapes.analyze(clazz);
    final Serde serde = Companion.createSerde(shapes.root(), shapes.registry(), shapes.bindings()::get);
    return new ShapePickler<>(clazz, shapes.root(), shapes.registry(), config, serde);
  }
}
