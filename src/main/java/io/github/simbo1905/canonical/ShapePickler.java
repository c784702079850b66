// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.nio.ByteBuffer;
import java.util.Objects;

import static io.github.simbo1905.canonical.PicklerException.Kind.TRAILING_DATA;

final class ShapePickler<T> implements Pickler<T> {
  final Class<T> type;
  final Shape root;
  final Registry registry;
  final PicklerConfig config;
  final Serde serde;

  ShapePickler(Class<T> type, Shape root, Registry registry, PicklerConfig config, Serde serde) {
    this.type = Objects.requireNonNull(type);
    this.root = Objects.requireNonNull(root);
    this.registry = Objects.requireNonNull(registry);
    this.config = Objects.requireNonNull(config);
    this.serde = Objects.requireNonNull(serde);
    LOGGER.fine(() -> "Created pickler for " + root.toTreeString() + " with " + config);
  }

  @Override
  public byte[] serialize(T value) {
    Objects.requireNonNull(value, "value must not be null");
    final WriteBuffer buffer = WriteBuffer.growable(WriteBuffer.DEFAULT_CAPACITY, Nesting.of(config));
    serde.writer().write(buffer, value);
    LOGGER.finer(() -> "Serialized " + root.toTreeString() + " to " + buffer.position() + " bytes");
    return buffer.toByteArray();
  }

  @Override
  public int serialize(ByteBuffer buffer, T value) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    Objects.requireNonNull(value, "value must not be null");
    final WriteBuffer sink = WriteBuffer.wrap(buffer, Nesting.of(config));
    serde.writer().write(sink, value);
    return sink.commit();
  }

  @Override
  public T deserialize(byte[] bytes) {
    return readWhole(ReadBuffer.wrap(bytes, config));
  }

  @Override
  public T deserialize(ByteBuffer buffer) {
    final T result = readWhole(ReadBuffer.wrap(buffer, config));
    buffer.position(buffer.limit());
    return result;
  }

  private T readWhole(ReadBuffer source) {
    final Object value = serde.reader().read(source);
    if (source.hasRemaining()) {
      throw source.error(TRAILING_DATA, source.position(), source.remaining() + " bytes follow the encoded value");
    }
    LOGGER.finer(() -> "Deserialized " + root.toTreeString() + " from " + source.position() + " bytes");
    return type.cast(value);
  }

  @Override
  public int sizeOf(T value) {
    Objects.requireNonNull(value, "value must not be null");
    return serde.sizer().sizeOf(Nesting.of(config), value);
  }

  @Override
  public Shape shape() {
    return root;
  }

  @Override
  public Registry registry() {
    return registry;
  }

  @Override
  public PicklerConfig config() {
    return config;
  }

  @Override
  public String toString() {
    return "Pickler[" + root.toTreeString() + "]";
  }
}
