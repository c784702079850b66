// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.function.Function;

import static io.github.simbo1905.canonical.Pickler.LOGGER;
import static io.github.simbo1905.canonical.PicklerException.Kind.*;

/// This is the static helpers of the pickler. Every shape is turned into a [Serde] once, up front, so
/// that pickling a value is a walk down prebuilt writer and reader chains with no runtime type analysis.
final class Companion {
  static final byte OPTION_NONE = 0;
  static final byte OPTION_SOME = 1;

  static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);
  static final BigInteger MIN_I128 = BigInteger.ONE.shiftLeft(127).negate();
  static final BigInteger MAX_I128 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
  static final BigInteger MAX_U128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

  static final int MAX_CODE_POINT = Character.MAX_CODE_POINT;

  private Companion() {
  }

  /// Build the serde for a root shape. Every definition in the registry gets exactly one serde and
  /// named references look it up when called, so recursive definitions need no special handling.
  static Serde createSerde(Shape root, Registry registry, Function<String, Binding> bindings) {
    final Map<String, Serde> named = new HashMap<>();
    for (TypeDef def : registry.definitions().values()) {
      final Binding binding = Objects.requireNonNull(bindings.apply(def.name()), () -> "No binding for " + def.name());
      final Serde serde = createDefinitionSerde(def, binding, registry, named);
      LOGGER.fine(() -> "Built serde for " + def.toTreeString() + " with " + binding);
      named.put(def.name(), serde);
    }
    final Serde serde = createSerdeChain(root, registry, named);
    LOGGER.fine(() -> "Built serde for root " + root.toTreeString());
    return serde;
  }

  /// Recursive descent over the shape building the writer, reader and sizer bottom up
  static Serde createSerdeChain(Shape shape, Registry registry, Map<String, Serde> named) {
    if (shape instanceof Shape.PrimitiveNode primitive) {
      return new Serde(
          buildPrimitiveWriter(primitive.type()),
          buildPrimitiveReader(primitive.type()),
          buildPrimitiveSizer(primitive.type()));
    } else if (shape instanceof Shape.UnitNode) {
      return new Serde(
          (buffer, value) -> expect(value, Unit.class, "UNIT"),
          buffer -> Unit.UNIT,
          (nesting, value) -> 0);
    } else if (shape instanceof Shape.StringNode) {
      return new Serde(Companion::writeString, Companion::readString,
          (nesting, value) -> {
            final int length = utf8Length(expect(value, String.class, "STRING"));
            return Uleb128.sizeOf(length) + length;
          });
    } else if (shape instanceof Shape.BytesNode) {
      return new Serde(Companion::writeBytes, Companion::readBytes,
          (nesting, value) -> {
            final int length = expect(value, Bytes.class, "BYTES").length();
            return Uleb128.sizeOf(length) + length;
          });
    } else if (shape instanceof Shape.SeqNode seq) {
      final Serde element = createSerdeChain(seq.element(), registry, named);
      final int minElementSize = minSize(seq.element(), registry, new HashSet<>());
      return new Serde(
          createSeqWriter(element.writer()),
          createSeqReader(element.reader(), minElementSize),
          createSeqSizer(element.sizer()));
    } else if (shape instanceof Shape.OptionNode option) {
      final Serde wrapped = createSerdeChain(option.wrapped(), registry, named);
      return new Serde(
          createOptionWriter(wrapped.writer()),
          createOptionReader(wrapped.reader()),
          createOptionSizer(wrapped.sizer()));
    } else if (shape instanceof Shape.MapNode map) {
      final Serde key = createSerdeChain(map.key(), registry, named);
      final Serde value = createSerdeChain(map.value(), registry, named);
      final int minEntrySize = minSize(List.of(map.key(), map.value()), registry, new HashSet<>());
      return new Serde(
          createMapWriter(key.writer(), value.writer()),
          createMapReader(key.reader(), value.reader(), minEntrySize),
          createMapSizer(key.writer(), value.sizer()));
    } else if (shape instanceof Shape.SetNode set) {
      final Serde key = createSerdeChain(set.key(), registry, named);
      final int minKeySize = minSize(set.key(), registry, new HashSet<>());
      return new Serde(
          createSetWriter(key.writer()),
          createSetReader(key.reader(), minKeySize),
          createSetSizer(key.writer()));
    } else if (shape instanceof Shape.TupleNode tuple) {
      final Serde[] elements = tuple.elements().stream()
          .map(e -> createSerdeChain(e, registry, named))
          .toArray(Serde[]::new);
      return createTupleSerde(elements, "TUPLE");
    } else if (shape instanceof Shape.ArrayNode array) {
      final Serde element = createSerdeChain(array.element(), registry, named);
      final Serde[] elements = new Serde[array.size()];
      Arrays.fill(elements, element);
      return createTupleSerde(elements, "ARRAY");
    } else if (shape instanceof Shape.NamedNode namedNode) {
      return createNamedReference(namedNode.name(), named);
    }
    throw new IllegalArgumentException("Unsupported shape: " + shape);
  }

  /// Named references resolve their target when first called so that a definition may refer to itself.
  /// Entering a named definition while writing, reading or sizing counts against the depth limit.
  static Serde createNamedReference(String name, Map<String, Serde> named) {
    return new Serde(
        (buffer, value) -> {
          buffer.nesting().enter(name);
          resolve(named, name).writer().write(buffer, value);
          buffer.nesting().exit();
        },
        buffer -> {
          buffer.enter(name);
          final Object result = resolve(named, name).reader().read(buffer);
          buffer.exit();
          return result;
        },
        (nesting, value) -> {
          nesting.enter(name);
          final int size = resolve(named, name).sizer().sizeOf(nesting, value);
          nesting.exit();
          return size;
        });
  }

  private static Serde resolve(Map<String, Serde> named, String name) {
    final Serde serde = named.get(name);
    if (serde == null) {
      throw new IllegalStateException("No serde found for type name: " + name);
    }
    return serde;
  }

  static Serde createDefinitionSerde(TypeDef def, Binding binding, Registry registry, Map<String, Serde> named) {
    if (def instanceof TypeDef.StructDef struct) {
      if (!(binding instanceof Binding.StructBinding structBinding)) {
        throw new IllegalArgumentException("Struct " + struct.name() + " needs a struct binding but got " + binding);
      }
      final Serde[] fields = struct.shapes().stream()
          .map(s -> createSerdeChain(s, registry, named))
          .toArray(Serde[]::new);
      return createStructSerde(struct.name(), fields, structBinding);
    } else if (def instanceof TypeDef.EnumDef enumDef) {
      if (!(binding instanceof Binding.EnumBinding enumBinding)) {
        throw new IllegalArgumentException("Enum " + enumDef.name() + " needs an enum binding but got " + binding);
      }
      final Map<Integer, Serde[]> variants = new HashMap<>();
      enumDef.variants().forEach((tag, variant) -> variants.put(tag, variant.shapes().stream()
          .map(s -> createSerdeChain(s, registry, named))
          .toArray(Serde[]::new)));
      return createEnumSerde(enumDef.name(), Map.copyOf(variants), enumBinding);
    }
    throw new IllegalArgumentException("Unsupported definition: " + def);
  }

  /// Products have no framing: the fields are written back to back in declaration order
  static Serde createStructSerde(String name, Serde[] fields, Binding.StructBinding binding) {
    final Writer writer = (buffer, value) -> {
      final Object[] values = binding.fields(value);
      checkArity(name, fields.length, values.length);
      LOGGER.finer(() -> "Writing struct " + name + " at position " + buffer.position());
      writeFields(buffer, fields, values);
    };
    final Reader reader = buffer -> {
      final int position = buffer.position();
      final Object[] values = readFields(buffer, fields);
      LOGGER.finer(() -> "Read struct " + name + " from position " + position + " to " + buffer.position());
      return binding.construct(values);
    };
    final Sizer sizer = (nesting, value) -> sizeFields(nesting, fields, binding.fields(value));
    return new Serde(writer, reader, sizer);
  }

  /// Sums are the variant tag as ULEB128 followed by the fields of that variant
  static Serde createEnumSerde(String name, Map<Integer, Serde[]> variants, Binding.EnumBinding binding) {
    final Writer writer = (buffer, value) -> {
      final int tag = binding.tag(value);
      final Serde[] fields = variants.get(tag);
      if (fields == null) {
        throw new IllegalArgumentException("Enum " + name + " has no variant with tag " + tag);
      }
      final Object[] values = binding.fields(value);
      checkArity(name + " variant " + tag, fields.length, values.length);
      LOGGER.finer(() -> "Writing enum " + name + " variant " + tag + " at position " + buffer.position());
      Uleb128.putInt(buffer, tag);
      writeFields(buffer, fields, values);
    };
    final Reader reader = buffer -> {
      final int position = buffer.position();
      final long tag = buffer.getVariantTag();
      final Serde[] fields = tag <= Integer.MAX_VALUE ? variants.get((int) tag) : null;
      if (fields == null) {
        throw buffer.error(UNKNOWN_VARIANT_TAG, position, "enum " + name + " has no variant with tag " + tag);
      }
      LOGGER.finer(() -> "Read enum " + name + " variant " + tag + " at position " + position);
      return binding.construct((int) tag, readFields(buffer, fields));
    };
    final Sizer sizer = (nesting, value) -> {
      final int tag = binding.tag(value);
      final Serde[] fields = variants.get(tag);
      if (fields == null) {
        throw new IllegalArgumentException("Enum " + name + " has no variant with tag " + tag);
      }
      return Uleb128.sizeOf(tag) + sizeFields(nesting, fields, binding.fields(value));
    };
    return new Serde(writer, reader, sizer);
  }

  /// Tuples and fixed size arrays are lists with exactly one element per field and no length prefix
  static Serde createTupleSerde(Serde[] elements, String kind) {
    final Writer writer = (buffer, value) -> {
      final List<?> list = expect(value, List.class, kind);
      checkArity(kind, elements.length, list.size());
      writeFields(buffer, elements, list.toArray());
    };
    final Reader reader = buffer -> List.of(readFields(buffer, elements));
    final Sizer sizer = (nesting, value) -> {
      final List<?> list = expect(value, List.class, kind);
      checkArity(kind, elements.length, list.size());
      return sizeFields(nesting, elements, list.toArray());
    };
    return new Serde(writer, reader, sizer);
  }

  private static void writeFields(WriteBuffer buffer, Serde[] fields, Object[] values) {
    for (int i = 0; i < fields.length; i++) {
      fields[i].writer().write(buffer, Objects.requireNonNull(values[i], "null is not a valid value"));
    }
  }

  private static Object[] readFields(ReadBuffer buffer, Serde[] fields) {
    final Object[] values = new Object[fields.length];
    for (int i = 0; i < fields.length; i++) {
      values[i] = fields[i].reader().read(buffer);
    }
    return values;
  }

  private static int sizeFields(Nesting nesting, Serde[] fields, Object[] values) {
    int size = 0;
    for (int i = 0; i < fields.length; i++) {
      size += fields[i].sizer().sizeOf(nesting, Objects.requireNonNull(values[i], "null is not a valid value"));
    }
    return size;
  }

  private static void checkArity(String what, int expected, int actual) {
    if (expected != actual) {
      throw new IllegalArgumentException(what + " expects " + expected + " fields but got " + actual);
    }
  }

  static Writer buildPrimitiveWriter(Shape.PrimitiveType type) {
    return switch (type) {
      case BOOL -> (buffer, value) -> buffer.put(expect(value, Boolean.class, type) ? (byte) 1 : (byte) 0);
      case U8, I8 -> (buffer, value) -> buffer.put(expect(value, Byte.class, type));
      case U16, I16 -> (buffer, value) -> buffer.putShort(expect(value, Short.class, type));
      case U32, I32 -> (buffer, value) -> buffer.putInt(expect(value, Integer.class, type));
      case U64, I64 -> (buffer, value) -> buffer.putLong(expect(value, Long.class, type));
      case U128 -> (buffer, value) -> write128(buffer, checkRange(expect(value, BigInteger.class, type), BigInteger.ZERO, MAX_U128, type));
      case I128 -> (buffer, value) -> write128(buffer, checkRange(expect(value, BigInteger.class, type), MIN_I128, MAX_I128, type));
      // raw bits so NaN payloads survive
      case F32 -> (buffer, value) -> buffer.putInt(Float.floatToRawIntBits(expect(value, Float.class, type)));
      case F64 -> (buffer, value) -> buffer.putLong(Double.doubleToRawLongBits(expect(value, Double.class, type)));
      case CHAR -> (buffer, value) -> buffer.putInt(codePointOf(value));
    };
  }

  static Reader buildPrimitiveReader(Shape.PrimitiveType type) {
    return switch (type) {
      case BOOL -> buffer -> {
        final int position = buffer.position();
        final byte b = buffer.get();
        if (b == 0) {
          return Boolean.FALSE;
        } else if (b == 1) {
          return Boolean.TRUE;
        }
        throw buffer.error(INVALID_BOOLEAN, position, "boolean byte must be 0 or 1 but was " + (b & 0xFF));
      };
      case U8, I8 -> ReadBuffer::get;
      case U16, I16 -> ReadBuffer::getShort;
      case U32, I32 -> ReadBuffer::getInt;
      case U64, I64 -> ReadBuffer::getLong;
      case U128 -> buffer -> {
        final long low = buffer.getLong();
        final long high = buffer.getLong();
        return unsigned(high).shiftLeft(64).or(unsigned(low));
      };
      case I128 -> buffer -> {
        final long low = buffer.getLong();
        final long high = buffer.getLong();
        return BigInteger.valueOf(high).shiftLeft(64).or(unsigned(low));
      };
      case F32 -> buffer -> Float.intBitsToFloat(buffer.getInt());
      case F64 -> buffer -> Double.longBitsToDouble(buffer.getLong());
      case CHAR -> buffer -> {
        final int position = buffer.position();
        final int codePoint = buffer.getInt();
        if (!isScalarValue(codePoint)) {
          throw buffer.error(INVALID_CHAR, position,
              "0x" + Integer.toHexString(codePoint) + " is not a Unicode scalar value");
        }
        return codePoint;
      };
    };
  }

  static Sizer buildPrimitiveSizer(Shape.PrimitiveType type) {
    final int width = type.width();
    return (nesting, value) -> width;
  }

  /// Low 64 bits then high 64 bits, each little-endian
  static void write128(WriteBuffer buffer, BigInteger value) {
    buffer.putLong(value.longValue());
    buffer.putLong(value.shiftRight(64).longValue());
  }

  static BigInteger unsigned(long bits) {
    final BigInteger value = BigInteger.valueOf(bits);
    return bits >= 0 ? value : value.add(TWO_64);
  }

  private static BigInteger checkRange(BigInteger value, BigInteger min, BigInteger max, Shape.PrimitiveType type) {
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw new IllegalArgumentException(type + " value out of range [" + min + ", " + max + "]: " + value);
    }
    return value;
  }

  static boolean isScalarValue(int codePoint) {
    return codePoint >= 0 && codePoint <= MAX_CODE_POINT
        && (codePoint < Character.MIN_SURROGATE || codePoint > Character.MAX_SURROGATE);
  }

  private static int codePointOf(Object value) {
    final int codePoint;
    if (value instanceof Character c) {
      codePoint = c;
    } else {
      codePoint = expect(value, Integer.class, Shape.PrimitiveType.CHAR);
    }
    if (!isScalarValue(codePoint)) {
      throw new IllegalArgumentException("CHAR value 0x" + Integer.toHexString(codePoint) + " is not a Unicode scalar value");
    }
    return codePoint;
  }

  static void writeString(WriteBuffer buffer, Object value) {
    final String string = expect(value, String.class, "STRING");
    // validates there are no unpaired surrogates so that getBytes cannot substitute
    final int length = utf8Length(string);
    Uleb128.putInt(buffer, length);
    buffer.putBytes(string.getBytes(StandardCharsets.UTF_8));
  }

  static Object readString(ReadBuffer buffer) {
    final int position = buffer.position();
    final int length = buffer.getLength();
    final byte[] bytes = buffer.getBytes(length);
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new PicklerException(INVALID_UTF8, position, "string of " + length + " bytes is not well formed UTF-8", e);
    }
  }

  /// Number of UTF-8 bytes the string encodes to
  /// @throws IllegalArgumentException if the string holds an unpaired surrogate
  static int utf8Length(String string) {
    int length = 0;
    for (int i = 0; i < string.length(); i++) {
      final char c = string.charAt(i);
      if (c < 0x80) {
        length += 1;
      } else if (c < 0x800) {
        length += 2;
      } else if (Character.isHighSurrogate(c) && i + 1 < string.length() && Character.isLowSurrogate(string.charAt(i + 1))) {
        length += 4;
        i++;
      } else if (Character.isSurrogate(c)) {
        throw new IllegalArgumentException("String has an unpaired surrogate at index " + i);
      } else {
        length += 3;
      }
    }
    return length;
  }

  static void writeBytes(WriteBuffer buffer, Object value) {
    final Bytes bytes = expect(value, Bytes.class, "BYTES");
    Uleb128.putInt(buffer, bytes.length());
    buffer.putBytes(bytes.unsafeArray());
  }

  static Object readBytes(ReadBuffer buffer) {
    final int length = buffer.getLength();
    return Bytes.wrap(buffer.getBytes(length));
  }

  static Writer createSeqWriter(Writer elementWriter) {
    return (buffer, value) -> {
      final List<?> list = expect(value, List.class, "SEQ");
      final int position = buffer.position();
      Uleb128.putInt(buffer, list.size());
      LOGGER.finer(() -> "Written sequence length " + list.size() + " at position " + position);
      for (Object element : list) {
        elementWriter.write(buffer, Objects.requireNonNull(element, "null is not a valid sequence element"));
      }
    };
  }

  /// Elements that can occupy no bytes are not bounded by the remaining input. Such a shape has only
  /// one value, so once the first element is seen to take no bytes the result is that element repeated.
  static Reader createSeqReader(Reader elementReader, int minElementSize) {
    return buffer -> {
      final int length = readCount(buffer, minElementSize);
      final List<Object> list = new ArrayList<>(Math.min(length, buffer.remaining()));
      if (minElementSize == 0 && length > 0) {
        final int start = buffer.position();
        final Object first = elementReader.read(buffer);
        if (buffer.position() == start) {
          LOGGER.finer(() -> "Read sequence of " + length + " zero width elements at position " + start);
          return Collections.nCopies(length, first);
        }
        list.add(first);
      }
      for (int i = list.size(); i < length; i++) {
        list.add(elementReader.read(buffer));
      }
      return Collections.unmodifiableList(list);
    };
  }

  static Sizer createSeqSizer(Sizer elementSizer) {
    return (nesting, value) -> {
      final List<?> list = expect(value, List.class, "SEQ");
      int size = Uleb128.sizeOf(list.size());
      for (Object element : list) {
        size += elementSizer.sizeOf(nesting, Objects.requireNonNull(element, "null is not a valid sequence element"));
      }
      return size;
    };
  }

  /// Read a length prefix and fail early when the remaining input cannot possibly hold that many elements
  private static int readCount(ReadBuffer buffer, int minElementSize) {
    final int position = buffer.position();
    final int length = buffer.getLength();
    if (minElementSize > 0 && (long) length * minElementSize > buffer.remaining()) {
      throw buffer.error(UNEXPECTED_END_OF_INPUT, position, "length " + length + " needs at least " +
          (long) length * minElementSize + " bytes but only " + buffer.remaining() + " remain");
    }
    return length;
  }

  static Writer createOptionWriter(Writer valueWriter) {
    return (buffer, value) -> {
      final Optional<?> optional = expect(value, Optional.class, "OPTION");
      if (optional.isEmpty()) {
        buffer.put(OPTION_NONE);
      } else {
        buffer.put(OPTION_SOME);
        valueWriter.write(buffer, optional.get());
      }
    };
  }

  static Reader createOptionReader(Reader valueReader) {
    return buffer -> {
      final int position = buffer.position();
      final byte tag = buffer.get();
      if (tag == OPTION_NONE) {
        return Optional.empty();
      } else if (tag == OPTION_SOME) {
        return Optional.of(valueReader.read(buffer));
      }
      throw buffer.error(INVALID_OPTION_TAG, position, "option tag must be 0 or 1 but was " + (tag & 0xFF));
    };
  }

  static Sizer createOptionSizer(Sizer valueSizer) {
    return (nesting, value) -> {
      final Optional<?> optional = expect(value, Optional.class, "OPTION");
      return 1 + optional.map(wrapped -> valueSizer.sizeOf(nesting, wrapped)).orElse(0);
    };
  }

  /// An entry with its encoded key and encoded value, ordered by the unsigned bytes of the key
  record EncodedEntry(Object key, Object value, byte[] keyBytes, byte[] valueBytes) implements Comparable<EncodedEntry> {
    @Override
    public int compareTo(EncodedEntry other) {
      return Arrays.compareUnsigned(keyBytes, other.keyBytes);
    }
  }

  /// Encode every key, sort by encoded key bytes, then emit. The iteration order of the source map is irrelevant.
  /// Values are only encoded when a value writer is given. Scratch buffers share the caller's nesting depth.
  /// @throws IllegalArgumentException if two distinct keys have the same encoding
  static List<EncodedEntry> canonicalEntries(Map<?, ?> map, Writer keyWriter, Writer valueWriter, Nesting nesting) {
    final List<EncodedEntry> entries = new ArrayList<>(map.size());
    map.forEach((key, value) -> {
      Objects.requireNonNull(key, "null is not a valid map key");
      Objects.requireNonNull(value, "null is not a valid map value");
      final WriteBuffer keyBuffer = WriteBuffer.growable(16, nesting);
      keyWriter.write(keyBuffer, key);
      final byte[] valueBytes;
      if (valueWriter == null) {
        valueBytes = null;
      } else {
        final WriteBuffer valueBuffer = WriteBuffer.growable(WriteBuffer.DEFAULT_CAPACITY, nesting);
        valueWriter.write(valueBuffer, value);
        valueBytes = valueBuffer.toByteArray();
      }
      entries.add(new EncodedEntry(key, value, keyBuffer.toByteArray(), valueBytes));
    });
    Collections.sort(entries);
    for (int i = 1; i < entries.size(); i++) {
      if (entries.get(i - 1).compareTo(entries.get(i)) == 0) {
        throw new IllegalArgumentException("Distinct keys " + entries.get(i - 1).key() + " and " +
            entries.get(i).key() + " have the same encoding");
      }
    }
    return entries;
  }

  static Writer createMapWriter(Writer keyWriter, Writer valueWriter) {
    return (buffer, value) -> {
      final Map<?, ?> map = expect(value, Map.class, "MAP");
      final List<EncodedEntry> entries = canonicalEntries(map, keyWriter, valueWriter, buffer.nesting());
      final int position = buffer.position();
      Uleb128.putInt(buffer, entries.size());
      LOGGER.finer(() -> "Written map size " + entries.size() + " at position " + position);
      for (EncodedEntry entry : entries) {
        buffer.putBytes(entry.keyBytes());
        buffer.putBytes(entry.valueBytes());
      }
    };
  }

  static Writer createSetWriter(Writer keyWriter) {
    return (buffer, value) -> {
      final List<EncodedEntry> entries = canonicalEntries(setAsMap(value), keyWriter, null, buffer.nesting());
      Uleb128.putInt(buffer, entries.size());
      for (EncodedEntry entry : entries) {
        buffer.putBytes(entry.keyBytes());
      }
    };
  }

  /// Check that the key just read sorts strictly after the previous one
  private static byte[] checkKeyOrder(ReadBuffer buffer, byte[] previous, int start) {
    final byte[] current = buffer.copyRange(start, buffer.position());
    if (previous != null) {
      final int cmp = Arrays.compareUnsigned(previous, current);
      if (cmp == 0) {
        throw buffer.error(DUPLICATE_KEY, start, "key bytes repeat the previous key");
      } else if (cmp > 0) {
        throw buffer.error(MAP_NOT_CANONICALLY_ORDERED, start, "key bytes sort before the previous key");
      }
    }
    return current;
  }

  static Reader createMapReader(Reader keyReader, Reader valueReader, int minEntrySize) {
    return buffer -> {
      final int size = readCount(buffer, minEntrySize);
      final Map<Object, Object> map = new LinkedHashMap<>(Math.min(size, buffer.remaining()));
      byte[] previous = null;
      for (int i = 0; i < size; i++) {
        final int start = buffer.position();
        final Object key = keyReader.read(buffer);
        previous = checkKeyOrder(buffer, previous, start);
        if (map.containsKey(key)) {
          throw equalDecodedKeys(buffer, start, key);
        }
        map.put(key, valueReader.read(buffer));
      }
      return Collections.unmodifiableMap(map);
    };
  }

  static Reader createSetReader(Reader keyReader, int minKeySize) {
    return buffer -> {
      final int size = readCount(buffer, minKeySize);
      final Set<Object> set = new LinkedHashSet<>(Math.min(size, buffer.remaining()));
      byte[] previous = null;
      for (int i = 0; i < size; i++) {
        final int start = buffer.position();
        final Object key = keyReader.read(buffer);
        previous = checkKeyOrder(buffer, previous, start);
        if (!set.add(key)) {
          throw equalDecodedKeys(buffer, start, key);
        }
      }
      return Collections.unmodifiableSet(set);
    };
  }

  /// Key bytes that strictly ascend can still decode to Java values that are equal, such as two F32 NaNs
  /// with different payloads. A Java map or set cannot hold both so the input is refused.
  private static PicklerException equalDecodedKeys(ReadBuffer buffer, int start, Object key) {
    return buffer.error(DUPLICATE_KEY, start, "key " + key +
        " has different bytes from an earlier key but decodes to an equal Java value");
  }

  /// Keys are encoded rather than sized so that distinct keys sharing an encoding fail as they do when writing
  static Sizer createMapSizer(Writer keyWriter, Sizer valueSizer) {
    return (nesting, value) -> {
      final Map<?, ?> map = expect(value, Map.class, "MAP");
      final List<EncodedEntry> entries = canonicalEntries(map, keyWriter, null, nesting);
      int size = Uleb128.sizeOf(entries.size());
      for (EncodedEntry entry : entries) {
        size += entry.keyBytes().length + valueSizer.sizeOf(nesting, entry.value());
      }
      return size;
    };
  }

  static Sizer createSetSizer(Writer keyWriter) {
    return (nesting, value) -> {
      final List<EncodedEntry> entries = canonicalEntries(setAsMap(value), keyWriter, null, nesting);
      int size = Uleb128.sizeOf(entries.size());
      for (EncodedEntry entry : entries) {
        size += entry.keyBytes().length;
      }
      return size;
    };
  }

  private static Map<Object, Object> setAsMap(Object value) {
    final Set<?> set = expect(value, Set.class, "SET");
    final Map<Object, Object> asMap = new LinkedHashMap<>();
    set.forEach(key -> asMap.put(Objects.requireNonNull(key, "null is not a valid set element"), Unit.UNIT));
    return asMap;
  }

  /// Smallest number of bytes any value of the shape can encode to. Used to reject length prefixes
  /// that the remaining input could never satisfy before allocating anything.
  static int minSize(Shape shape, Registry registry, Set<String> visiting) {
    if (shape instanceof Shape.PrimitiveNode primitive) {
      return primitive.type().width();
    } else if (shape instanceof Shape.UnitNode) {
      return 0;
    } else if (shape instanceof Shape.TupleNode tuple) {
      return minSize(tuple.elements(), registry, visiting);
    } else if (shape instanceof Shape.ArrayNode array) {
      return (int) Math.min(Integer.MAX_VALUE, (long) array.size() * minSize(array.element(), registry, visiting));
    } else if (shape instanceof Shape.NamedNode namedNode) {
      if (!visiting.add(namedNode.name())) {
        // a cycle contributes nothing to the lower bound
        return 0;
      }
      final TypeDef def = registry.get(namedNode.name());
      final int size;
      if (def instanceof TypeDef.StructDef struct) {
        size = minSize(struct.shapes(), registry, visiting);
      } else {
        // a tag is at least one byte
        size = 1;
      }
      visiting.remove(namedNode.name());
      return size;
    }
    // strings, bytes, sequences, maps and sets need their length prefix, options their tag byte
    return 1;
  }

  /// Lower bound of shapes written back to back, saturating at [Integer#MAX_VALUE]
  static int minSize(List<Shape> shapes, Registry registry, Set<String> visiting) {
    final long sum = shapes.stream().mapToLong(s -> minSize(s, registry, visiting)).sum();
    return (int) Math.min(Integer.MAX_VALUE, sum);
  }

  /// Check the Java type of a value before writing it
  /// @throws IllegalArgumentException with the expected and actual types
  static <T> T expect(Object value, Class<T> type, Object what) {
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("Expected " + type.getSimpleName() + " for " + what + " but got " +
          (value == null ? "null" : value.getClass().getName()));
    }
    return type.cast(value);
  }
}
