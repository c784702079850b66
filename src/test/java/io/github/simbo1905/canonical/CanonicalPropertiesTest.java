// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

/// Canonical encoding properties over generated values
class CanonicalPropertiesTest {

  final Pickler<Object> longSet = Pickler.forShape(Shape.set(Shape.U64), Registry.EMPTY);
  final Pickler<Object> stringMap = Pickler.forShape(Shape.map(Shape.STRING, Shape.I32), Registry.EMPTY);
  final Pickler<Object> strings = Pickler.forShape(Shape.STRING, Registry.EMPTY);

  @Property
  void setBytesDoNotDependOnInsertionOrder(@ForAll @Size(max = 30) List<Long> values) {
    final Set<Object> forwards = new LinkedHashSet<>(values);
    final List<Long> reversed = new ArrayList<>(values);
    Collections.reverse(reversed);
    final Set<Object> backwards = new LinkedHashSet<>(reversed);

    final byte[] bytes = longSet.serialize(forwards);
    assertThat(longSet.serialize(backwards)).isEqualTo(bytes);
    assertThat(longSet.sizeOf(forwards)).isEqualTo(bytes.length);
    assertThat(longSet.deserialize(bytes)).isEqualTo(forwards);
  }

  @Property
  void mapRoundTripIsStable(@ForAll("textMaps") Map<String, Integer> map) {
    final byte[] bytes = stringMap.serialize(map);
    final Object back = stringMap.deserialize(bytes);
    assertThat(back).isEqualTo(map);
    assertThat(stringMap.serialize(back)).isEqualTo(bytes);
  }

  @Property
  void stringsRoundTripAndSizeMatches(@ForAll("texts") String text) {
    final byte[] bytes = strings.serialize(text);
    assertThat(strings.sizeOf(text)).isEqualTo(bytes.length);
    assertThat(strings.deserialize(bytes)).isEqualTo(text);
  }

  @Property
  void uleb128RoundTripsEveryNonNegativeInt(@ForAll @IntRange(min = 0) int value) {
    final WriteBuffer buffer = WriteBuffer.growable();
    final int written = Uleb128.putInt(buffer, value);
    final ReadBuffer reader = ReadBuffer.wrap(buffer.toByteArray(), PicklerConfig.DEFAULT);
    assertThat(Uleb128.getU32(reader)).isEqualTo(value);
    assertThat(reader.position()).isEqualTo(written);
  }

  @Property
  void unsignedLongsKeepTheirBits(@ForAll long value) {
    final Pickler<Object> u64 = Pickler.forShape(Shape.U64, Registry.EMPTY);
    assertThat(u64.deserialize(u64.serialize(value))).isEqualTo(value);
  }

  @Provide
  Arbitrary<Map<String, Integer>> textMaps() {
    return Arbitraries.maps(texts(), Arbitraries.integers()).ofMaxSize(20);
  }

  @Provide
  Arbitrary<String> texts() {
    return Arbitraries.strings()
        .withCharRange('a', 'z')
        .withChars('é', 'ß', '€', '中')
        .ofMaxLength(12);
  }
}
