// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static io.github.simbo1905.canonical.PicklerAssertions.assertFails;
import static io.github.simbo1905.canonical.PicklerAssertions.hex;
import static io.github.simbo1905.canonical.PicklerException.Kind.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Uleb128Test {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @ParameterizedTest
  @CsvSource({
      "0, 00",
      "1, 01",
      "127, 7f",
      "128, 8001",
      "300, ac02",
      "16384, 808001",
      "2147483647, ffffffff07"
  })
  void writesShortestForm(int value, String expected) {
    final WriteBuffer buffer = WriteBuffer.growable();
    final int written = Uleb128.putInt(buffer, value);
    assertThat(hex(buffer.toByteArray())).isEqualTo(expected);
    assertThat(written).isEqualTo(expected.length() / 2);
    assertThat(Uleb128.sizeOf(value)).isEqualTo(written);
  }

  @ParameterizedTest
  @CsvSource({
      "00, 0",
      "7f, 127",
      "8001, 128",
      "ac02, 300",
      "ffffffff0f, 4294967295"
  })
  void readsCanonicalValues(String bytes, long expected) {
    final ReadBuffer buffer = ReadBuffer.wrap(hex(bytes), PicklerConfig.DEFAULT);
    assertThat(Uleb128.getU32(buffer)).isEqualTo(expected);
    assertThat(buffer.hasRemaining()).isFalse();
  }

  @Test
  void rejectsNegativeValues() {
    assertThatThrownBy(() -> Uleb128.putInt(WriteBuffer.growable(), -1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Uleb128.sizeOf(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsRedundantTrailingZeroGroup() {
    assertFails(() -> Uleb128.getU32(ReadBuffer.wrap(hex("8000"), PicklerConfig.DEFAULT)), NON_CANONICAL_LENGTH, 0);
    assertFails(() -> Uleb128.getU32(ReadBuffer.wrap(hex("ff8000"), PicklerConfig.DEFAULT)), NON_CANONICAL_LENGTH, 0);
  }

  @Test
  void rejectsValuesWiderThan32Bits() {
    assertFails(() -> Uleb128.getU32(ReadBuffer.wrap(hex("ffffffff1f"), PicklerConfig.DEFAULT)), LENGTH_OVERFLOW, 0);
    assertFails(() -> Uleb128.getU32(ReadBuffer.wrap(hex("808080808001"), PicklerConfig.DEFAULT)), LENGTH_OVERFLOW, 0);
  }

  @Test
  void truncatedInputIsEndOfInput() {
    assertFails(() -> Uleb128.getU32(ReadBuffer.wrap(hex("80"), PicklerConfig.DEFAULT)), UNEXPECTED_END_OF_INPUT, 1);
    assertFails(() -> Uleb128.getU32(ReadBuffer.wrap(new byte[0], PicklerConfig.DEFAULT)), UNEXPECTED_END_OF_INPUT, 0);
  }

  @Test
  void lengthPrefixIsCheckedAgainstConfiguredMaximum() {
    final PicklerConfig config = PicklerConfig.DEFAULT.withMaxLength(10);
    assertThat(ReadBuffer.wrap(hex("0a"), config).getLength()).isEqualTo(10);
    assertFails(() -> ReadBuffer.wrap(hex("0b"), config).getLength(), LENGTH_OVERFLOW, 0);
    // a u32 above Integer.MAX_VALUE can never be a Java length
    assertFails(() -> ReadBuffer.wrap(hex("ffffffff0f"), PicklerConfig.DEFAULT).getLength(), LENGTH_OVERFLOW, 0);
  }
}
