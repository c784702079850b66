// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static io.github.simbo1905.canonical.PicklerAssertions.assertFails;
import static io.github.simbo1905.canonical.PicklerAssertions.hex;
import static io.github.simbo1905.canonical.PicklerException.Kind.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrimitiveTypesTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static Pickler<Object> pickler(Shape shape) {
    return Pickler.forShape(shape, Registry.EMPTY);
  }

  static void assertEncodes(Shape shape, Object value, String expected) {
    final Pickler<Object> pickler = pickler(shape);
    final byte[] bytes = pickler.serialize(value);
    assertThat(hex(bytes)).isEqualTo(expected);
    assertThat(pickler.sizeOf(value)).isEqualTo(bytes.length);
    assertThat(pickler.deserialize(bytes)).isEqualTo(value);
  }

  @Test
  void unsignedMaxIsAllOnes() {
    assertEncodes(Shape.U64, -1L, "ffffffffffffffff");
    assertEncodes(Shape.U8, (byte) 0xFF, "ff");
    assertEncodes(Shape.U16, (short) 300, "2c01");
    assertEncodes(Shape.U32, 3_000_000, "c0c62d00");
  }

  @Test
  void signedIntegersAreTwosComplementLittleEndian() {
    assertEncodes(Shape.I8, (byte) -128, "80");
    assertEncodes(Shape.I16, (short) -400, "70fe");
    assertEncodes(Shape.I32, -30_000_000, "803c36fe");
    assertEncodes(Shape.I64, Long.MAX_VALUE, "ffffffffffffff7f");
  }

  @Test
  void booleansAreZeroOrOne() {
    assertEncodes(Shape.BOOL, true, "01");
    assertEncodes(Shape.BOOL, false, "00");
    assertFails(() -> pickler(Shape.BOOL).deserialize(hex("02")), INVALID_BOOLEAN, 0);
    assertFails(() -> pickler(Shape.BOOL).deserialize(hex("ff")), INVALID_BOOLEAN, 0);
  }

  @Test
  void wideIntegersAreLowHalfThenHighHalf() {
    assertEncodes(Shape.U128, BigInteger.ONE.shiftLeft(64), "0000000000000000" + "0100000000000000");
    assertEncodes(Shape.U128, Companion.MAX_U128, "ff".repeat(16));
    assertEncodes(Shape.U128, BigInteger.ZERO, "00".repeat(16));
    assertEncodes(Shape.I128, Companion.MIN_I128, "00".repeat(8) + "0000000000000080");
    assertEncodes(Shape.I128, Companion.MAX_I128, "ff".repeat(15) + "7f");
    assertEncodes(Shape.I128, BigInteger.ONE.negate(), "ff".repeat(16));
    assertEncodes(Shape.I128, BigInteger.valueOf(-2), "fe" + "ff".repeat(15));
  }

  @Test
  void wideIntegersOutOfRangeAreRejected() {
    assertThatThrownBy(() -> pickler(Shape.U128).serialize(BigInteger.ONE.negate()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> pickler(Shape.U128).serialize(Companion.MAX_U128.add(BigInteger.ONE)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> pickler(Shape.I128).serialize(BigInteger.ONE.shiftLeft(127)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void floatsKeepTheirExactBits() {
    final Pickler<Object> f32 = pickler(Shape.F32);
    assertThat(f32.deserialize(f32.serialize(623929.125f))).isEqualTo(623929.125f);
    assertEncodes(Shape.F32, 1.0f, "0000803f");
    assertEncodes(Shape.F64, -2.5d, "00000000000004c0");

    final float nan = Float.intBitsToFloat(0x7fc00123);
    assertThat(hex(f32.serialize(nan))).isEqualTo("2301c07f");
    assertThat(Float.floatToRawIntBits((Float) f32.deserialize(hex("2301c07f")))).isEqualTo(0x7fc00123);

    final Pickler<Object> f64 = pickler(Shape.F64);
    final byte[] negativeZero = f64.serialize(-0.0d);
    assertThat(hex(negativeZero)).isEqualTo("0000000000000080");
    assertThat(Double.doubleToRawLongBits((Double) f64.deserialize(negativeZero))).isEqualTo(Long.MIN_VALUE);
  }

  @Test
  void charsAreCodePoints() {
    assertEncodes(Shape.CHAR, 20, "14000000");
    assertEncodes(Shape.CHAR, 0x1F600, "00f60100");
    final Pickler<Object> chars = pickler(Shape.CHAR);
    assertThat(hex(chars.serialize('A'))).isEqualTo("41000000");
    assertThat(chars.deserialize(hex("41000000"))).isEqualTo(65);
  }

  @Test
  void surrogatesAndOutOfRangeCodePointsAreInvalidChars() {
    final Pickler<Object> chars = pickler(Shape.CHAR);
    assertFails(() -> chars.deserialize(hex("00d80000")), INVALID_CHAR, 0);
    assertFails(() -> chars.deserialize(hex("00001100")), INVALID_CHAR, 0);
    assertFails(() -> chars.deserialize(hex("ffffffff")), INVALID_CHAR, 0);
    assertThatThrownBy(() -> chars.serialize(0xDFFF)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> chars.serialize('\uD800')).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void wrongJavaTypeIsRejectedOnWrite() {
    assertThatThrownBy(() -> pickler(Shape.I32).serialize(5L))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Integer");
    assertThatThrownBy(() -> pickler(Shape.BOOL).serialize(1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> pickler(Shape.I64).serialize(null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void truncatedAndTrailingInputIsRejected() {
    assertFails(() -> pickler(Shape.I64).deserialize(hex("010203")), UNEXPECTED_END_OF_INPUT, 0);
    assertFails(() -> pickler(Shape.U16).deserialize(new byte[0]), UNEXPECTED_END_OF_INPUT, 0);
    assertFails(() -> pickler(Shape.BOOL).deserialize(hex("0100")), TRAILING_DATA, 1);
  }

  @Test
  void unitEncodesToNothing() {
    assertEncodes(Shape.UNIT, Unit.UNIT, "");
    assertFails(() -> pickler(Shape.UNIT).deserialize(hex("00")), TRAILING_DATA, 0);
  }
}
