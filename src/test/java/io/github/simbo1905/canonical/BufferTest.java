// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.canonical;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static io.github.simbo1905.canonical.PicklerAssertions.assertFails;
import static io.github.simbo1905.canonical.PicklerAssertions.hex;
import static io.github.simbo1905.canonical.PicklerException.Kind.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferTest {

  @Test
  void growableBufferDoublesAsNeeded() {
    final WriteBuffer buffer = WriteBuffer.growable(1);
    for (long i = 0; i < 100; i++) {
      buffer.putLong(i);
    }
    final byte[] bytes = buffer.toByteArray();
    assertThat(bytes).hasSize(800);
    assertThat(bytes[8]).isEqualTo((byte) 1);
    assertThat(bytes[799]).isZero();
  }

  @Test
  void writesAreLittleEndian() {
    final WriteBuffer buffer = WriteBuffer.growable();
    buffer.putShort((short) 0x0102).putInt(0x03040506).put((byte) 7);
    assertThat(hex(buffer.toByteArray())).isEqualTo("0201" + "06050403" + "07");
  }

  @Test
  void wrappedBufferOnlyMovesOnCommit() {
    final ByteBuffer target = ByteBuffer.allocate(4);
    target.position(1);
    final WriteBuffer buffer = WriteBuffer.wrap(target);
    buffer.putShort((short) 1);
    assertThat(target.position()).isEqualTo(1);
    assertThat(buffer.commit()).isEqualTo(2);
    assertThat(target.position()).isEqualTo(3);
  }

  @Test
  void wrappedBufferIsExhausted() {
    final WriteBuffer buffer = WriteBuffer.wrap(ByteBuffer.allocate(3));
    buffer.putShort((short) 1);
    assertFails(() -> buffer.putShort((short) 2), SINK_EXHAUSTED, 2);
  }

  @Test
  void readOnlyTargetIsRejected() {
    assertThatThrownBy(() -> WriteBuffer.wrap(ByteBuffer.allocate(4).asReadOnlyBuffer()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void readsAreBoundsChecked() {
    final ReadBuffer buffer = ReadBuffer.wrap(hex("0102030405"), PicklerConfig.DEFAULT);
    assertThat(buffer.getInt()).isEqualTo(0x04030201);
    assertFails(buffer::getShort, UNEXPECTED_END_OF_INPUT, 4);
    assertThat(buffer.get()).isEqualTo((byte) 5);
    assertThat(buffer.hasRemaining()).isFalse();
    assertThat(buffer.copyRange(1, 3)).containsExactly(2, 3);
  }

  @Test
  void readerStartsAtTheSourcePosition() {
    final ByteBuffer source = ByteBuffer.wrap(hex("ff0102"));
    source.position(1);
    final ReadBuffer buffer = ReadBuffer.wrap(source, PicklerConfig.DEFAULT);
    assertThat(buffer.position()).isZero();
    assertThat(buffer.getShort()).isEqualTo((short) 0x0201);
    assertThat(source.position()).isEqualTo(1);
  }

  @Test
  void depthIsLimited() {
    final ReadBuffer buffer = ReadBuffer.wrap(new byte[0], PicklerConfig.DEFAULT.withMaxDepth(2));
    buffer.enter("A");
    buffer.enter("B");
    assertThat(buffer.depth()).isEqualTo(2);
    assertFails(() -> buffer.enter("C"), RECURSION_LIMIT_EXCEEDED, 0);
    buffer.exit();
    buffer.exit();
    buffer.exit();
    assertThat(buffer.depth()).isZero();
  }

  @Test
  void writeDepthIsLimited() {
    final WriteBuffer buffer = WriteBuffer.growable(8, new Nesting(2));
    buffer.nesting().enter("A");
    buffer.nesting().enter("B");
    assertThatThrownBy(() -> buffer.nesting().enter("C"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("C exceeds the maximum depth of 2");
    assertThat(buffer.nesting().depth()).isEqualTo(2);
    buffer.nesting().exit();
    buffer.nesting().exit();
    assertThat(buffer.nesting().depth()).isZero();
  }
}
