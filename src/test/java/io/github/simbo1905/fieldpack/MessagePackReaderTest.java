// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static io.github.simbo1905.fieldpack.MessagePackWriterTest.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MessagePackReaderTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static MessagePackReader reader(int... values) {
    return MessagePackReader.of(ByteBuffer.wrap(bytes(values)));
  }

  @Test
  void peekDoesNotConsume() {
    final MessagePackReader in = reader(0xa2, 'h', 'i');
    final WireTag tag = in.peekTag();
    assertThat(tag.type()).isEqualTo(TypeTag.STRING);
    assertThat(tag.length()).isEqualTo(2);
    assertThat(in.position()).isZero();
    assertThat(in.readString()).isEqualTo("hi");
    assertThat(in.position()).isEqualTo(3);
  }

  @Test
  void classifiesIntegerFamilies() {
    assertThat(reader(0x05).peekTag().type()).isEqualTo(TypeTag.UINT);
    assertThat(reader(0xcc, 0xff).peekTag().type()).isEqualTo(TypeTag.UINT);
    assertThat(reader(0xff).peekTag().type()).isEqualTo(TypeTag.INTEGER);
    assertThat(reader(0xd0, 0x05).peekTag().type()).isEqualTo(TypeTag.INTEGER);
  }

  @Test
  void integersReadFromEitherFamily() {
    assertThat(reader(0xd0, 0x05).readUInt()).isEqualTo(5);
    assertThat(reader(0x05).readInt()).isEqualTo(5);
    assertThat(reader(0xff).readInt()).isEqualTo(-1);
    assertThat(reader(0xd1, 0xff, 0x00).readInt()).isEqualTo(-256);
    assertThat(reader(0xcd, 0xff, 0x00).readUInt()).isEqualTo(0xff00);
  }

  @Test
  void floatsAreStrict() {
    assertThat(reader(0xca, 0x3f, 0xc0, 0, 0).readFloat32()).isEqualTo(1.5f);
    final MessagePackReader in = reader(0xca, 0x3f, 0xc0, 0, 0);
    assertThatThrownBy(in::readFloat64)
        .isInstanceOf(DecodeException.class)
        .hasMessageStartingWith(ErrorCode.TYPE_MISMATCH.name());
    assertThat(in.position()).isZero();
  }

  @Test
  void mismatchLeavesPositionForRetry() {
    final MessagePackReader in = reader(0xc3);
    assertThatThrownBy(in::readString).isInstanceOf(DecodeException.class);
    assertThat(in.position()).isZero();
    assertThat(in.readBool()).isTrue();
  }

  @Test
  void boundedStringStopsAtCodePointBoundary() {
    // "aé" is 61 c3 a9; a bound of 2 would split the é
    final MessagePackReader in = reader(0xa3, 'a', 0xc3, 0xa9, 0xc0);
    assertThat(in.readString(2)).isEqualTo("a");
    in.readNil();
    assertThat(reader(0xa3, 'a', 'b', 'c').readString(2)).isEqualTo("ab");
    assertThat(reader(0xa3, 'a', 'b', 'c').readString(10)).isEqualTo("abc");
  }

  @Test
  void discardSkipsNestedValues() {
    // {"a": [1, {"b": nil}], "c": 1.5f} then true
    final MessagePackReader in = reader(
        0x82,
        0xa1, 'a', 0x92, 0x01, 0x81, 0xa1, 'b', 0xc0,
        0xa1, 'c', 0xca, 0x3f, 0xc0, 0, 0,
        0xc3);
    in.discard();
    assertThat(in.readBool()).isTrue();
  }

  @Test
  void discardSkipsExtensionAndBinary() {
    final MessagePackReader in = reader(0xd4, 0x2a, 0x01, 0xc4, 0x02, 9, 9, 0xc2);
    in.discard();
    in.discard();
    assertThat(in.readBool()).isFalse();
  }

  @Test
  void truncatedPayloadFails() {
    assertThatThrownBy(() -> reader(0xa3, 'a').readString())
        .isInstanceOf(DecodeException.class)
        .extracting(e -> ((DecodeException) e).code())
        .isEqualTo(ErrorCode.TRUNCATED_INPUT);
    assertThatThrownBy(() -> reader(0xcd, 0x01).readUInt())
        .isInstanceOf(DecodeException.class)
        .extracting(e -> ((DecodeException) e).code())
        .isEqualTo(ErrorCode.TRUNCATED_INPUT);
    assertThatThrownBy(() -> reader().peekTag())
        .isInstanceOf(DecodeException.class)
        .extracting(e -> ((DecodeException) e).code())
        .isEqualTo(ErrorCode.TRUNCATED_INPUT);
  }

  @Test
  void hugeCountIsRejectedBeforeAllocating() {
    assertThatThrownBy(() -> reader(0xdd, 0x7f, 0xff, 0xff, 0xff).readArrayHeader())
        .isInstanceOf(DecodeException.class)
        .extracting(e -> ((DecodeException) e).code())
        .isEqualTo(ErrorCode.TRUNCATED_INPUT);
  }

  @Test
  void neverUsedFormatIsAMismatch() {
    assertThatThrownBy(() -> reader(0xc1).peekTag())
        .isInstanceOf(DecodeException.class)
        .extracting(e -> ((DecodeException) e).code())
        .isEqualTo(ErrorCode.TYPE_MISMATCH);
  }

  @Test
  void extensionHeaderCarriesSubtype() {
    final MessagePackReader in = reader(0xc7, 0x03, 0x2a, 1, 2, 3);
    final WireTag tag = in.readExtensionHeader();
    assertThat(tag.length()).isEqualTo(3);
    assertThat(tag.extensionType()).isEqualTo((byte) 0x2a);
    final byte[] payload = new byte[3];
    in.readBytes(payload, 0, 3);
    assertThat(payload).containsExactly(1, 2, 3);
  }
}
