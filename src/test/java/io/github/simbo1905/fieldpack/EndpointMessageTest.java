// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.fieldpack.model.EndpointMessage;
import io.github.simbo1905.fieldpack.model.Io;
import io.github.simbo1905.fieldpack.model.IoData;
import io.github.simbo1905.fieldpack.model.IoError;
import io.github.simbo1905.fieldpack.model.IoGroup;
import io.github.simbo1905.fieldpack.model.IoStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// A realistic nested message: composites inside lists inside composites, a variant member and a status extension.
public class EndpointMessageTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static EndpointMessage sample() {
    final IoGroup group = new IoGroup();
    group.setName("Group1");
    group.setTimeRecorded(1622547800L);
    group.setFail(false);
    group.setIos(List.of(new Io("IO1", new IoData.Flag(true)), new Io("IO2", new IoData.Reading(200.0))));
    group.setErrors(List.of(new IoError("Error1", "Type1", "Error message 1")));

    final EndpointMessage message = new EndpointMessage();
    message.setEndpointId("Endpoint123");
    message.setCurrentTime(1622547800L);
    message.setIoGroups(List.of(group));
    return message;
  }

  @Test
  void messageRoundTripsThroughFixedBuffer() {
    final EndpointMessage message = sample();
    final ByteBuffer buffer = ByteBuffer.allocate(1024);

    final int written = MessagePack.encodeToBuffer(message, buffer);
    buffer.flip();
    final EndpointMessage restored = new EndpointMessage();
    MessagePack.decodeFromBuffer(buffer, restored);

    assertThat(written).isEqualTo(MessagePack.forSchema(EndpointMessage.SCHEMA).sizeOf(message));
    assertThat(restored).isEqualTo(message);
    assertThat(restored.getIoGroups().get(0).getIos())
        .extracting(Io::getData)
        .containsExactly(new IoData.Flag(true), new IoData.Reading(200.0));
  }

  @Test
  void statusTravelsAsOneByteExtension() {
    final EndpointMessage message = sample();
    message.getIoGroups().get(0).setStatus(IoStatus.WARN);

    final byte[] encoded = MessagePack.forSchema(EndpointMessage.SCHEMA).toByteArray(message);

    // "Status" key then fixext1 of subtype 0x2a holding WARN
    assertThat(HexFormat.of().formatHex(encoded)).contains("a6537461747573" + "d42a02");
    final EndpointMessage restored = MessagePack.forSchema(EndpointMessage.SCHEMA).decode(ByteBuffer.wrap(encoded));
    assertThat(restored.getIoGroups().get(0).getStatus()).isEqualTo(IoStatus.WARN);
  }

  @Test
  void defaultStatusIsClear() {
    assertThat(new IoGroup().getStatus()).isEqualTo(IoStatus.CLEAR);
    assertThat(new IoGroup().getStatusExtension().type()).isEqualTo((byte) IoStatus.EXTENSION_TYPE);
  }

  @Test
  void timesAreUnsignedOnTheWire() {
    final EndpointMessage message = sample();
    message.setCurrentTime(-1L);

    final byte[] encoded = MessagePack.forSchema(EndpointMessage.SCHEMA).toByteArray(message);

    assertThat(HexFormat.of().formatHex(encoded)).contains("cfffffffffffffffff");
    final EndpointMessage restored = MessagePack.forSchema(EndpointMessage.SCHEMA).decode(ByteBuffer.wrap(encoded));
    assertThat(Long.toUnsignedString(restored.getCurrentTime())).isEqualTo("18446744073709551615");
  }

  @Test
  void emptyMessageRoundTrips() {
    final MessagePack<EndpointMessage> pack = MessagePack.forSchema(EndpointMessage.SCHEMA);
    final EndpointMessage empty = new EndpointMessage();
    assertThat(pack.decode(ByteBuffer.wrap(pack.toByteArray(empty)))).isEqualTo(empty);
  }
}
