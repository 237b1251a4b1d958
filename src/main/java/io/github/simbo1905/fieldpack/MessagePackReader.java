// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Reads MessagePack formats from a [ByteBuffer] between its position and its limit.
/// Reads advance the buffer position; [#peekTag()] leaves it unchanged so a decode can resume after a peek.
/// Running out of input raises [DecodeException] with [ErrorCode#TRUNCATED_INPUT] and finding a different format than
/// the one requested raises [ErrorCode#TYPE_MISMATCH].
public final class MessagePackReader {
  private final ByteBuffer buffer;

  private MessagePackReader(ByteBuffer buffer) {
    this.buffer = buffer;
  }

  public static MessagePackReader of(ByteBuffer buffer) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    buffer.order(ByteOrder.BIG_ENDIAN);
    return new MessagePackReader(buffer);
  }

  public int position() {
    return buffer.position();
  }

  /// Classify the next value without consuming it.
  public WireTag peekTag() {
    final int position = buffer.position();
    try {
      return readTag();
    } finally {
      buffer.position(position);
    }
  }

  public void readNil() {
    expect(TypeTag.NIL);
  }

  public boolean readBool() {
    final int position = buffer.position();
    final int format = u8();
    return switch (format) {
      case 0xc2 -> false;
      case 0xc3 -> true;
      default -> throw mismatch(TypeTag.BOOL, format, position);
    };
  }

  /// Read an integer of either family and return its raw 64 bits.
  /// A uint64 above [Long#MAX_VALUE] comes back negative; callers that care peek the tag first.
  public long readInt() {
    return readIntegral(TypeTag.INTEGER);
  }

  /// Read an integer of either family and return its raw 64 bits, to be interpreted as unsigned.
  /// A negative signed value comes back in two's complement.
  public long readUInt() {
    return readIntegral(TypeTag.UINT);
  }

  public float readFloat32() {
    final int position = buffer.position();
    final int format = u8();
    if (format != 0xca) {
      throw mismatch(TypeTag.FLOAT32, format, position);
    }
    require(Float.BYTES);
    return buffer.getFloat();
  }

  public double readFloat64() {
    final int position = buffer.position();
    final int format = u8();
    if (format != 0xcb) {
      throw mismatch(TypeTag.FLOAT64, format, position);
    }
    require(Double.BYTES);
    return buffer.getDouble();
  }

  public String readString() {
    final int length = expect(TypeTag.STRING).length();
    require(length);
    final byte[] utf8 = new byte[length];
    buffer.get(utf8);
    return new String(utf8, StandardCharsets.UTF_8);
  }

  /// Read a string keeping at most `maxBytes` bytes of its UTF-8 form.
  /// A longer string is cut at the last code point boundary within the bound and the rest of it is skipped.
  public String readString(int maxBytes) {
    if (maxBytes < 0) {
      throw new IllegalArgumentException("maxBytes must not be negative, got: " + maxBytes);
    }
    final int length = expect(TypeTag.STRING).length();
    require(length);
    final int start = buffer.position();
    int end = Math.min(length, maxBytes);
    if (end < length) {
      while (end > 0 && (buffer.get(start + end) & 0xc0) == 0x80) {
        end--;
      }
    }
    final byte[] utf8 = new byte[end];
    buffer.get(utf8);
    buffer.position(start + length);
    return new String(utf8, StandardCharsets.UTF_8);
  }

  public byte[] readBinary() {
    final int length = expect(TypeTag.BINARY).length();
    require(length);
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  /// Consume an extension header. The caller reads the payload with [#readBytes(byte\[\], int, int)].
  public WireTag readExtensionHeader() {
    return expect(TypeTag.EXTENSION);
  }

  public void readBytes(byte[] destination, int offset, int length) {
    Objects.checkFromIndexSize(offset, length, destination.length);
    require(length);
    buffer.get(destination, offset, length);
  }

  public void skipBytes(int length) {
    require(length);
    buffer.position(buffer.position() + length);
  }

  public int readArrayHeader() {
    return expect(TypeTag.ARRAY).length();
  }

  public int readMapHeader() {
    return expect(TypeTag.MAP).length();
  }

  /// Skip exactly one value, including everything nested inside it.
  public void discard() {
    long pending = 1;
    while (pending > 0) {
      pending--;
      final WireTag tag = readTag();
      switch (tag.type()) {
        case NIL, BOOL -> {
        }
        case INTEGER, UINT, FLOAT32, FLOAT64 -> skipScalarPayload(tag);
        case STRING, BINARY, EXTENSION -> skipBytes(tag.length());
        case ARRAY -> pending += tag.length();
        case MAP -> pending += 2L * tag.length();
        default -> throw new IllegalStateException("Unexpected wire tag " + tag);
      }
    }
  }

  /// Consume the header of the next value. Scalar payloads are left in place; lengths and counts are consumed.
  private WireTag readTag() {
    final int position = buffer.position();
    final int format = u8();
    if (format <= 0x7f) {
      return WireTag.of(TypeTag.UINT);
    }
    if (format <= 0x8f) {
      return WireTag.of(TypeTag.MAP, count(format & 0x0f, 2));
    }
    if (format <= 0x9f) {
      return WireTag.of(TypeTag.ARRAY, count(format & 0x0f, 1));
    }
    if (format <= 0xbf) {
      return WireTag.of(TypeTag.STRING, format & 0x1f);
    }
    if (format >= 0xe0) {
      return WireTag.of(TypeTag.INTEGER);
    }
    return switch (format) {
      case 0xc0 -> WireTag.of(TypeTag.NIL);
      case 0xc2, 0xc3 -> WireTag.of(TypeTag.BOOL);
      case 0xc4 -> WireTag.of(TypeTag.BINARY, u8());
      case 0xc5 -> WireTag.of(TypeTag.BINARY, u16());
      case 0xc6 -> WireTag.of(TypeTag.BINARY, length(u32()));
      case 0xc7 -> extension(u8());
      case 0xc8 -> extension(u16());
      case 0xc9 -> extension(length(u32()));
      case 0xca -> WireTag.of(TypeTag.FLOAT32);
      case 0xcb -> WireTag.of(TypeTag.FLOAT64);
      case 0xcc, 0xcd, 0xce, 0xcf -> WireTag.of(TypeTag.UINT);
      case 0xd0, 0xd1, 0xd2, 0xd3 -> WireTag.of(TypeTag.INTEGER);
      case 0xd4 -> extension(1);
      case 0xd5 -> extension(2);
      case 0xd6 -> extension(4);
      case 0xd7 -> extension(8);
      case 0xd8 -> extension(16);
      case 0xd9 -> WireTag.of(TypeTag.STRING, u8());
      case 0xda -> WireTag.of(TypeTag.STRING, u16());
      case 0xdb -> WireTag.of(TypeTag.STRING, length(u32()));
      case 0xdc -> WireTag.of(TypeTag.ARRAY, count(u16(), 1));
      case 0xdd -> WireTag.of(TypeTag.ARRAY, count(length(u32()), 1));
      case 0xde -> WireTag.of(TypeTag.MAP, count(u16(), 2));
      case 0xdf -> WireTag.of(TypeTag.MAP, count(length(u32()), 2));
      default -> throw new DecodeException(ErrorCode.TYPE_MISMATCH,
          "Format byte 0x" + Integer.toHexString(format) + " at position " + position + " is never used");
    };
  }

  private WireTag expect(TypeTag expected) {
    final int position = buffer.position();
    final WireTag tag = readTag();
    if (tag.type() != expected) {
      buffer.position(position);
      throw new DecodeException(ErrorCode.TYPE_MISMATCH,
          "Expected " + expected + " but found " + tag.type() + " at position " + position);
    }
    return tag;
  }

  private long readIntegral(TypeTag expected) {
    final int position = buffer.position();
    final int format = u8();
    if (format <= 0x7f) {
      return format;
    }
    if (format >= 0xe0) {
      return (byte) format;
    }
    return switch (format) {
      case 0xcc -> u8();
      case 0xcd -> u16();
      case 0xce -> u32();
      case 0xcf, 0xd3 -> {
        require(Long.BYTES);
        yield buffer.getLong();
      }
      case 0xd0 -> {
        require(Byte.BYTES);
        yield buffer.get();
      }
      case 0xd1 -> {
        require(Short.BYTES);
        yield buffer.getShort();
      }
      case 0xd2 -> {
        require(Integer.BYTES);
        yield buffer.getInt();
      }
      default -> throw mismatch(expected, format, position);
    };
  }

  private void skipScalarPayload(WireTag tag) {
    // the header is consumed; step back one byte and let the typed read consume the payload
    buffer.position(buffer.position() - 1);
    switch (tag.type()) {
      case INTEGER, UINT -> readIntegral(tag.type());
      case FLOAT32 -> readFloat32();
      case FLOAT64 -> readFloat64();
      default -> throw new IllegalStateException("Not a scalar tag " + tag);
    }
  }

  private WireTag extension(int length) {
    require(1);
    final byte type = buffer.get();
    return new WireTag(TypeTag.EXTENSION, length, type);
  }

  /// Each element needs at least one byte, so a count larger than what remains cannot be satisfied.
  private int count(int count, int bytesPerElement) {
    if ((long) count * bytesPerElement > buffer.remaining()) {
      throw truncated((long) count * bytesPerElement);
    }
    return count;
  }

  private int length(long u32) {
    if (u32 > buffer.remaining()) {
      throw truncated(u32);
    }
    return (int) u32;
  }

  private DecodeException mismatch(TypeTag expected, int format, int position) {
    buffer.position(position);
    return new DecodeException(ErrorCode.TYPE_MISMATCH,
        "Expected " + expected + " but found format byte 0x" + Integer.toHexString(format) + " at position " + position);
  }

  private void require(long bytes) {
    if (buffer.remaining() < bytes) {
      throw truncated(bytes);
    }
  }

  private DecodeException truncated(long bytes) {
    return new DecodeException(ErrorCode.TRUNCATED_INPUT, "Need " + bytes + " bytes at position " +
        buffer.position() + " but only " + buffer.remaining() + " remain");
  }

  private int u8() {
    require(1);
    return buffer.get() & 0xff;
  }

  private int u16() {
    require(2);
    return buffer.getShort() & 0xffff;
  }

  private long u32() {
    require(4);
    return buffer.getInt() & 0xffffffffL;
  }
}
