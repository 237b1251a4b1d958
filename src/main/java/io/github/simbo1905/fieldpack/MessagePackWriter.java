// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Writes MessagePack formats into a fixed capacity [ByteBuffer] starting at its position.
/// Every write checks the remaining space first so the buffer never overflows; running out of space raises
/// [EncodeException] with [ErrorCode#BUFFER_TOO_SMALL].
///
/// A writer created with [#sizer()] has no buffer and only counts the bytes that would be written.
///
/// Signed integers are always written in the signed formats and unsigned integers in the positive fixint and uint
/// formats so that a reader can tell the two families apart.
public final class MessagePackWriter {
  private final ByteBuffer buffer;
  private int written;

  private MessagePackWriter(ByteBuffer buffer) {
    this.buffer = buffer;
  }

  /// A writer that appends to `buffer` from its position up to its limit.
  public static MessagePackWriter of(ByteBuffer buffer) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    buffer.order(ByteOrder.BIG_ENDIAN);
    return new MessagePackWriter(buffer);
  }

  /// A writer that only counts bytes.
  public static MessagePackWriter sizer() {
    return new MessagePackWriter(null);
  }

  /// Number of bytes written by this writer so far.
  public int bytesWritten() {
    return written;
  }

  public void writeNil() {
    reserve(1);
    put((byte) 0xc0);
  }

  public void writeBool(boolean value) {
    reserve(1);
    put(value ? (byte) 0xc3 : (byte) 0xc2);
  }

  /// Write a signed integer in the smallest signed format that holds it.
  public void writeInt(long value) {
    if (value >= -32 && value < 0) {
      reserve(1);
      put((byte) value);
    } else if (value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE) {
      reserve(2);
      put((byte) 0xd0);
      put((byte) value);
    } else if (value >= Short.MIN_VALUE && value <= Short.MAX_VALUE) {
      reserve(3);
      put((byte) 0xd1);
      putShort((short) value);
    } else if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
      reserve(5);
      put((byte) 0xd2);
      putInt((int) value);
    } else {
      reserve(9);
      put((byte) 0xd3);
      putLong(value);
    }
  }

  /// Write an unsigned integer in the smallest unsigned format that holds it.
  /// The argument is interpreted as an unsigned 64-bit value.
  public void writeUInt(long value) {
    if (Long.compareUnsigned(value, 0x7f) <= 0) {
      reserve(1);
      put((byte) value);
    } else if (Long.compareUnsigned(value, 0xff) <= 0) {
      reserve(2);
      put((byte) 0xcc);
      put((byte) value);
    } else if (Long.compareUnsigned(value, 0xffff) <= 0) {
      reserve(3);
      put((byte) 0xcd);
      putShort((short) value);
    } else if (Long.compareUnsigned(value, 0xffffffffL) <= 0) {
      reserve(5);
      put((byte) 0xce);
      putInt((int) value);
    } else {
      reserve(9);
      put((byte) 0xcf);
      putLong(value);
    }
  }

  public void writeFloat32(float value) {
    reserve(5);
    put((byte) 0xca);
    if (buffer != null) {
      buffer.putFloat(value);
    }
  }

  public void writeFloat64(double value) {
    reserve(9);
    put((byte) 0xcb);
    if (buffer != null) {
      buffer.putDouble(value);
    }
  }

  public void writeString(String value) {
    Objects.requireNonNull(value, "value must not be null");
    final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    writeString(utf8, 0, utf8.length);
  }

  /// Write `length` bytes of already encoded UTF-8 as a string.
  public void writeString(byte[] utf8, int offset, int length) {
    Objects.checkFromIndexSize(offset, length, utf8.length);
    if (length < 32) {
      reserve(1 + length);
      put((byte) (0xa0 | length));
    } else if (length <= 0xff) {
      reserve(2 + length);
      put((byte) 0xd9);
      put((byte) length);
    } else if (length <= 0xffff) {
      reserve(3 + length);
      put((byte) 0xda);
      putShort((short) length);
    } else {
      reserve(5 + length);
      put((byte) 0xdb);
      putInt(length);
    }
    putBytes(utf8, offset, length);
  }

  public void writeBinary(byte[] value) {
    Objects.requireNonNull(value, "value must not be null");
    final int length = value.length;
    if (length <= 0xff) {
      reserve(2 + length);
      put((byte) 0xc4);
      put((byte) length);
    } else if (length <= 0xffff) {
      reserve(3 + length);
      put((byte) 0xc5);
      putShort((short) length);
    } else {
      reserve(5 + length);
      put((byte) 0xc6);
      putInt(length);
    }
    putBytes(value, 0, length);
  }

  /// Write an extension value. Payloads of 1, 2, 4, 8 and 16 bytes use the fixext formats.
  public void writeExtension(byte type, byte[] data) {
    Objects.requireNonNull(data, "data must not be null");
    final int length = data.length;
    switch (length) {
      case 1 -> fixext(0xd4, 1);
      case 2 -> fixext(0xd5, 2);
      case 4 -> fixext(0xd6, 4);
      case 8 -> fixext(0xd7, 8);
      case 16 -> fixext(0xd8, 16);
      default -> {
        if (length <= 0xff) {
          reserve(3 + length);
          put((byte) 0xc7);
          put((byte) length);
        } else if (length <= 0xffff) {
          reserve(4 + length);
          put((byte) 0xc8);
          putShort((short) length);
        } else {
          reserve(6 + length);
          put((byte) 0xc9);
          putInt(length);
        }
      }
    }
    put(type);
    putBytes(data, 0, length);
  }

  public void writeArrayHeader(int count) {
    requireCount(count);
    if (count < 16) {
      reserve(1);
      put((byte) (0x90 | count));
    } else if (count <= 0xffff) {
      reserve(3);
      put((byte) 0xdc);
      putShort((short) count);
    } else {
      reserve(5);
      put((byte) 0xdd);
      putInt(count);
    }
  }

  public void writeMapHeader(int count) {
    requireCount(count);
    if (count < 16) {
      reserve(1);
      put((byte) (0x80 | count));
    } else if (count <= 0xffff) {
      reserve(3);
      put((byte) 0xde);
      putShort((short) count);
    } else {
      reserve(5);
      put((byte) 0xdf);
      putInt(count);
    }
  }

  private void fixext(int format, int length) {
    reserve(2 + length);
    put((byte) format);
  }

  private static void requireCount(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative, got: " + count);
    }
  }

  /// Claim `bytes` bytes for the next format. Counts them and checks the buffer has room.
  private void reserve(int bytes) {
    if (buffer != null && buffer.remaining() < bytes) {
      throw new EncodeException(ErrorCode.BUFFER_TOO_SMALL, "Need " + bytes + " bytes at position " +
          buffer.position() + " but only " + buffer.remaining() + " remain after writing " + written + " bytes");
    }
    written += bytes;
  }

  private void put(byte b) {
    if (buffer != null) {
      buffer.put(b);
    }
  }

  private void putShort(short s) {
    if (buffer != null) {
      buffer.putShort(s);
    }
  }

  private void putInt(int i) {
    if (buffer != null) {
      buffer.putInt(i);
    }
  }

  private void putLong(long l) {
    if (buffer != null) {
      buffer.putLong(l);
    }
  }

  private void putBytes(byte[] bytes, int offset, int length) {
    if (buffer != null) {
      buffer.put(bytes, offset, length);
    }
  }
}
