// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Objects;

import static io.github.simbo1905.fieldpack.MessagePack.LOGGER;

/// Binds the composite handler of a schema to caller supplied buffers. Holds no per call state.
final class BufferSession<T> implements MessagePack<T> {
  private final CompositeHandler<T> handler;

  BufferSession(@NotNull FieldSchema<T> schema) {
    this.handler = new CompositeHandler<>(schema);
  }

  @Override
  public int encode(T value, ByteBuffer buffer) {
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(buffer, "buffer must not be null");
    final int start = buffer.position();
    final MessagePackWriter out = MessagePackWriter.of(buffer);
    try {
      handler.write(out, value);
    } catch (RuntimeException e) {
      buffer.position(start);
      LOGGER.fine(() -> "Encode of " + handler + " failed after " + out.bytesWritten() + " bytes: " + e.getMessage());
      throw e;
    }
    final int written = buffer.position() - start;
    LOGGER.finer(() -> "Encoded " + handler + " in " + written + " bytes at position " + start);
    return written;
  }

  @Override
  public void decode(ByteBuffer buffer, T into) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    Objects.requireNonNull(into, "into must not be null");
    final int start = buffer.position();
    handler.readInto(MessagePackReader.of(buffer), into);
    LOGGER.finer(() -> "Decoded " + handler + " from " + (buffer.position() - start) + " bytes at position " + start);
  }

  @Override
  public T decode(ByteBuffer buffer) {
    final T value = handler.schema.newInstance();
    decode(buffer, value);
    return value;
  }

  @Override
  public int sizeOf(T value) {
    Objects.requireNonNull(value, "value must not be null");
    final MessagePackWriter sizer = MessagePackWriter.sizer();
    handler.write(sizer, value);
    return sizer.bytesWritten();
  }

  @Override
  public byte[] toByteArray(T value) {
    final byte[] bytes = new byte[sizeOf(value)];
    encode(value, ByteBuffer.wrap(bytes));
    return bytes;
  }

  @Override
  public FieldSchema<T> schema() {
    return handler.schema;
  }

  @Override
  public String toString() {
    return "MessagePack[" + handler.schema + "]";
  }
}
