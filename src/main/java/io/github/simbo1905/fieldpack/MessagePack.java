// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface of the fieldpack library.
/// Encodes a composite type described by a [FieldSchema] to MessagePack in a caller supplied buffer and decodes it
/// back into a caller supplied object.
///
/// ```java
/// final MessagePack<Outer> pack = MessagePack.forSchema(Outer.SCHEMA);
/// final ByteBuffer buffer = ByteBuffer.allocate(pack.sizeOf(outer));
/// pack.encode(outer, buffer);
/// buffer.flip();
/// final Outer copy = pack.decode(buffer);
/// ```
public sealed interface MessagePack<T> permits BufferSession {

  Logger LOGGER = Logger.getLogger(MessagePack.class.getName());

  /// Encode a value starting at the buffer's position, advancing the position past it.
  /// If the buffer has too little room an [EncodeException] with [ErrorCode#BUFFER_TOO_SMALL] is thrown and the
  /// position is left where it was. Bytes beyond the position may have been overwritten.
  /// @param value The value to encode
  /// @param buffer The buffer to write to
  /// @return The number of bytes written
  int encode(T value, ByteBuffer buffer);

  /// Decode the value at the buffer's position into `into`, advancing the position past it.
  /// Members whose keys are absent keep their current values and unknown keys are skipped.
  /// Trailing bytes after the value are left unread.
  /// On failure a [DecodeException] is thrown and `into` may have been partly overwritten.
  /// @param buffer The buffer to read from
  /// @param into The object to decode into
  void decode(ByteBuffer buffer, T into);

  /// Decode the value at the buffer's position into a fresh instance from the schema factory.
  /// @param buffer The buffer to read from
  /// @return The decoded object
  T decode(ByteBuffer buffer);

  /// Calculate the exact number of bytes [#encode(Object, ByteBuffer)] will write for a value
  /// @param value The value to size
  /// @return The encoded size in bytes
  int sizeOf(T value);

  /// Encode a value into an array of exactly its encoded size.
  byte[] toByteArray(T value);

  FieldSchema<T> schema();

  /// A session for the composite type described by `schema`. Sessions are immutable and may be shared.
  static <T> MessagePack<T> forSchema(FieldSchema<T> schema) {
    Objects.requireNonNull(schema, "schema must not be null");
    return new BufferSession<>(schema);
  }

  /// Encode a [Packable] value starting at the buffer's position.
  static <T extends Packable<T>> int encodeToBuffer(T value, ByteBuffer buffer) {
    Objects.requireNonNull(value, "value must not be null");
    return forSchema(value.fieldSchema()).encode(value, buffer);
  }

  /// Decode the value at the buffer's position into a [Packable] object.
  static <T extends Packable<T>> void decodeFromBuffer(ByteBuffer buffer, T into) {
    Objects.requireNonNull(into, "into must not be null");
    forSchema(into.fieldSchema()).decode(buffer, into);
  }
}
