// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.fieldpack.MessagePack.LOGGER;

/// Writes a composite as a map of field name to value in schema order and reads it back by name.
/// Unknown keys are skipped and missing keys leave the member at its default value.
final class CompositeHandler<T> implements TypeHandler<T> {
  final FieldSchema<T> schema;

  CompositeHandler(FieldSchema<T> schema) {
    this.schema = Objects.requireNonNull(schema, "schema must not be null");
  }

  @Override
  public TypeTag tag() {
    return TypeTag.CUSTOM_OBJECT;
  }

  @Override
  public void write(MessagePackWriter out, T value) {
    out.writeMapHeader(schema.size());
    for (FieldDescriptor<T, ?> field : schema.fields()) {
      field.writeTo(out, value);
    }
  }

  @Override
  public T read(MessagePackReader in, T current) {
    final T target = current != null ? current : schema.newInstance();
    readInto(in, target);
    return target;
  }

  /// Decode the next map into `target`, overwriting only the members whose keys are present.
  void readInto(MessagePackReader in, T target) {
    final int position = in.position();
    final WireTag head = in.peekTag();
    if (head.type() != TypeTag.MAP) {
      throw new DecodeException(ErrorCode.EXPECTED_MAP, "Expected a map for " + schema.type().getSimpleName() +
          " but found " + head.type() + " at position " + position);
    }
    final int pairs = in.readMapHeader();
    for (int i = 0; i < pairs; i++) {
      final int keyPosition = in.position();
      final WireTag key = in.peekTag();
      if (key.type() != TypeTag.STRING) {
        throw new DecodeException(ErrorCode.TYPE_MISMATCH, "Expected a string key in " +
            schema.type().getSimpleName() + " but found " + key.type() + " at position " + keyPosition);
      }
      if (key.length() > schema.maxKeyLength()) {
        LOGGER.finer(() -> "Skipping " + key.length() + " byte key at position " + keyPosition + " of " +
            schema.type().getSimpleName() + " as it is longer than any field name");
        in.discard();
        in.discard();
        continue;
      }
      final String name = in.readString();
      final Optional<FieldDescriptor<T, ?>> field = schema.field(name);
      if (field.isPresent()) {
        field.get().readInto(in, target);
      } else {
        LOGGER.finer(() -> "Skipping unknown key '" + name + "' at position " + keyPosition + " of " +
            schema.type().getSimpleName());
        in.discard();
      }
    }
  }

  @Override
  public String toString() {
    return schema.type().getSimpleName();
  }
}
