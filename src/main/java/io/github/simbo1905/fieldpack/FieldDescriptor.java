// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.BiConsumer;
import java.util.function.Function;

/// Binds a wire key to one member of a composite type `T`.
/// @param name the key written on the wire, unique within its [FieldSchema]
/// @param handler the handler of the member type
/// @param getter reads the member
/// @param setter writes the member
/// @param maxLength the maximum length in UTF-8 bytes of a string member, empty when unconstrained
public record FieldDescriptor<T, V>(
    String name,
    TypeHandler<V> handler,
    Function<T, V> getter,
    BiConsumer<T, V> setter,
    OptionalInt maxLength
) {
  public FieldDescriptor {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(handler, "handler must not be null");
    Objects.requireNonNull(getter, "getter must not be null");
    Objects.requireNonNull(setter, "setter must not be null");
    Objects.requireNonNull(maxLength, "maxLength must not be null");
  }

  /// Write the key and then the member's current value.
  void writeTo(MessagePackWriter out, T owner) {
    final V value = getter.apply(owner);
    if (value == null) {
      throw new NullPointerException("Field '" + name + "' of " + owner.getClass().getSimpleName() + " is null");
    }
    out.writeString(name);
    handler.write(out, value);
  }

  /// Read the next value into the member, passing the member's current value to the handler.
  void readInto(MessagePackReader in, T owner) {
    setter.accept(owner, handler.read(in, getter.apply(owner)));
  }
}
