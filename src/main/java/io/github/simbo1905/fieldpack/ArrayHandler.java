// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Objects;
import java.util.function.IntFunction;

/// Handler for a Java array that must hold exactly `length` elements on both sides of the wire.
final class ArrayHandler<E> implements TypeHandler<E[]> {
  private final TypeHandler<E> elementHandler;
  private final int length;
  private final IntFunction<E[]> generator;

  ArrayHandler(TypeHandler<E> elementHandler, int length, IntFunction<E[]> generator) {
    this.elementHandler = Objects.requireNonNull(elementHandler, "elementHandler must not be null");
    this.generator = Objects.requireNonNull(generator, "generator must not be null");
    if (length < 0) {
      throw new IllegalArgumentException("length must not be negative, got: " + length);
    }
    this.length = length;
  }

  @Override
  public TypeTag tag() {
    return TypeTag.ARRAY;
  }

  @Override
  public void write(MessagePackWriter out, E[] value) {
    if (value.length != length) {
      throw new EncodeException(ErrorCode.ARRAY_LENGTH_MISMATCH,
          "Expected an array of " + length + " elements but got " + value.length);
    }
    out.writeArrayHeader(length);
    for (int i = 0; i < length; i++) {
      elementHandler.write(out, Objects.requireNonNull(value[i], "array element " + i + " is null"));
    }
  }

  @Override
  public E[] read(MessagePackReader in, E[] current) {
    final int position = in.position();
    final int count = in.readArrayHeader();
    if (count != length) {
      throw new DecodeException(ErrorCode.ARRAY_LENGTH_MISMATCH,
          "Expected an array of " + length + " elements but found " + count + " at position " + position);
    }
    final E[] target = current != null && current.length == length ? current.clone() : generator.apply(length);
    for (int i = 0; i < length; i++) {
      target[i] = elementHandler.read(in, target[i]);
    }
    return target;
  }

  @Override
  public String toString() {
    return "array(" + elementHandler + ", " + length + ")";
  }
}
