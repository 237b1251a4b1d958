// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Objects;
import java.util.OptionalInt;

/// Handler for a single wire value such as a bool, a number, a string or a binary blob.
final class ScalarHandler<T> implements TypeHandler<T> {
  private final TypeTag tag;
  private final String name;
  private final Writer<T> writer;
  private final Reader<T> reader;
  private final OptionalInt maxLength;

  ScalarHandler(TypeTag tag, String name, Writer<T> writer, Reader<T> reader) {
    this(tag, name, writer, reader, OptionalInt.empty());
  }

  ScalarHandler(TypeTag tag, String name, Writer<T> writer, Reader<T> reader, OptionalInt maxLength) {
    this.tag = Objects.requireNonNull(tag);
    this.name = Objects.requireNonNull(name);
    this.writer = Objects.requireNonNull(writer);
    this.reader = Objects.requireNonNull(reader);
    this.maxLength = Objects.requireNonNull(maxLength);
  }

  /// The UTF-8 byte bound of a bounded string, empty for every other scalar.
  OptionalInt maxLength() {
    return maxLength;
  }

  @Override
  public TypeTag tag() {
    return tag;
  }

  @Override
  public void write(MessagePackWriter out, T value) {
    writer.write(out, value);
  }

  @Override
  public T read(MessagePackReader in, T current) {
    return reader.read(in);
  }

  @Override
  public String toString() {
    return name;
  }
}
