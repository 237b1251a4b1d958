// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Handler for a variable length [List]. Decode sizes the result to the wire count.
final class ListHandler<E> implements TypeHandler<List<E>> {
  private final TypeHandler<E> elementHandler;

  ListHandler(TypeHandler<E> elementHandler) {
    this.elementHandler = Objects.requireNonNull(elementHandler, "elementHandler must not be null");
  }

  @Override
  public TypeTag tag() {
    return TypeTag.ARRAY;
  }

  @Override
  public void write(MessagePackWriter out, List<E> value) {
    out.writeArrayHeader(value.size());
    int index = 0;
    for (E element : value) {
      final int i = index++;
      elementHandler.write(out, Objects.requireNonNull(element, () -> "list element " + i + " is null"));
    }
  }

  @Override
  public List<E> read(MessagePackReader in, List<E> current) {
    final int count = in.readArrayHeader();
    final List<E> result = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      final E seed = current != null && i < current.size() ? current.get(i) : null;
      result.add(elementHandler.read(in, seed));
    }
    return result;
  }

  @Override
  public String toString() {
    return "list(" + elementHandler + ")";
  }
}
