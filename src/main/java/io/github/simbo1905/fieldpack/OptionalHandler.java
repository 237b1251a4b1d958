// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Objects;
import java.util.Optional;

/// Handler for [Optional]. Empty is written as Nil; a present value is written exactly as its own handler writes it.
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
final class OptionalHandler<U> implements TypeHandler<Optional<U>> {
  private final TypeHandler<U> valueHandler;

  OptionalHandler(TypeHandler<U> valueHandler) {
    this.valueHandler = Objects.requireNonNull(valueHandler, "valueHandler must not be null");
  }

  @Override
  public TypeTag tag() {
    return TypeTag.NIL;
  }

  @Override
  public boolean accepts(TypeTag wireTag) {
    return wireTag == TypeTag.NIL || valueHandler.accepts(wireTag);
  }

  @Override
  public void write(MessagePackWriter out, Optional<U> value) {
    if (value.isPresent()) {
      valueHandler.write(out, value.get());
    } else {
      out.writeNil();
    }
  }

  @Override
  public Optional<U> read(MessagePackReader in, Optional<U> current) {
    if (in.peekTag().type() == TypeTag.NIL) {
      in.readNil();
      return Optional.empty();
    }
    final U seed = current == null ? null : current.orElse(null);
    return Optional.of(valueHandler.read(in, seed));
  }

  @Override
  public String toString() {
    return "optional(" + valueHandler + ")";
  }
}
