// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

/// A stateless encode and decode strategy bound to one static type `T`.
/// Obtain instances from [TypeHandlers]. The interface is sealed: a type that none of the built-in handlers covers
/// cannot be given a handler, so an unsupported member type is a compile error rather than a runtime surprise.
/// Composite and collection handlers hold the handlers of their elements and recurse through them.
public sealed interface TypeHandler<T> permits ScalarHandler, ExtensionHandler, OptionalHandler, ArrayHandler,
    ListHandler, MapHandler, VariantHandler, CompositeHandler {

  /// The wire shape this handler writes and expects to read.
  TypeTag tag();

  /// Whether a value classified on the wire as `wireTag` can be read by this handler. Used to resolve variants.
  default boolean accepts(TypeTag wireTag) {
    return tag().matches(wireTag);
  }

  /// Write a non-null value.
  void write(MessagePackWriter out, T value);

  /// Read the next value.
  /// @param current the member's current value, which composites, arrays, lists and maps decode into.
  ///                Scalars ignore it. May be null.
  /// @return the decoded value, never null
  T read(MessagePackReader in, T current);
}
