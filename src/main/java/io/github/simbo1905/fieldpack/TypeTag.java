// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

/// The closed set of shapes a value can take on the wire.
/// A [TypeHandler] uses a tag to describe what it expects to read and the [MessagePackReader] uses the same tags to
/// classify a peeked header. [#CUSTOM_OBJECT] is never a wire classification: it is the expected shape of a composite
/// and is satisfied by a wire [#MAP].
public enum TypeTag {
  NIL,
  BOOL,
  INTEGER,
  UINT,
  FLOAT32,
  FLOAT64,
  STRING,
  BINARY,
  EXTENSION,
  ARRAY,
  MAP,
  CUSTOM_OBJECT;

  /// Whether a value classified on the wire as `wireTag` is a plausible source for this expected shape.
  /// Signed and unsigned integers are distinct, as are the two float widths.
  public boolean matches(TypeTag wireTag) {
    if (this == CUSTOM_OBJECT) {
      return wireTag == MAP;
    }
    return this == wireTag;
  }
}
