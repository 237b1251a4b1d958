// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Objects;

/// A decoded wire header.
/// @param type the shape of the value
/// @param length element count for arrays, pair count for maps, byte length for strings, binaries and extensions,
///               zero for everything else
/// @param extensionType the subtype byte of an extension, zero for everything else
public record WireTag(TypeTag type, int length, byte extensionType) {
  public WireTag {
    Objects.requireNonNull(type, "type must not be null");
    if (type == TypeTag.CUSTOM_OBJECT) {
      throw new IllegalArgumentException("CUSTOM_OBJECT is not a wire classification");
    }
    if (length < 0) {
      throw new IllegalArgumentException("length must not be negative, got: " + length);
    }
  }

  static WireTag of(TypeTag type) {
    return new WireTag(type, 0, (byte) 0);
  }

  static WireTag of(TypeTag type, int length) {
    return new WireTag(type, length, (byte) 0);
  }
}
