// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/// A small typed payload carried alongside ordinary fields, such as a status code.
/// @param type the subtype discriminant, written as the MessagePack extension type byte
/// @param data the payload; a field's handler pads it with zeros to the declared capacity
public record Extension(byte type, byte[] data) {
  public Extension {
    Objects.requireNonNull(data, "data must not be null");
  }

  /// A zero filled extension of the given capacity.
  public static Extension of(int type, int capacity) {
    if (type < Byte.MIN_VALUE || type > Byte.MAX_VALUE) {
      throw new IllegalArgumentException("Extension type must fit a signed byte, got: " + type);
    }
    return new Extension((byte) type, new byte[capacity]);
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || getClass() != o.getClass()) return false;
    Extension extension = (Extension) o;
    return type == extension.type && Arrays.equals(data, extension.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, Arrays.hashCode(data));
  }

  @Override
  public String toString() {
    return "Extension[type=" + type + ", data=" + HexFormat.of().formatHex(data) + "]";
  }
}
