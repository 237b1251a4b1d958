// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Arrays;

/// Handler for an [Extension] with a fixed payload capacity. Always writes exactly `capacity` payload bytes.
final class ExtensionHandler implements TypeHandler<Extension> {
  private final int capacity;

  ExtensionHandler(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative, got: " + capacity);
    }
    this.capacity = capacity;
  }

  @Override
  public TypeTag tag() {
    return TypeTag.EXTENSION;
  }

  @Override
  public void write(MessagePackWriter out, Extension value) {
    final byte[] data = value.data();
    if (data.length > capacity) {
      throw new EncodeException(ErrorCode.BUFFER_TOO_SMALL,
          "Extension payload of " + data.length + " bytes exceeds capacity " + capacity);
    }
    out.writeExtension(value.type(), data.length == capacity ? data : Arrays.copyOf(data, capacity));
  }

  @Override
  public Extension read(MessagePackReader in, Extension current) {
    final int position = in.position();
    final WireTag tag = in.readExtensionHeader();
    if (tag.length() > capacity) {
      throw new DecodeException(ErrorCode.BUFFER_TOO_SMALL, "Extension payload of " + tag.length() +
          " bytes at position " + position + " exceeds capacity " + capacity);
    }
    final byte[] data = new byte[capacity];
    in.readBytes(data, 0, tag.length());
    return new Extension(tag.extensionType(), data);
  }

  @Override
  public String toString() {
    return "extension(" + capacity + ")";
  }
}
