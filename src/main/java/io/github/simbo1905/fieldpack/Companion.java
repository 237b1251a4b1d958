// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import static io.github.simbo1905.fieldpack.MessagePack.LOGGER;

/// This is the static helpers of the handlers
sealed interface Companion permits Companion.Nothing {

  record Nothing() implements Companion {
  }

  /// Read an integer of either wire family and narrow it to `bits` wide signed or unsigned value.
  /// Whether it fits is judged against the family the wire declared, not just the raw bits.
  static long readIntegral(MessagePackReader in, int bits, boolean unsignedTarget, NarrowingMode mode, String name) {
    final int position = in.position();
    final boolean unsignedSource = in.peekTag().type() == TypeTag.UINT;
    final long raw = unsignedTarget ? in.readUInt() : in.readInt();
    if (fits(raw, unsignedSource, bits, unsignedTarget)) {
      return raw;
    }
    final String shown = unsignedSource ? Long.toUnsignedString(raw) : Long.toString(raw);
    if (mode == NarrowingMode.STRICT) {
      throw new DecodeException(ErrorCode.INTEGER_OVERFLOW,
          "Value " + shown + " at position " + position + " does not fit " + name);
    }
    final long truncated = truncate(raw, bits, unsignedTarget);
    LOGGER.finer(() -> "Truncated " + shown + " at position " + position + " to " + name + " value " + truncated);
    return truncated;
  }

  static boolean fits(long raw, boolean unsignedSource, int bits, boolean unsignedTarget) {
    if (unsignedTarget) {
      if (!unsignedSource && raw < 0) {
        return false;
      }
      return bits == Long.SIZE || Long.compareUnsigned(raw, (1L << bits) - 1) <= 0;
    }
    if (unsignedSource && raw < 0) {
      // above Long.MAX_VALUE
      return false;
    }
    final long min = -(1L << (bits - 1));
    final long max = (1L << (bits - 1)) - 1;
    return raw >= min && raw <= max;
  }

  static long truncate(long raw, int bits, boolean unsignedTarget) {
    if (bits == Long.SIZE) {
      return raw;
    }
    if (unsignedTarget) {
      return raw & ((1L << bits) - 1);
    }
    final int shift = Long.SIZE - bits;
    return (raw << shift) >> shift;
  }

  /// Length of the longest prefix of `utf8` that is at most `maxBytes` long and does not split a code point.
  static int utf8Prefix(byte[] utf8, int maxBytes) {
    if (utf8.length <= maxBytes) {
      return utf8.length;
    }
    int end = maxBytes;
    while (end > 0 && (utf8[end] & 0xc0) == 0x80) {
      end--;
    }
    return end;
  }
}
