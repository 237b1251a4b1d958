// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Arrays;

/// Integer narrowing policy. Set via system property `fieldpack.IntegerNarrowing`. The default is TRUNCATE.
/// When a wire integer is wider than the member it is read into, for example `300` read into a `uint8`:
/// - TRUNCATE keeps the low bits of the value, so `300` becomes `44`. Nothing is reported.
/// - STRICT raises a [DecodeException] with [ErrorCode#INTEGER_OVERFLOW].
///
/// The mode is captured when an integer handler is created, so set the property before building a [FieldSchema].
enum NarrowingMode {
  /// Silently keep the low bits that fit the target width.
  TRUNCATE,

  /// Fail the decode when the value does not fit the target width.
  STRICT;

  static final String PROPERTY = "fieldpack.IntegerNarrowing";

  static NarrowingMode current() {
    final String mode = System.getProperty(PROPERTY, "TRUNCATE").toUpperCase();
    try {
      return NarrowingMode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid integer narrowing mode: " + mode + ". Must be one of: " +
          Arrays.toString(NarrowingMode.values()), e);
    }
  }
}
