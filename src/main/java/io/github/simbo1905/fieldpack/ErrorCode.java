// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

/// Classifies why an encode or decode failed.
public enum ErrorCode {
  /// The wire shape disagrees with the shape the handler expects.
  TYPE_MISMATCH,
  /// A composite was expected but the wire value is not a map.
  EXPECTED_MAP,
  /// No alternative of a variant accepts the wire shape.
  NO_MATCHING_VARIANT,
  /// The destination buffer is too small, or an extension payload exceeds the declared capacity.
  BUFFER_TOO_SMALL,
  /// The input ended before a value was fully read.
  TRUNCATED_INPUT,
  /// A fixed length array does not have the declared number of elements.
  ARRAY_LENGTH_MISMATCH,
  /// An integer does not fit the target width. Only raised when [NarrowingMode#STRICT] is configured.
  INTEGER_OVERFLOW
}
