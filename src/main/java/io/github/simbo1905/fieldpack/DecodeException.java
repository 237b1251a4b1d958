// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

/// Raised when the wire data cannot be read into the target type.
public final class DecodeException extends MessagePackException {
  DecodeException(ErrorCode code, String message) {
    super(code, message);
  }
}
