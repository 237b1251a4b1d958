// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

/// Raised when a value cannot be written, typically [ErrorCode#BUFFER_TOO_SMALL].
public final class EncodeException extends MessagePackException {
  EncodeException(ErrorCode code, String message) {
    super(code, message);
  }
}
