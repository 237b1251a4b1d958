// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.Objects;

/// Base of the errors raised while encoding or decoding. Always carries an [ErrorCode].
public sealed class MessagePackException extends RuntimeException permits EncodeException, DecodeException {
  private final ErrorCode code;

  MessagePackException(ErrorCode code, String message) {
    super(Objects.requireNonNull(code, "code must not be null") + ": " + message);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }
}
