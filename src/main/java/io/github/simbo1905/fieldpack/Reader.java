// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.function.Function;

@FunctionalInterface
interface Reader<T> extends
    Function<MessagePackReader, T> {

  /// Read a value from the MessagePackReader
  default T read(MessagePackReader in) {
    return apply(in);
  }
}
