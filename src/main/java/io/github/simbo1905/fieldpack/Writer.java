// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.function.BiConsumer;

@FunctionalInterface
interface Writer<T> extends
    BiConsumer<MessagePackWriter, T> {

  /// Write a value with the MessagePackWriter
  default void write(MessagePackWriter out, T value) {
    accept(out, value);
  }
}
