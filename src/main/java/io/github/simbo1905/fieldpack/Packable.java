// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

/// Implemented by a composite type to declare its [FieldSchema]. This is the only thing a new composite type has to
/// provide; return a schema held in a static constant rather than building one per call.
public interface Packable<T extends Packable<T>> {
  FieldSchema<T> fieldSchema();
}
