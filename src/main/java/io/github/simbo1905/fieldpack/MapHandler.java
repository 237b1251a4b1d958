// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Handler for a keyed [Map]. Decode merges the wire entries into a copy of the current map, replacing by key.
/// Each wire value is decoded fresh, so a replaced value never keeps members of the one it replaces.
final class MapHandler<K, V> implements TypeHandler<Map<K, V>> {
  private final TypeHandler<K> keyHandler;
  private final TypeHandler<V> valueHandler;

  MapHandler(TypeHandler<K> keyHandler, TypeHandler<V> valueHandler) {
    this.keyHandler = Objects.requireNonNull(keyHandler, "keyHandler must not be null");
    this.valueHandler = Objects.requireNonNull(valueHandler, "valueHandler must not be null");
  }

  @Override
  public TypeTag tag() {
    return TypeTag.MAP;
  }

  @Override
  public void write(MessagePackWriter out, Map<K, V> value) {
    out.writeMapHeader(value.size());
    for (Map.Entry<K, V> entry : value.entrySet()) {
      keyHandler.write(out, Objects.requireNonNull(entry.getKey(), "map key is null"));
      valueHandler.write(out, Objects.requireNonNull(entry.getValue(),
          () -> "map value for key " + entry.getKey() + " is null"));
    }
  }

  @Override
  public Map<K, V> read(MessagePackReader in, Map<K, V> current) {
    final int count = in.readMapHeader();
    final Map<K, V> result = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
    for (int i = 0; i < count; i++) {
      final K key = keyHandler.read(in, null);
      result.put(key, valueHandler.read(in, null));
    }
    return result;
  }

  @Override
  public String toString() {
    return "map(" + keyHandler + ", " + valueHandler + ")";
  }
}
