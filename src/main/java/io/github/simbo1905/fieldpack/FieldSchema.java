// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.github.simbo1905.fieldpack.MessagePack.LOGGER;

/// The ordered, named member bindings of a composite type. Built once per type, immutable, shared by every encode and
/// decode of that type. Fields are written in declaration order; decode matches them by name.
///
/// ```java
/// static final FieldSchema<Outer> SCHEMA = FieldSchema.builder(Outer.class, Outer::new)
///     .field("name", TypeHandlers.string(), Outer::getName, Outer::setName)
///     .field("inner", TypeHandlers.composite(Inner.SCHEMA), Outer::getInner, Outer::setInner)
///     .build();
/// ```
public final class FieldSchema<T> {
  private final Class<T> type;
  private final Supplier<T> factory;
  private final List<FieldDescriptor<T, ?>> fields;
  private final Map<String, FieldDescriptor<T, ?>> fieldsByName;
  private final int maxKeyLength;

  private FieldSchema(Class<T> type, Supplier<T> factory, List<FieldDescriptor<T, ?>> fields) {
    this.type = type;
    this.factory = factory;
    this.fields = List.copyOf(fields);
    final Map<String, FieldDescriptor<T, ?>> byName = new HashMap<>();
    fields.forEach(field -> byName.put(field.name(), field));
    this.fieldsByName = Map.copyOf(byName);
    this.maxKeyLength = fields.stream()
        .mapToInt(field -> field.name().getBytes(StandardCharsets.UTF_8).length)
        .max()
        .orElse(0);
  }

  public static <T> Builder<T> builder(Class<T> type, Supplier<T> factory) {
    return new Builder<>(type, factory);
  }

  public Class<T> type() {
    return type;
  }

  public List<FieldDescriptor<T, ?>> fields() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  /// Exact, case-sensitive lookup by wire key.
  public Optional<FieldDescriptor<T, ?>> field(String name) {
    return Optional.ofNullable(fieldsByName.get(name));
  }

  /// UTF-8 length of the widest field name. Longer wire keys cannot match and are skipped without being decoded.
  public int maxKeyLength() {
    return maxKeyLength;
  }

  /// A fresh instance holding the type's default field values.
  public T newInstance() {
    return Objects.requireNonNull(factory.get(), () -> "Factory of " + type.getName() + " returned null");
  }

  @Override
  public String toString() {
    return type.getSimpleName() + fields.stream()
        .map(field -> field.name() + ":" + field.handler())
        .collect(Collectors.joining(", ", "{", "}"));
  }

  public static final class Builder<T> {
    private final Class<T> type;
    private final Supplier<T> factory;
    private final List<FieldDescriptor<T, ?>> fields = new ArrayList<>();

    private Builder(Class<T> type, Supplier<T> factory) {
      this.type = Objects.requireNonNull(type, "type must not be null");
      this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /// A member with an explicit handler. A bounded [TypeHandlers#string(int)] handler records its bound as the
    /// field's `maxLength`.
    public <V> Builder<T> field(String name, TypeHandler<V> handler, Function<T, V> getter, BiConsumer<T, V> setter) {
      final OptionalInt maxLength = handler instanceof ScalarHandler<?> scalar
          ? scalar.maxLength()
          : OptionalInt.empty();
      return add(new FieldDescriptor<>(name, handler, getter, setter, maxLength));
    }

    /// A member whose handler is resolved from its Java class, see [TypeHandlers#forClass(Class)].
    public <V> Builder<T> field(String name, Class<V> memberType, Function<T, V> getter, BiConsumer<T, V> setter) {
      return field(name, TypeHandlers.forClass(memberType), getter, setter);
    }

    /// A string member truncated on write, and bounded on read, to `maxLength` UTF-8 bytes.
    public Builder<T> string(String name, int maxLength, Function<T, String> getter, BiConsumer<T, String> setter) {
      return field(name, TypeHandlers.string(maxLength), getter, setter);
    }

    private Builder<T> add(FieldDescriptor<T, ?> field) {
      if (fields.stream().anyMatch(existing -> existing.name().equals(field.name()))) {
        throw new IllegalArgumentException("Duplicate field name '" + field.name() + "' in schema of " + type.getName());
      }
      fields.add(field);
      return this;
    }

    public FieldSchema<T> build() {
      final FieldSchema<T> schema = new FieldSchema<>(type, factory, fields);
      LOGGER.fine(() -> "Built field schema " + schema);
      return schema;
    }
  }
}
