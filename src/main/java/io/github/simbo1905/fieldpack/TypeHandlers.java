// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.IntFunction;
import java.util.function.LongFunction;

/// The built-in [TypeHandler]s, listed in the priority order in which a Java type is matched to one.
/// Composite and collection handlers take the handlers of their elements, so any nesting is expressed by nesting calls:
///
/// ```java
/// TypeHandler<Map<String, List<Optional<Integer>>>> handler =
///     TypeHandlers.map(TypeHandlers.string(), TypeHandlers.list(TypeHandlers.optional(TypeHandlers.int32())));
/// ```
public final class TypeHandlers {

  private TypeHandlers() {
  }

  /// 1. `boolean` as wire Bool.
  public static TypeHandler<Boolean> bool() {
    return new ScalarHandler<>(TypeTag.BOOL, "bool", MessagePackWriter::writeBool, MessagePackReader::readBool);
  }

  /// 2. Unsigned 8-bit held in an `Integer`, as wire UInt.
  public static TypeHandler<Integer> uint8() {
    return unsigned("uint8", Byte.SIZE, value -> (int) value);
  }

  /// 2. Unsigned 16-bit held in an `Integer`, as wire UInt.
  public static TypeHandler<Integer> uint16() {
    return unsigned("uint16", Short.SIZE, value -> (int) value);
  }

  /// 2. Unsigned 32-bit held in a `Long`, as wire UInt.
  public static TypeHandler<Long> uint32() {
    return unsigned("uint32", Integer.SIZE, value -> value);
  }

  /// 2. Unsigned 64-bit held in the raw bits of a `Long`, as wire UInt. Use [Long#toUnsignedString(long)] to show it.
  public static TypeHandler<Long> uint64() {
    return unsigned("uint64", Long.SIZE, value -> value);
  }

  /// 3. `byte` as wire Integer.
  public static TypeHandler<Byte> int8() {
    return signed("int8", Byte.SIZE, value -> (byte) value);
  }

  /// 3. `short` as wire Integer.
  public static TypeHandler<Short> int16() {
    return signed("int16", Short.SIZE, value -> (short) value);
  }

  /// 3. `int` as wire Integer.
  public static TypeHandler<Integer> int32() {
    return signed("int32", Integer.SIZE, value -> (int) value);
  }

  /// 3. `long` as wire Integer.
  public static TypeHandler<Long> int64() {
    return signed("int64", Long.SIZE, value -> value);
  }

  /// 4. `float` as wire Float32. A Float64 on the wire is a type mismatch.
  public static TypeHandler<Float> float32() {
    return new ScalarHandler<>(TypeTag.FLOAT32, "float32", MessagePackWriter::writeFloat32,
        MessagePackReader::readFloat32);
  }

  /// 4. `double` as wire Float64. A Float32 on the wire is a type mismatch.
  public static TypeHandler<Double> float64() {
    return new ScalarHandler<>(TypeTag.FLOAT64, "float64", MessagePackWriter::writeFloat64,
        MessagePackReader::readFloat64);
  }

  /// 5. `String` as wire String in UTF-8.
  public static TypeHandler<String> string() {
    return new ScalarHandler<>(TypeTag.STRING, "string", MessagePackWriter::writeString,
        in -> in.readString());
  }

  /// 5. `String` as wire String limited to `maxLength` UTF-8 bytes. Longer values are cut at a code point boundary
  /// when written and when read.
  public static TypeHandler<String> string(int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must not be negative, got: " + maxLength);
    }
    return new ScalarHandler<>(TypeTag.STRING, "string(" + maxLength + ")",
        (out, value) -> {
          final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
          out.writeString(utf8, 0, Companion.utf8Prefix(utf8, maxLength));
        },
        in -> in.readString(maxLength), OptionalInt.of(maxLength));
  }

  /// `byte[]` as wire Binary.
  public static TypeHandler<byte[]> binary() {
    return new ScalarHandler<>(TypeTag.BINARY, "binary", MessagePackWriter::writeBinary,
        MessagePackReader::readBinary);
  }

  /// 6. [Extension] with a payload of exactly `capacity` bytes. A larger wire payload fails to decode with
  /// [ErrorCode#BUFFER_TOO_SMALL].
  public static TypeHandler<Extension> extension(int capacity) {
    return new ExtensionHandler(capacity);
  }

  /// 7. [Optional] as Nil when empty, otherwise as the wrapped value.
  public static <U> TypeHandler<Optional<U>> optional(TypeHandler<U> valueHandler) {
    return new OptionalHandler<>(valueHandler);
  }

  /// 8. An array of exactly `length` elements. A different wire count fails with [ErrorCode#ARRAY_LENGTH_MISMATCH].
  public static <E> TypeHandler<E[]> array(TypeHandler<E> elementHandler, int length, IntFunction<E[]> generator) {
    return new ArrayHandler<>(elementHandler, length, generator);
  }

  /// 9. A [List] of any length.
  public static <E> TypeHandler<List<E>> list(TypeHandler<E> elementHandler) {
    return new ListHandler<>(elementHandler);
  }

  /// 10. A [Map] as wire Map.
  public static <K, V> TypeHandler<Map<K, V>> map(TypeHandler<K> keyHandler, TypeHandler<V> valueHandler) {
    return new MapHandler<>(keyHandler, valueHandler);
  }

  /// 11. A tagged union; add its alternatives in the order they should be tried.
  public static <V> VariantHandler.Builder<V> variant(Class<V> type) {
    return VariantHandler.builder(type);
  }

  /// 12. Any type with a [FieldSchema], as a map keyed by field name.
  public static <T> TypeHandler<T> composite(FieldSchema<T> schema) {
    return new CompositeHandler<>(schema);
  }

  /// Resolve the handler of a scalar Java class in the priority order above. Unsigned handlers have no Java class of
  /// their own and must be asked for by name, as must extensions, containers, variants and composites.
  /// @throws IllegalArgumentException if the class is not a supported scalar
  @SuppressWarnings("unchecked")
  public static <T> TypeHandler<T> forClass(Class<T> type) {
    final TypeHandler<?> handler;
    if (type == Boolean.class || type == boolean.class) {
      handler = bool();
    } else if (type == Byte.class || type == byte.class) {
      handler = int8();
    } else if (type == Short.class || type == short.class) {
      handler = int16();
    } else if (type == Integer.class || type == int.class) {
      handler = int32();
    } else if (type == Long.class || type == long.class) {
      handler = int64();
    } else if (type == Float.class || type == float.class) {
      handler = float32();
    } else if (type == Double.class || type == double.class) {
      handler = float64();
    } else if (type == String.class) {
      handler = string();
    } else if (type == byte[].class) {
      handler = binary();
    } else {
      throw new IllegalArgumentException("Unsupported type: " + type.getName() + ". Only scalar classes resolve " +
          "by class; build extensions, containers, variants and composites with the TypeHandlers factories");
    }
    return (TypeHandler<T>) handler;
  }

  private static <T> @NotNull TypeHandler<T> signed(String name, int bits, LongFunction<T> box) {
    final NarrowingMode mode = NarrowingMode.current();
    return new ScalarHandler<>(TypeTag.INTEGER, name,
        (out, value) -> out.writeInt(((Number) value).longValue()),
        in -> box.apply(Companion.readIntegral(in, bits, false, mode, name)));
  }

  private static <T> @NotNull TypeHandler<T> unsigned(String name, int bits, LongFunction<T> box) {
    final NarrowingMode mode = NarrowingMode.current();
    return new ScalarHandler<>(TypeTag.UINT, name,
        (out, value) -> out.writeUInt(Companion.truncate(((Number) value).longValue(), bits, true)),
        in -> box.apply(Companion.readIntegral(in, bits, true, mode, name)));
  }
}
