// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.github.simbo1905.fieldpack.MessagePack.LOGGER;

/// Handler for a tagged union modelled as a sealed interface `V` with one implementing type per alternative.
///
/// Encode writes the active alternative exactly as its own handler would, with no discriminant.
/// Decode peeks the wire tag and commits to the first alternative, in declaration order, whose handler accepts it.
/// Integer and UInt are different tags, as are Float32 and Float64; composites accept a Map.
/// The chosen alternative is always decoded fresh, never into the current value.
///
/// Two alternatives with the same wire shape, such as two composites, cannot be told apart: the first declared
/// always wins no matter which one was encoded. No attempt is made to inspect the keys of a map to disambiguate.
///
/// ```java
/// sealed interface Data permits Flag, Reading {}
/// record Flag(boolean value) implements Data {}
/// record Reading(double value) implements Data {}
///
/// TypeHandler<Data> data = VariantHandler.builder(Data.class)
///     .alternative(Flag.class, TypeHandlers.bool(), Flag::new, Flag::value)
///     .alternative(Reading.class, TypeHandlers.float64(), Reading::new, Reading::value)
///     .build();
/// ```
public final class VariantHandler<V> implements TypeHandler<V> {

  /// One alternative: the Java type that marks it active, the handler for its wire form and the conversions between.
  record Alternative<V, A>(Class<? extends V> type, TypeHandler<A> handler,
                           Function<A, ? extends V> wrap, Function<V, A> unwrap) {
    Alternative {
      Objects.requireNonNull(type, "type must not be null");
      Objects.requireNonNull(handler, "handler must not be null");
      Objects.requireNonNull(wrap, "wrap must not be null");
      Objects.requireNonNull(unwrap, "unwrap must not be null");
    }
  }

  private final Class<V> type;
  private final List<Alternative<V, ?>> alternatives;

  private VariantHandler(Class<V> type, List<Alternative<V, ?>> alternatives) {
    this.type = type;
    this.alternatives = List.copyOf(alternatives);
  }

  public static <V> Builder<V> builder(Class<V> type) {
    return new Builder<>(type);
  }

  /// The shape of the first declared alternative. Use [#accepts(TypeTag)] to test a wire tag.
  @Override
  public TypeTag tag() {
    return alternatives.get(0).handler().tag();
  }

  @Override
  public boolean accepts(TypeTag wireTag) {
    return alternatives.stream().anyMatch(alternative -> alternative.handler().accepts(wireTag));
  }

  @Override
  public void write(MessagePackWriter out, V value) {
    for (Alternative<V, ?> alternative : alternatives) {
      if (alternative.type().isInstance(value)) {
        writeAlternative(alternative, out, value);
        return;
      }
    }
    throw new IllegalArgumentException("Value of " + value.getClass().getName() + " is not an alternative of " +
        type.getName());
  }

  @Override
  public V read(MessagePackReader in, V current) {
    final int position = in.position();
    final WireTag tag = in.peekTag();
    for (int i = 0; i < alternatives.size(); i++) {
      final Alternative<V, ?> alternative = alternatives.get(i);
      if (alternative.handler().accepts(tag.type())) {
        final int index = i;
        LOGGER.finer(() -> type.getSimpleName() + " resolved wire tag " + tag.type() + " at position " + position +
            " to alternative " + index + " " + alternative.type().getSimpleName());
        return readAlternative(alternative, in);
      }
    }
    throw new DecodeException(ErrorCode.NO_MATCHING_VARIANT, "No alternative of " + type.getSimpleName() +
        " accepts " + tag.type() + " at position " + position);
  }

  private static <V, A> void writeAlternative(Alternative<V, A> alternative, MessagePackWriter out, V value) {
    alternative.handler().write(out, alternative.unwrap().apply(value));
  }

  private static <V, A> V readAlternative(Alternative<V, A> alternative, MessagePackReader in) {
    return alternative.wrap().apply(alternative.handler().read(in, null));
  }

  @Override
  public String toString() {
    return "variant(" + alternatives.stream()
        .map(alternative -> alternative.type().getSimpleName())
        .collect(Collectors.joining(", ")) + ")";
  }

  /// Collects alternatives in declaration order, which is also the order they are tried in on decode.
  public static final class Builder<V> {
    private final Class<V> type;
    private final List<Alternative<V, ?>> alternatives = new ArrayList<>();

    private Builder(Class<V> type) {
      this.type = Objects.requireNonNull(type, "type must not be null");
    }

    /// An alternative that is its own wire form, typically a composite implementing `V`.
    public <W extends V> Builder<V> alternative(Class<W> alternativeType, TypeHandler<W> handler) {
      final Function<W, V> wrap = value -> value;
      return add(new Alternative<>(alternativeType, handler, wrap, alternativeType::cast));
    }

    /// An alternative of type `W` that wraps a value of type `A`, typically a record around a scalar.
    public <W extends V, A> Builder<V> alternative(Class<W> alternativeType, TypeHandler<A> handler,
                                                   Function<A, W> wrap, Function<W, A> unwrap) {
      Objects.requireNonNull(alternativeType, "alternativeType must not be null");
      Objects.requireNonNull(unwrap, "unwrap must not be null");
      final Function<V, A> narrowing = value -> unwrap.apply(alternativeType.cast(value));
      return add(new Alternative<>(alternativeType, handler, wrap, narrowing));
    }

    private Builder<V> add(Alternative<V, ?> alternative) {
      alternatives.stream()
          .filter(earlier -> overlaps(earlier.handler(), alternative.handler()))
          .findFirst()
          .ifPresent(earlier -> LOGGER.fine(() -> type.getSimpleName() + " alternatives " +
              earlier.type().getSimpleName() + " and " + alternative.type().getSimpleName() + " share wire shape " +
              sharedTag(earlier.handler(), alternative.handler()) + "; decode will always pick " +
              earlier.type().getSimpleName()));
      alternatives.add(alternative);
      return this;
    }

    /// Whether some wire tag is accepted by both handlers, so that the later one can never be chosen for it.
    static boolean overlaps(TypeHandler<?> earlier, TypeHandler<?> later) {
      return sharedTag(earlier, later) != null;
    }

    private static TypeTag sharedTag(TypeHandler<?> earlier, TypeHandler<?> later) {
      for (TypeTag wireTag : TypeTag.values()) {
        if (wireTag != TypeTag.CUSTOM_OBJECT && earlier.accepts(wireTag) && later.accepts(wireTag)) {
          return wireTag;
        }
      }
      return null;
    }

    public VariantHandler<V> build() {
      if (alternatives.isEmpty()) {
        throw new IllegalArgumentException("Variant " + type.getName() + " must have at least one alternative");
      }
      return new VariantHandler<>(type, alternatives);
    }
  }
}
