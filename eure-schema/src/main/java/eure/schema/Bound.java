package eure.schema;

import java.util.Objects;

/// One end of a numeric range
public sealed interface Bound<T extends Comparable<T>> {

  record Unbounded<T extends Comparable<T>>() implements Bound<T> {}

  record Inclusive<T extends Comparable<T>>(T value) implements Bound<T> {
    public Inclusive {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  record Exclusive<T extends Comparable<T>>(T value) implements Bound<T> {
    public Exclusive {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  static <T extends Comparable<T>> Bound<T> unbounded() {
    return new Unbounded<>();
  }

  static <T extends Comparable<T>> Bound<T> inclusive(T value) {
    return new Inclusive<>(value);
  }

  static <T extends Comparable<T>> Bound<T> exclusive(T value) {
    return new Exclusive<>(value);
  }

  default boolean isBounded() {
    return !(this instanceof Unbounded);
  }

  /// True when `candidate` is on the allowed side of this bound used as a minimum
  default boolean admitsAbove(T candidate) {
    if (this instanceof Inclusive<T> in) return candidate.compareTo(in.value()) >= 0;
    if (this instanceof Exclusive<T> ex) return candidate.compareTo(ex.value()) > 0;
    return true;
  }

  /// True when `candidate` is on the allowed side of this bound used as a maximum
  default boolean admitsBelow(T candidate) {
    if (this instanceof Inclusive<T> in) return candidate.compareTo(in.value()) <= 0;
    if (this instanceof Exclusive<T> ex) return candidate.compareTo(ex.value()) < 0;
    return true;
  }

  /// Interval notation for messages, e.g. `[0` or `10)`
  static String describe(Bound<?> min, Bound<?> max) {
    final var sb = new StringBuilder();
    if (min instanceof Inclusive<?> in) sb.append('[').append(in.value());
    else if (min instanceof Exclusive<?> ex) sb.append('(').append(ex.value());
    else sb.append("(-inf");
    sb.append(", ");
    if (max instanceof Inclusive<?> in) sb.append(in.value()).append(']');
    else if (max instanceof Exclusive<?> ex) sb.append(ex.value()).append(')');
    else sb.append("+inf)");
    return sb.toString();
  }
}
