package eure.document;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Generic interchange projection of a document subtree.
///
/// Format bridges (JSON, YAML, TOML) only ever see this shape. A projection taken
/// with [Document#toValue(NodeId)] is lossless: [Document#fromValue(Value)] rebuilds
/// an equal tree, extensions included.
public sealed interface Value {

  /// Leaf values. These are the only values a [NodeValue.Primitive] node holds.
  sealed interface Primitive extends Value permits TextValue, IntegerValue, FloatValue, BooleanValue, NullValue {}

  /// Text with an optional language tag. A null language means plaintext.
  record TextValue(String content, String language) implements Primitive {
    public TextValue {
      Objects.requireNonNull(content, "content must not be null");
    }

    public boolean isPlaintext() {
      return language == null;
    }
  }

  /// Arbitrary precision integer
  record IntegerValue(BigInteger value) implements Primitive {
    public IntegerValue {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  /// IEEE-754 double. Never produced from an integer literal.
  record FloatValue(double value) implements Primitive {}

  record BooleanValue(boolean value) implements Primitive {}

  record NullValue() implements Primitive {}

  /// Declared but unfilled value, with an optional label
  record HoleValue(String label) implements Value {}

  record ArrayValue(List<Value> elements) implements Value {
    public ArrayValue {
      elements = List.copyOf(elements);
    }
  }

  record TupleValue(List<Value> elements) implements Value {
    public TupleValue {
      elements = List.copyOf(elements);
      if (elements.size() > PathSegment.TupleIndex.MAX + 1) {
        throw new IllegalArgumentException("tuple arity exceeds " + (PathSegment.TupleIndex.MAX + 1));
      }
    }
  }

  /// Ordered map. Keys are identifiers or literal keys, never extensions.
  record MapValue(Map<ObjectKey, Value> entries) implements Value {
    public MapValue {
      Objects.requireNonNull(entries, "entries must not be null");
      for (final var entry : entries.entrySet()) {
        if (entry.getKey() instanceof ObjectKey.Extension e) {
          throw new IllegalArgumentException("extension key " + e + " belongs in AnnotatedValue");
        }
        Objects.requireNonNull(entry.getValue(), "map value must not be null");
      }
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
  }

  /// A value carrying extension entries such as `$type`. Extensions must be non-empty.
  record AnnotatedValue(Value value, Map<String, Value> extensions) implements Value {
    public AnnotatedValue {
      Objects.requireNonNull(value, "value must not be null");
      if (value instanceof AnnotatedValue) {
        throw new IllegalArgumentException("AnnotatedValue must not wrap another AnnotatedValue");
      }
      if (extensions.isEmpty()) {
        throw new IllegalArgumentException("AnnotatedValue requires at least one extension");
      }
      extensions.keySet().forEach(name -> Identifiers.require(name, "extension identifier"));
      extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }
  }

  static TextValue text(String content) {
    return new TextValue(content, null);
  }

  static TextValue text(String content, String language) {
    return new TextValue(content, language);
  }

  static IntegerValue integer(long value) {
    return new IntegerValue(BigInteger.valueOf(value));
  }

  static FloatValue floating(double value) {
    return new FloatValue(value);
  }

  static BooleanValue bool(boolean value) {
    return new BooleanValue(value);
  }

  static NullValue nul() {
    return new NullValue();
  }

  static HoleValue hole() {
    return new HoleValue(null);
  }

  /// Value without its extensions, at this level only
  default Value unannotated() {
    return this instanceof AnnotatedValue a ? a.value() : this;
  }

  /// Short kind name used in diagnostics
  default String kindName() {
    if (this instanceof TextValue) return "text";
    if (this instanceof IntegerValue) return "integer";
    if (this instanceof FloatValue) return "float";
    if (this instanceof BooleanValue) return "boolean";
    if (this instanceof NullValue) return "null";
    if (this instanceof HoleValue) return "hole";
    if (this instanceof ArrayValue) return "array";
    if (this instanceof TupleValue) return "tuple";
    if (this instanceof MapValue) return "map";
    return ((AnnotatedValue) this).value().kindName();
  }
}
