package eure.schema;

import eure.document.Document;
import eure.document.EurePath;
import eure.document.Node;
import eure.document.NodeId;
import eure.document.NodeValue;
import eure.document.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static eure.schema.Annotations.*;

/// Reads constraint annotations (`$min`, `$pattern`, `$length`, ...) and narrows a base schema with them
final class Constraints {

  /// `[0, 100)`, `(, 5]`, `[-1.5, 2.5]`; an empty endpoint is unbounded
  private static final Pattern INTERVAL =
      Pattern.compile("\\s*([\\[(])\\s*([^,\\s]*)\\s*,\\s*([^\\])\\s]*)\\s*([\\])])\\s*");

  private final Document doc;
  private final Node node;
  private final EurePath path;

  private Constraints(Document doc, Node node, EurePath path) {
    this.doc = doc;
    this.node = node;
    this.path = path;
  }

  /// True when `node` carries any constraint annotation
  static boolean present(Node node) {
    return CONSTRAINTS.stream().anyMatch(node.extensions()::containsKey);
  }

  static SchemaNodeContent apply(Document doc, NodeId id, EurePath path, SchemaNodeContent base) {
    final var node = doc.node(id);
    if (!present(node)) {
      return base;
    }
    final var reader = new Constraints(doc, node, path);
    if (base instanceof SchemaNodeContent.TextSchema text) return reader.text(text);
    if (base instanceof SchemaNodeContent.IntegerSchema integer) return reader.integer(integer);
    if (base instanceof SchemaNodeContent.FloatSchema floating) return reader.floating(floating);
    if (base instanceof SchemaNodeContent.ArraySchema array) return reader.array(array);
    if (base instanceof SchemaNodeContent.MapSchema map) return reader.map(map);
    reader.onlyAllowed(Set.of(), base.kindName());
    return base;
  }

  private SchemaNodeContent text(SchemaNodeContent.TextSchema base) {
    onlyAllowed(TEXT_CONSTRAINTS, "text");
    final var bounds = lengths(base.minLength(), base.maxLength());
    String pattern = base.pattern();
    if (has(PATTERN)) {
      pattern = plainText(PATTERN);
      try {
        Pattern.compile(pattern);
      } catch (PatternSyntaxException e) {
        throw malformed(PATTERN, "invalid regular expression: " + e.getDescription());
      }
    }
    return new SchemaNodeContent.TextSchema(bounds.min(), bounds.max(), pattern, base.language());
  }

  private SchemaNodeContent array(SchemaNodeContent.ArraySchema base) {
    onlyAllowed(ARRAY_CONSTRAINTS, "array");
    final var bounds = lengths(base.minLength(), base.maxLength());
    boolean unique = base.unique();
    if (has(UNIQUE)) {
      if (!(primitive(UNIQUE) instanceof Value.BooleanValue b)) {
        throw malformed(UNIQUE, "expected a boolean");
      }
      unique = b.value();
    }
    return new SchemaNodeContent.ArraySchema(base.item(), bounds.min(), bounds.max(), unique);
  }

  private SchemaNodeContent map(SchemaNodeContent.MapSchema base) {
    onlyAllowed(MAP_CONSTRAINTS, "map");
    final Integer min = has(MIN_SIZE) ? count(MIN_SIZE) : base.minSize();
    final Integer max = has(MAX_SIZE) ? count(MAX_SIZE) : base.maxSize();
    if (min != null && max != null && min > max) {
      throw malformed(MIN_SIZE, "min-size " + min + " exceeds max-size " + max);
    }
    return new SchemaNodeContent.MapSchema(base.key(), base.value(), min, max);
  }

  private SchemaNodeContent integer(SchemaNodeContent.IntegerSchema base) {
    onlyAllowed(NUMERIC_CONSTRAINTS, "integer");
    final var range = range(base.min(), base.max(), this::integerValue, BigInteger::new);
    BigInteger multipleOf = base.multipleOf();
    if (has(MULTIPLE_OF)) {
      multipleOf = integerValue(primitive(MULTIPLE_OF), MULTIPLE_OF);
      if (multipleOf.signum() <= 0) {
        throw malformed(MULTIPLE_OF, "must be positive, got " + multipleOf);
      }
    }
    return new SchemaNodeContent.IntegerSchema(range.min(), range.max(), multipleOf);
  }

  private SchemaNodeContent floating(SchemaNodeContent.FloatSchema base) {
    onlyAllowed(NUMERIC_CONSTRAINTS, "float");
    final var range = range(base.min(), base.max(), this::decimalValue, BigDecimal::new);
    BigDecimal multipleOf = base.multipleOf();
    if (has(MULTIPLE_OF)) {
      multipleOf = decimalValue(primitive(MULTIPLE_OF), MULTIPLE_OF);
      if (multipleOf.signum() <= 0) {
        throw malformed(MULTIPLE_OF, "must be positive, got " + multipleOf);
      }
    }
    return new SchemaNodeContent.FloatSchema(range.min(), range.max(), multipleOf);
  }

  private record Range<T extends Comparable<T>>(Bound<T> min, Bound<T> max) {}

  /// Converts the value of a numeric annotation, naming the annotation in errors
  @FunctionalInterface
  private interface BoundReader<T> {
    T read(Value value, String annotation);
  }

  private <T extends Comparable<T>> Range<T> range(Bound<T> min, Bound<T> max,
                                                   BoundReader<T> reader,
                                                   Function<String, T> textReader) {
    if (has(MIN) && has(EXCLUSIVE_MIN)) {
      throw malformed(EXCLUSIVE_MIN, "cannot be combined with $min");
    }
    if (has(MAX) && has(EXCLUSIVE_MAX)) {
      throw malformed(EXCLUSIVE_MAX, "cannot be combined with $max");
    }
    if (has(RANGE)) {
      if (has(MIN) || has(MAX) || has(EXCLUSIVE_MIN) || has(EXCLUSIVE_MAX)) {
        throw malformed(RANGE, "cannot be combined with $min, $max or their exclusive forms");
      }
      final var parsed = rangeValue(reader, textReader);
      min = parsed.min();
      max = parsed.max();
    }
    if (has(MIN)) min = Bound.inclusive(reader.read(primitive(MIN), MIN));
    if (has(EXCLUSIVE_MIN)) min = Bound.exclusive(reader.read(primitive(EXCLUSIVE_MIN), EXCLUSIVE_MIN));
    if (has(MAX)) max = Bound.inclusive(reader.read(primitive(MAX), MAX));
    if (has(EXCLUSIVE_MAX)) max = Bound.exclusive(reader.read(primitive(EXCLUSIVE_MAX), EXCLUSIVE_MAX));
    if (isEmpty(min, max)) {
      throw malformed(has(RANGE) ? RANGE : MIN, "empty range " + Bound.describe(min, max));
    }
    return new Range<>(min, max);
  }

  private <T extends Comparable<T>> Range<T> rangeValue(BoundReader<T> reader,
                                                        Function<String, T> textReader) {
    final var rangeId = node.extension(RANGE).orElseThrow();
    final var content = doc.node(rangeId).content();
    if (content instanceof NodeValue.NodeTuple tuple && tuple.items().size() == 2) {
      return new Range<>(
          tupleEnd(tuple.items().get(0), reader),
          tupleEnd(tuple.items().get(1), reader));
    }
    if (content instanceof NodeValue.Primitive p && p.value() instanceof Value.TextValue text) {
      final var m = INTERVAL.matcher(text.content());
      if (!m.matches()) {
        throw malformed(RANGE, "expected interval text like \"[0, 100)\", got " + text.content());
      }
      try {
        final Bound<T> min = m.group(2).isEmpty() ? Bound.unbounded()
            : m.group(1).equals("[") ? Bound.inclusive(textReader.apply(m.group(2)))
            : Bound.exclusive(textReader.apply(m.group(2)));
        final Bound<T> max = m.group(3).isEmpty() ? Bound.unbounded()
            : m.group(4).equals("]") ? Bound.inclusive(textReader.apply(m.group(3)))
            : Bound.exclusive(textReader.apply(m.group(3)));
        return new Range<>(min, max);
      } catch (NumberFormatException e) {
        throw malformed(RANGE, "invalid interval endpoint in " + text.content());
      }
    }
    throw malformed(RANGE, "expected a (min, max) tuple or interval text");
  }

  /// Tuple ends are inclusive; `null` leaves that end open
  private <T extends Comparable<T>> Bound<T> tupleEnd(NodeId id, BoundReader<T> reader) {
    final var content = doc.node(id).content();
    if (!(content instanceof NodeValue.Primitive p)) {
      throw malformed(RANGE, "expected a number or null, got " + content.kindName());
    }
    if (p.value() instanceof Value.NullValue) {
      return Bound.unbounded();
    }
    return Bound.inclusive(reader.read(p.value(), RANGE));
  }

  private BigInteger integerValue(Value value, String annotation) {
    if (value instanceof Value.IntegerValue i) {
      return i.value();
    }
    if (value instanceof Value.FloatValue) {
      throw malformed(annotation, "float bound on an integer type");
    }
    throw malformed(annotation, "expected an integer, got " + value.kindName());
  }

  private BigDecimal decimalValue(Value value, String annotation) {
    if (value instanceof Value.IntegerValue i) {
      return new BigDecimal(i.value());
    }
    if (value instanceof Value.FloatValue f) {
      if (!Double.isFinite(f.value())) {
        throw malformed(annotation, "bound must be finite, got " + f.value());
      }
      return BigDecimal.valueOf(f.value());
    }
    throw malformed(annotation, "expected a number, got " + value.kindName());
  }

  private static <T extends Comparable<T>> boolean isEmpty(Bound<T> min, Bound<T> max) {
    final T lo = min instanceof Bound.Inclusive<T> in ? in.value() : min instanceof Bound.Exclusive<T> ex ? ex.value() : null;
    final T hi = max instanceof Bound.Inclusive<T> in ? in.value() : max instanceof Bound.Exclusive<T> ex ? ex.value() : null;
    if (lo == null || hi == null) {
      return false;
    }
    final int cmp = lo.compareTo(hi);
    return cmp > 0 || (cmp == 0 && (min instanceof Bound.Exclusive || max instanceof Bound.Exclusive));
  }

  private record Lengths(Integer min, Integer max) {}

  /// Reads `$length`, `$min-length` and `$max-length` over the given defaults
  private Lengths lengths(Integer min, Integer max) {
    if (has(LENGTH)) {
      if (has(MIN_LENGTH) || has(MAX_LENGTH)) {
        throw malformed(LENGTH, "cannot be combined with $min-length or $max-length");
      }
      final var content = doc.node(node.extension(LENGTH).orElseThrow()).content();
      if (content instanceof NodeValue.NodeTuple tuple && tuple.items().size() == 2) {
        min = lengthEnd(tuple.items().get(0));
        max = lengthEnd(tuple.items().get(1));
      } else {
        min = count(LENGTH);
        max = min;
      }
    }
    if (has(MIN_LENGTH)) min = count(MIN_LENGTH);
    if (has(MAX_LENGTH)) max = count(MAX_LENGTH);
    if (min != null && max != null && min > max) {
      throw malformed(has(LENGTH) ? LENGTH : MIN_LENGTH, "min-length " + min + " exceeds max-length " + max);
    }
    return new Lengths(min, max);
  }

  private Integer lengthEnd(NodeId id) {
    final var content = doc.node(id).content();
    if (content instanceof NodeValue.Primitive p) {
      if (p.value() instanceof Value.NullValue) return null;
      return toCount(p.value(), LENGTH);
    }
    throw malformed(LENGTH, "expected a non-negative integer or null, got " + content.kindName());
  }

  private Integer count(String annotation) {
    return toCount(primitive(annotation), annotation);
  }

  private Integer toCount(Value value, String annotation) {
    if (value instanceof Value.IntegerValue i
        && i.value().signum() >= 0
        && i.value().compareTo(BigInteger.valueOf(Integer.MAX_VALUE)) <= 0) {
      return i.value().intValue();
    }
    throw malformed(annotation, "expected a non-negative integer, got " + value.kindName() + " " + display(value));
  }

  private String plainText(String annotation) {
    if (primitive(annotation) instanceof Value.TextValue t && t.isPlaintext()) {
      return t.content();
    }
    throw malformed(annotation, "expected plaintext");
  }

  private Value primitive(String annotation) {
    final var content = doc.node(node.extension(annotation).orElseThrow()).content();
    if (content instanceof NodeValue.Primitive p) {
      return p.value();
    }
    throw malformed(annotation, "expected a single value, got " + content.kindName());
  }

  private boolean has(String annotation) {
    return node.extensions().containsKey(annotation);
  }

  private void onlyAllowed(Set<String> allowed, String kind) {
    for (final var name : CONSTRAINTS) {
      if (has(name) && !allowed.contains(name)) {
        throw malformed(name, "does not apply to " + kind);
      }
    }
  }

  private SchemaException malformed(String annotation, String detail) {
    return new SchemaException(SchemaException.Kind.MALFORMED_CONSTRAINT, path.appendExtension(annotation),
        "$" + annotation, detail);
  }

  private static String display(Value value) {
    if (value instanceof Value.IntegerValue i) return i.value().toString();
    if (value instanceof Value.FloatValue f) return Double.toString(f.value());
    if (value instanceof Value.TextValue t) return "\"" + t.content() + "\"";
    return value.kindName();
  }
}
