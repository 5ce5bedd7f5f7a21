package eure.schema;

import eure.document.Document;
import eure.document.EurePath;
import eure.document.Node;
import eure.document.NodeId;
import eure.document.NodeValue;
import eure.document.ObjectKey;
import eure.document.Value;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static eure.schema.SchemaLogging.LOG;

/// Validates documents against a [SchemaDocument].
///
/// Validation runs in two passes over an explicit work stack. The structural pass
/// checks every node against its schema and treats a Hole as matching anything.
/// The completeness pass then reports required Holes as `MISSING_FIELD`.
///
/// Instances are immutable and can validate many documents concurrently.
public final class SchemaValidator {

  private final SchemaDocument schema;
  private final ValidationOptions options;
  private final Map<SchemaNodeId, Pattern> patterns;

  private SchemaValidator(SchemaDocument schema, ValidationOptions options, Map<SchemaNodeId, Pattern> patterns) {
    this.schema = schema;
    this.options = options;
    this.patterns = patterns;
  }

  public static SchemaValidator of(SchemaDocument schema) {
    return of(schema, ValidationOptions.DEFAULT);
  }

  /// Creates a validator. System property overrides are applied to `options` here, once.
  /// @throws ValidatorException if a stored pattern does not compile
  public static SchemaValidator of(SchemaDocument schema, ValidationOptions options) {
    Objects.requireNonNull(schema, "schema must not be null");
    Objects.requireNonNull(options, "options must not be null");
    final var effective = options.withSystemOverrides();
    LOG.fine(() -> "SchemaValidator for " + schema + " with " + effective.summary());
    final var patterns = new HashMap<SchemaNodeId, Pattern>();
    for (int i = 0; i < schema.size(); i++) {
      final var id = new SchemaNodeId(i);
      if (schema.node(id).content() instanceof SchemaNodeContent.TextSchema text && text.pattern() != null) {
        try {
          patterns.put(id, Pattern.compile(text.pattern()));
        } catch (PatternSyntaxException e) {
          throw new ValidatorException("schema node " + id + " has an invalid pattern: " + e.getDescription(), e);
        }
      }
    }
    return new SchemaValidator(schema, effective, Collections.unmodifiableMap(patterns));
  }

  public SchemaDocument schema() {
    return schema;
  }

  public ValidationOptions options() {
    return options;
  }

  /// Both passes against the root schema
  /// @throws ValidatorException if the schema turns out to be corrupt
  public ValidationResult validate(Document document) {
    return validateFrom(document, schema.root());
  }

  /// Both passes against the named type
  /// @throws IllegalArgumentException if the registry has no such type
  public ValidationResult validate(Document document, String typeName) {
    final var id = schema.type(typeName)
        .orElseThrow(() -> new IllegalArgumentException("unknown type: " + typeName));
    return validateFrom(document, id);
  }

  public ValidationResult validateStructure(Document document) {
    Objects.requireNonNull(document, "document must not be null");
    return new Walk(document).run(schema.root());
  }

  public ValidationResult checkCompleteness(Document document) {
    Objects.requireNonNull(document, "document must not be null");
    return new CompletenessChecker(schema, document, options).check(schema.root());
  }

  private ValidationResult validateFrom(Document document, SchemaNodeId start) {
    Objects.requireNonNull(document, "document must not be null");
    StructuredLog.fine(LOG, "validate.start", "document", document, "schema", start, "options", options.summary());
    final var structural = new Walk(document).run(start);
    final var result = structural.merge(new CompletenessChecker(schema, document, options).check(start));
    StructuredLog.fine(LOG, "validate.done", "errors", result.errors().size(), "warnings", result.warnings().size());
    return result;
  }

  /// One structural pass over one document
  private final class Walk {
    private final Document doc;
    private final VariantSelector selector;
    private final List<ValidationError> errors = new ArrayList<>();
    private final List<ValidationWarning> warnings = new ArrayList<>();
    private final Set<NodeId> inspectedExtensions = new HashSet<>();

    Walk(Document doc) {
      this.doc = doc;
      this.selector = new VariantSelector(schema, doc, options.unionTagMode());
    }

    ValidationResult run(SchemaNodeId start) {
      final var stack = new ArrayDeque<Frame>();
      stack.push(new Frame(doc.root(), start, EurePath.root(), 0));
      while (!stack.isEmpty()) {
        step(stack.pop(), stack);
      }
      return errors.isEmpty() && warnings.isEmpty() ? ValidationResult.success() : new ValidationResult(errors, warnings);
    }

    private void step(Frame frame, ArrayDeque<Frame> stack) {
      StructuredLog.finestSampled(LOG, "validate.frame", 1, "frame", frame);
      if (frame.depth() > options.maxDepth()) {
        error(ErrorKind.RECURSION_LIMIT, frame.path(), options.maxDepth());
        return;
      }
      final var node = doc.node(frame.node());
      inspectExtensions(frame, node);

      final var resolved = References.resolve(schema, frame.schema());
      if (resolved.dangling()) {
        error(ErrorKind.DANGLING_REFERENCE, frame.path(), resolved.missing());
        return;
      }
      if (node.isHole()) {
        return;
      }
      final var content = schema.node(resolved.id()).content();
      final var children = new ArrayList<Frame>();

      if (content instanceof SchemaNodeContent.AnySchema) {
        return;
      } else if (content instanceof SchemaNodeContent.LiteralSchema literal) {
        final var actual = doc.toContentValue(frame.node());
        if (!literal.value().equals(actual)) {
          error(ErrorKind.LITERAL_MISMATCH, frame.path(), display(literal.value()), display(actual));
        }
      } else if (content instanceof SchemaNodeContent.RecordSchema rec) {
        stepRecord(frame, node, rec, children);
      } else if (content instanceof SchemaNodeContent.ArraySchema array) {
        stepArray(frame, node, array, children);
      } else if (content instanceof SchemaNodeContent.MapSchema map) {
        stepMap(frame, node, map, children);
      } else if (content instanceof SchemaNodeContent.TupleSchema tuple) {
        stepTuple(frame, node, tuple, children);
      } else if (content instanceof SchemaNodeContent.UnionSchema union) {
        stepUnion(frame, node, union, children);
      } else if (node.content() instanceof NodeValue.Primitive primitive) {
        checkPrimitive(primitive.value(), content, resolved.id(), frame.path());
      } else {
        typeMismatch(frame.path(), content, node.content());
      }

      // reversed so that errors come out in document order
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }

    private void stepRecord(Frame frame, Node node, SchemaNodeContent.RecordSchema rec, List<Frame> children) {
      if (!(node.content() instanceof NodeValue.NodeMap map)) {
        typeMismatch(frame.path(), rec, node.content());
        return;
      }
      final var byName = new LinkedHashMap<String, Map.Entry<ObjectKey, NodeId>>();
      for (final var entry : map.entries().entrySet()) {
        entry.getKey().fieldName().ifPresent(name -> byName.putIfAbsent(name, entry));
      }
      for (final var field : rec.fields().entrySet()) {
        final var name = field.getKey();
        final var entry = byName.get(name);
        if (entry == null) {
          if (!field.getValue().optional()) {
            error(ErrorKind.MISSING_FIELD, frame.path(), name);
          }
          continue;
        }
        final var fieldPath = frame.path().appendKey(entry.getKey());
        if (schema.node(References.checked(schema, field.getValue().schema())).metadata().deprecated()) {
          warnings.add(ValidationWarning.of(WarningKind.DEPRECATED_FIELD, fieldPath, name));
        }
        children.add(new Frame(entry.getValue(), field.getValue().schema(), fieldPath,
            null, field.getValue().optional(), frame.depth() + 1));
      }
      if (rec.unknownFields() == UnknownFieldsPolicy.ALLOW) {
        return;
      }
      for (final var key : map.entries().keySet()) {
        final var name = key.fieldName();
        if (name.isPresent() && (rec.fields().containsKey(name.get()) || name.get().equals(frame.exemptField()))) {
          continue;
        }
        error(ErrorKind.UNKNOWN_FIELD, frame.path().appendKey(key), key);
      }
    }

    private void stepArray(Frame frame, Node node, SchemaNodeContent.ArraySchema array, List<Frame> children) {
      if (!(node.content() instanceof NodeValue.NodeArray items)) {
        typeMismatch(frame.path(), array, node.content());
        return;
      }
      final int size = items.items().size();
      if (!withinLengths(size, array.minLength(), array.maxLength())) {
        error(ErrorKind.ARRAY_LENGTH_OUT_OF_BOUNDS, frame.path(), size, lengths(array.minLength(), array.maxLength()));
      }
      final Map<Value, Integer> firstSeen = array.unique() ? new HashMap<>() : null;
      for (int i = 0; i < size; i++) {
        final var item = items.items().get(i);
        final var itemPath = frame.path().appendArrayIndex(i);
        if (firstSeen != null) {
          final var previous = firstSeen.putIfAbsent(doc.toContentValue(item), i);
          if (previous != null) {
            error(ErrorKind.ARRAY_NOT_UNIQUE, itemPath, i, previous);
          }
        }
        children.add(frame.child(item, array.item(), itemPath));
      }
    }

    private void stepMap(Frame frame, Node node, SchemaNodeContent.MapSchema mapSchema, List<Frame> children) {
      if (!(node.content() instanceof NodeValue.NodeMap map)) {
        typeMismatch(frame.path(), mapSchema, node.content());
        return;
      }
      if (!withinLengths(map.size(), mapSchema.minSize(), mapSchema.maxSize())) {
        error(ErrorKind.MAP_SIZE_OUT_OF_BOUNDS, frame.path(), map.size(), lengths(mapSchema.minSize(), mapSchema.maxSize()));
      }
      final var keySchema = References.resolve(schema, mapSchema.key());
      SchemaNodeContent keyContent = null;
      if (keySchema.dangling()) {
        error(ErrorKind.DANGLING_REFERENCE, frame.path(), keySchema.missing());
      } else {
        keyContent = schema.node(keySchema.id()).content();
        if (!describesKeys(keyContent)) {
          error(ErrorKind.INVALID_KEY_TYPE, frame.path(), keyContent.kindName());
          keyContent = null;
        }
      }
      for (final var entry : map.entries().entrySet()) {
        final var entryPath = frame.path().appendKey(entry.getKey());
        if (keyContent != null) {
          checkKey(entry.getKey(), keyContent, keySchema.id(), entryPath);
        }
        children.add(frame.child(entry.getValue(), mapSchema.value(), entryPath));
      }
    }

    private void stepTuple(Frame frame, Node node, SchemaNodeContent.TupleSchema tuple, List<Frame> children) {
      if (!(node.content() instanceof NodeValue.NodeTuple items)) {
        typeMismatch(frame.path(), tuple, node.content());
        return;
      }
      final int expected = tuple.elements().size();
      final int actual = items.items().size();
      if (expected != actual) {
        error(ErrorKind.ARITY_MISMATCH, frame.path(), expected, actual);
      }
      for (int i = 0; i < Math.min(expected, actual); i++) {
        children.add(frame.child(items.items().get(i), tuple.elements().get(i), frame.path().appendTupleIndex(i)));
      }
    }

    private void stepUnion(Frame frame, Node node, SchemaNodeContent.UnionSchema union, List<Frame> children) {
      final var selection = selector.select(frame.node(), frame.path(), union);
      if (selection instanceof VariantSelector.Selection.Failed failed) {
        errors.add(failed.error());
        return;
      }
      final var selected = (VariantSelector.Selection.Selected) selection;
      if (union.repr() instanceof VariantRepr.Adjacent adjacent
          && !selected.target().equals(frame.node())
          && node.content() instanceof NodeValue.NodeMap container) {
        for (final var key : container.entries().keySet()) {
          final var name = key.fieldName().orElse(null);
          if (!adjacent.tag().equals(name) && !adjacent.content().equals(name)) {
            error(ErrorKind.UNKNOWN_FIELD, frame.path().appendKey(key), key);
          }
        }
      }
      children.add(new Frame(selected.target(), selected.schema(), selected.targetPath(),
          selected.exemptField(), frame.optional(), frame.depth() + 1));
    }

    private void checkKey(ObjectKey key, SchemaNodeContent keyContent, SchemaNodeId keyId, EurePath path) {
      final Value.Primitive keyValue = key instanceof ObjectKey.Literal literal
          ? literal.value()
          : Value.text(((ObjectKey.Ident) key).name());
      if (keyContent instanceof SchemaNodeContent.AnySchema) {
        return;
      }
      if (keyContent instanceof SchemaNodeContent.LiteralSchema literal) {
        if (!literal.value().equals(keyValue)) {
          error(ErrorKind.LITERAL_MISMATCH, path, display(literal.value()), display(keyValue));
        }
        return;
      }
      checkPrimitive(keyValue, keyContent, keyId, path);
    }

    private void checkPrimitive(Value.Primitive value, SchemaNodeContent content, SchemaNodeId schemaId, EurePath path) {
      if (content instanceof SchemaNodeContent.TextSchema text) {
        if (value instanceof Value.TextValue actual) {
          checkText(actual, text, schemaId, path);
        } else {
          error(ErrorKind.TYPE_MISMATCH, path, text.kindName(), value.kindName());
        }
      } else if (content instanceof SchemaNodeContent.IntegerSchema integer) {
        if (value instanceof Value.IntegerValue actual) {
          final var v = actual.value();
          if (!integer.min().admitsAbove(v) || !integer.max().admitsBelow(v)) {
            error(ErrorKind.OUT_OF_RANGE, path, v, Bound.describe(integer.min(), integer.max()));
          }
          if (integer.multipleOf() != null && v.remainder(integer.multipleOf()).signum() != 0) {
            error(ErrorKind.NOT_MULTIPLE_OF, path, v, integer.multipleOf());
          }
        } else {
          error(ErrorKind.TYPE_MISMATCH, path, integer.kindName(), value.kindName());
        }
      } else if (content instanceof SchemaNodeContent.FloatSchema floating) {
        if (value instanceof Value.FloatValue actual) {
          checkFloat(actual.value(), floating, path);
        } else {
          error(ErrorKind.TYPE_MISMATCH, path, floating.kindName(), value.kindName());
        }
      } else if (content instanceof SchemaNodeContent.BooleanSchema) {
        if (!(value instanceof Value.BooleanValue)) {
          error(ErrorKind.TYPE_MISMATCH, path, content.kindName(), value.kindName());
        }
      } else if (content instanceof SchemaNodeContent.NullSchema) {
        if (!(value instanceof Value.NullValue)) {
          error(ErrorKind.TYPE_MISMATCH, path, content.kindName(), value.kindName());
        }
      } else {
        error(ErrorKind.TYPE_MISMATCH, path, content.kindName(), value.kindName());
      }
    }

    private void checkText(Value.TextValue actual, SchemaNodeContent.TextSchema text, SchemaNodeId schemaId, EurePath path) {
      final var expectedLanguage = text.language();
      if (expectedLanguage != null) {
        final boolean matches = actual.isPlaintext()
            ? expectedLanguage.equals("plaintext") || expectedLanguage.equals("text")
            : expectedLanguage.equals(actual.language());
        if (!matches) {
          error(ErrorKind.LANGUAGE_MISMATCH, path, expectedLanguage,
              actual.isPlaintext() ? "plaintext" : actual.language());
        }
      }
      final var s = actual.content();
      final int length = s.codePointCount(0, s.length());
      if (!withinLengths(length, text.minLength(), text.maxLength())) {
        error(ErrorKind.LENGTH_OUT_OF_BOUNDS, path, length, lengths(text.minLength(), text.maxLength()));
      }
      final var pattern = patterns.get(schemaId);
      if (pattern != null && !pattern.matcher(s).find()) {
        error(ErrorKind.PATTERN_MISMATCH, path, pattern.pattern());
      }
    }

    private void checkFloat(double d, SchemaNodeContent.FloatSchema floating, EurePath path) {
      if (!Double.isFinite(d)) {
        // infinities and NaN satisfy no finite bound and no multiple-of
        if (floating.min().isBounded() || floating.max().isBounded()) {
          error(ErrorKind.OUT_OF_RANGE, path, d, Bound.describe(floating.min(), floating.max()));
        }
        if (floating.multipleOf() != null) {
          error(ErrorKind.NOT_MULTIPLE_OF, path, d, floating.multipleOf());
        }
        return;
      }
      final var v = BigDecimal.valueOf(d);
      if (!floating.min().admitsAbove(v) || !floating.max().admitsBelow(v)) {
        error(ErrorKind.OUT_OF_RANGE, path, d, Bound.describe(floating.min(), floating.max()));
      }
      if (floating.multipleOf() != null && v.remainder(floating.multipleOf()).signum() != 0) {
        error(ErrorKind.NOT_MULTIPLE_OF, path, d, floating.multipleOf().toPlainString());
      }
    }

    /// Warns once per node about extensions nothing interprets
    private void inspectExtensions(Frame frame, Node node) {
      if (node.extensions().isEmpty() || !inspectedExtensions.add(frame.node())) {
        return;
      }
      final var declared = schema.contains(frame.schema())
          ? schema.node(frame.schema()).metadata().extensions().keySet()
          : Set.<String>of();
      for (final var name : node.extensions().keySet()) {
        if (!Annotations.isReserved(name) && !declared.contains(name)) {
          warnings.add(ValidationWarning.of(WarningKind.UNKNOWN_EXTENSION, frame.path().appendExtension(name), name));
        }
      }
    }

    private void typeMismatch(EurePath path, SchemaNodeContent expected, NodeValue actual) {
      error(ErrorKind.TYPE_MISMATCH, path, expected.kindName(), actual.kindName());
    }

    private void error(ErrorKind kind, EurePath path, Object... args) {
      final var error = ValidationError.of(kind, path, args);
      LOG.finer(() -> "Validation error " + error);
      errors.add(error);
    }
  }

  private static boolean describesKeys(SchemaNodeContent content) {
    return content instanceof SchemaNodeContent.TextSchema
        || content instanceof SchemaNodeContent.IntegerSchema
        || content instanceof SchemaNodeContent.FloatSchema
        || content instanceof SchemaNodeContent.BooleanSchema
        || content instanceof SchemaNodeContent.NullSchema
        || content instanceof SchemaNodeContent.LiteralSchema
        || content instanceof SchemaNodeContent.AnySchema;
  }

  private static boolean withinLengths(int actual, Integer min, Integer max) {
    return (min == null || actual >= min) && (max == null || actual <= max);
  }

  private static String lengths(Integer min, Integer max) {
    return Bound.describe(
        min == null ? Bound.<Integer>unbounded() : Bound.inclusive(min),
        max == null ? Bound.<Integer>unbounded() : Bound.inclusive(max));
  }

  /// Short rendering of a value for messages
  static String display(Value value) {
    if (value instanceof Value.TextValue text) {
      final var sb = new StringBuilder();
      sb.append('"').append(text.content()).append('"');
      return text.isPlaintext() ? sb.toString() : sb.append(" (").append(text.language()).append(')').toString();
    }
    if (value instanceof Value.IntegerValue integer) return integer.value().toString();
    if (value instanceof Value.FloatValue floating) return Double.toString(floating.value());
    if (value instanceof Value.BooleanValue bool) return Boolean.toString(bool.value());
    if (value instanceof Value.NullValue) return "null";
    return value.kindName();
  }
}
