package eure.schema;

import eure.document.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The closed set of schema node kinds.
///
/// Child schemas are held as [SchemaNodeId]s into the owning [SchemaDocument];
/// named types are reached through [ReferenceSchema] by name, resolved lazily.
public sealed interface SchemaNodeContent {

  /// Text, optionally constrained by code point length, a regex (find semantics)
  /// and a language tag. Null fields are unconstrained.
  record TextSchema(Integer minLength, Integer maxLength, String pattern, String language) implements SchemaNodeContent {
    public static final TextSchema ANY_TEXT = new TextSchema(null, null, null, null);

    public TextSchema {
      requireLengths(minLength, maxLength, "length");
    }
  }

  /// Integer with an optional range and a positive multiple-of
  record IntegerSchema(Bound<BigInteger> min, Bound<BigInteger> max, BigInteger multipleOf) implements SchemaNodeContent {
    public static final IntegerSchema ANY_INTEGER =
        new IntegerSchema(Bound.unbounded(), Bound.unbounded(), null);

    public IntegerSchema {
      Objects.requireNonNull(min, "min must not be null");
      Objects.requireNonNull(max, "max must not be null");
      if (multipleOf != null && multipleOf.signum() <= 0) {
        throw new IllegalArgumentException("multiple-of must be positive: " + multipleOf);
      }
    }
  }

  /// Float with an optional range and a positive multiple-of, compared as exact decimals
  record FloatSchema(Bound<BigDecimal> min, Bound<BigDecimal> max, BigDecimal multipleOf) implements SchemaNodeContent {
    public static final FloatSchema ANY_FLOAT =
        new FloatSchema(Bound.unbounded(), Bound.unbounded(), null);

    public FloatSchema {
      Objects.requireNonNull(min, "min must not be null");
      Objects.requireNonNull(max, "max must not be null");
      if (multipleOf != null && multipleOf.signum() <= 0) {
        throw new IllegalArgumentException("multiple-of must be positive: " + multipleOf);
      }
    }
  }

  record BooleanSchema() implements SchemaNodeContent {}

  record NullSchema() implements SchemaNodeContent {}

  record AnySchema() implements SchemaNodeContent {}

  /// Exactly this value, compared without extensions
  record LiteralSchema(Value value) implements SchemaNodeContent {
    public LiteralSchema {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  record RecordField(SchemaNodeId schema, boolean optional) {
    public RecordField {
      Objects.requireNonNull(schema, "schema must not be null");
    }
  }

  /// Ordered named fields. Names are unique by construction of the map.
  record RecordSchema(Map<String, RecordField> fields, UnknownFieldsPolicy unknownFields) implements SchemaNodeContent {
    public RecordSchema {
      Objects.requireNonNull(unknownFields, "unknownFields must not be null");
      fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /// Names of the fields that must be present
    public List<String> requiredFields() {
      return fields.entrySet().stream().filter(e -> !e.getValue().optional()).map(Map.Entry::getKey).toList();
    }
  }

  record ArraySchema(SchemaNodeId item, Integer minLength, Integer maxLength, boolean unique) implements SchemaNodeContent {
    public ArraySchema {
      Objects.requireNonNull(item, "item must not be null");
      requireLengths(minLength, maxLength, "length");
    }
  }

  record MapSchema(SchemaNodeId key, SchemaNodeId value, Integer minSize, Integer maxSize) implements SchemaNodeContent {
    public MapSchema {
      Objects.requireNonNull(key, "key must not be null");
      Objects.requireNonNull(value, "value must not be null");
      requireLengths(minSize, maxSize, "size");
    }
  }

  /// Fixed arity, one schema per position
  record TupleSchema(List<SchemaNodeId> elements) implements SchemaNodeContent {
    public TupleSchema {
      elements = List.copyOf(elements);
    }
  }

  /// Tagged union. Variant names are unique by construction of the map.
  record UnionSchema(Map<String, SchemaNodeId> variants, VariantRepr repr) implements SchemaNodeContent {
    public UnionSchema {
      Objects.requireNonNull(repr, "repr must not be null");
      variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
    }
  }

  /// Named type in the owning registry
  record ReferenceSchema(String name) implements SchemaNodeContent {
    public ReferenceSchema {
      Objects.requireNonNull(name, "name must not be null");
    }
  }

  default String kindName() {
    if (this instanceof TextSchema) return "text";
    if (this instanceof IntegerSchema) return "integer";
    if (this instanceof FloatSchema) return "float";
    if (this instanceof BooleanSchema) return "boolean";
    if (this instanceof NullSchema) return "null";
    if (this instanceof AnySchema) return "any";
    if (this instanceof LiteralSchema) return "literal";
    if (this instanceof RecordSchema) return "record";
    if (this instanceof ArraySchema) return "array";
    if (this instanceof MapSchema) return "map";
    if (this instanceof TupleSchema) return "tuple";
    if (this instanceof UnionSchema) return "union";
    return "reference";
  }

  private static void requireLengths(Integer min, Integer max, String what) {
    if (min != null && min < 0) {
      throw new IllegalArgumentException("min " + what + " must not be negative: " + min);
    }
    if (max != null && max < 0) {
      throw new IllegalArgumentException("max " + what + " must not be negative: " + max);
    }
    if (min != null && max != null && min > max) {
      throw new IllegalArgumentException("min " + what + " " + min + " exceeds max " + what + " " + max);
    }
  }
}
