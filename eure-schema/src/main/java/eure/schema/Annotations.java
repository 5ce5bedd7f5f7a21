package eure.schema;

import java.util.List;
import java.util.Set;

/// Extension identifiers with a meaning to the schema subsystem
final class Annotations {

  static final String TYPE = "type";
  static final String ARRAY = "array";
  static final String MAP = "map";
  static final String LITERAL = "literal";
  static final String VARIANTS = "variants";
  static final String VARIANT_REPR = "variant-repr";
  static final String VARIANT = "variant";
  static final String OPTIONAL = "optional";
  static final String UNKNOWN_FIELDS = "unknown-fields";

  static final String MIN_LENGTH = "min-length";
  static final String MAX_LENGTH = "max-length";
  static final String LENGTH = "length";
  static final String PATTERN = "pattern";
  static final String MIN = "min";
  static final String MAX = "max";
  static final String EXCLUSIVE_MIN = "exclusive-min";
  static final String EXCLUSIVE_MAX = "exclusive-max";
  static final String RANGE = "range";
  static final String MULTIPLE_OF = "multiple-of";
  static final String UNIQUE = "unique";
  static final String MIN_SIZE = "min-size";
  static final String MAX_SIZE = "max-size";

  static final String DESCRIPTION = "description";
  static final String DEPRECATED = "deprecated";
  static final String DEFAULT = "default";
  static final String EXAMPLES = "examples";

  static final String RENAME = "rename";
  static final String RENAME_ALL = "rename-all";
  static final String SCHEMA = "schema";
  static final String TYPES = "types";

  /// In precedence order; at most one may appear on a node
  static final List<String> TYPE_BEARING = List.of(TYPE, ARRAY, MAP, LITERAL, VARIANTS);

  static final List<String> CONSTRAINTS = List.of(
      MIN_LENGTH, MAX_LENGTH, LENGTH, PATTERN,
      MIN, MAX, EXCLUSIVE_MIN, EXCLUSIVE_MAX, RANGE, MULTIPLE_OF,
      UNIQUE, MIN_SIZE, MAX_SIZE);

  static final Set<String> TEXT_CONSTRAINTS = Set.of(MIN_LENGTH, MAX_LENGTH, LENGTH, PATTERN);
  static final Set<String> NUMERIC_CONSTRAINTS = Set.of(MIN, MAX, EXCLUSIVE_MIN, EXCLUSIVE_MAX, RANGE, MULTIPLE_OF);
  static final Set<String> ARRAY_CONSTRAINTS = Set.of(MIN_LENGTH, MAX_LENGTH, LENGTH, UNIQUE);
  static final Set<String> MAP_CONSTRAINTS = Set.of(MIN_SIZE, MAX_SIZE);

  private static final Set<String> OTHER_RESERVED = Set.of(
      VARIANT_REPR, VARIANT, OPTIONAL, UNKNOWN_FIELDS,
      DESCRIPTION, DEPRECATED, DEFAULT, EXAMPLES,
      RENAME, RENAME_ALL, SCHEMA, TYPES);

  private Annotations() {}

  /// True for every extension name the extractor or validator interprets
  static boolean isReserved(String name) {
    return TYPE_BEARING.contains(name) || CONSTRAINTS.contains(name) || OTHER_RESERVED.contains(name);
  }
}
