package eure.schema;

/// Kinds of [ValidationError], each with a short title and a message template
public enum ErrorKind {
  TYPE_MISMATCH("Type mismatch", "expected %s, got %s"),
  MISSING_FIELD("Missing field", "missing required field '%s'"),
  UNKNOWN_FIELD("Unknown field", "unknown field '%s'"),
  OUT_OF_RANGE("Out of range", "value %s is outside %s"),
  NOT_MULTIPLE_OF("Not a multiple", "value %s is not a multiple of %s"),
  LENGTH_OUT_OF_BOUNDS("Length out of bounds", "text length %d is outside %s"),
  PATTERN_MISMATCH("Pattern mismatch", "text does not match pattern %s"),
  LANGUAGE_MISMATCH("Language mismatch", "expected language %s, got %s"),
  ARRAY_LENGTH_OUT_OF_BOUNDS("Array length out of bounds", "array length %d is outside %s"),
  ARRAY_NOT_UNIQUE("Duplicate element", "element %d repeats element %d"),
  MAP_SIZE_OUT_OF_BOUNDS("Map size out of bounds", "map size %d is outside %s"),
  INVALID_KEY_TYPE("Invalid key type", "a %s schema cannot describe a map key"),
  ARITY_MISMATCH("Arity mismatch", "expected %d elements, got %d"),
  LITERAL_MISMATCH("Literal mismatch", "expected %s, got %s"),
  VARIANT_KEY_COUNT("Variant key count", "externally tagged value needs exactly one key, got %d"),
  UNKNOWN_VARIANT("Unknown variant", "unknown variant '%s', expected one of %s"),
  INVALID_VARIANT_TAG("Invalid variant tag", "variant tag must be plaintext, got %s"),
  CONFLICTING_VARIANT_TAGS("Conflicting variant tags", "$variant names '%s' but the value is tagged '%s'"),
  MISSING_VARIANT_TAG("Missing variant tag", "no variant tag, expected %s"),
  AMBIGUOUS_VARIANT("Ambiguous variant", "value fits several variants: %s"),
  NO_VARIANT_MATCHED("No variant matched", "value fits none of the variants: %s"),
  DANGLING_REFERENCE("Dangling reference", "reference to undefined type '%s'"),
  RECURSION_LIMIT("Recursion limit", "nesting exceeds the maximum depth of %d");

  private final String title;
  private final String messageTemplate;

  ErrorKind(String title, String messageTemplate) {
    this.title = title;
    this.messageTemplate = messageTemplate;
  }

  public String title() {
    return title;
  }

  public String message(Object... args) {
    return String.format(messageTemplate, args);
  }
}
