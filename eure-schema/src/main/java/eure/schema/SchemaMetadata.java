package eure.schema;

import eure.document.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Documentation attached to a schema node. Never affects pass or fail,
/// except that `deprecated` raises a warning when the field is used.
///
/// `extensions` keeps annotations the extractor does not recognise, plus `$rename`,
/// verbatim under their names without the `$`.
public record SchemaMetadata(
    String description,
    boolean deprecated,
    Value defaultValue,
    List<Value> examples,
    Map<String, Value> extensions
) {
  public static final SchemaMetadata EMPTY = new SchemaMetadata(null, false, null, List.of(), Map.of());

  public SchemaMetadata {
    examples = List.copyOf(examples);
    extensions = Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
  }

  public Optional<String> describe() {
    return Optional.ofNullable(description);
  }

  public Optional<Value> defaults() {
    return Optional.ofNullable(defaultValue);
  }

  public boolean isEmpty() {
    return description == null && !deprecated && defaultValue == null && examples.isEmpty() && extensions.isEmpty();
  }
}
