package eure.schema;

import java.util.Objects;
import java.util.Optional;

/// Result of [SchemaExtractor#extract(eure.document.Document)].
///
/// `pureSchema` is true when the source held declarations only, false when it was a
/// self-describing document mixing example data with inline annotations.
/// `schemaReference` is the root `$schema` value, or null when absent.
public record ExtractedSchema(SchemaDocument schema, boolean pureSchema, String schemaReference) {
  public ExtractedSchema {
    Objects.requireNonNull(schema, "schema must not be null");
  }

  /// External schema file named by `$schema`. Never fetched by this library.
  public Optional<String> externalSchema() {
    return Optional.ofNullable(schemaReference);
  }
}
