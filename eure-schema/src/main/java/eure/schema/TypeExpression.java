package eure.schema;

import eure.document.Identifiers;

import java.util.Optional;
import java.util.function.Supplier;

/// Parser for type expressions such as `.text`, `.text.rust`, `.integer` or `.$types.User`.
///
/// After `$type` and inside other annotations the leading dot is optional. In value
/// position it is required, so that ordinary text data is never mistaken for a type.
final class TypeExpression {

  private static final String TYPES_PREFIX = "$" + Annotations.TYPES;

  private TypeExpression() {}

  /// Parses `text`, allocating the `Any` element schema of `.array` and `.map` from `anyNode`
  static Optional<SchemaNodeContent> parse(String text, boolean dotOptional, Supplier<SchemaNodeId> anyNode) {
    final String body;
    if (text.startsWith(".")) {
      body = text.substring(1);
    } else if (dotOptional) {
      body = text;
    } else {
      return Optional.empty();
    }
    final var parts = body.split("\\.", -1);
    if (parts.length == 2 && parts[0].equals(TYPES_PREFIX)) {
      return Identifiers.isValid(parts[1])
          ? Optional.of(new SchemaNodeContent.ReferenceSchema(parts[1]))
          : Optional.empty();
    }
    if (parts.length == 2 && (parts[0].equals("text") || parts[0].equals("string"))) {
      return Identifiers.isValid(parts[1])
          ? Optional.of(new SchemaNodeContent.TextSchema(null, null, null, parts[1]))
          : Optional.empty();
    }
    if (parts.length != 1) {
      return Optional.empty();
    }
    return Optional.ofNullable(switch (parts[0]) {
      case "text", "string" -> SchemaNodeContent.TextSchema.ANY_TEXT;
      case "integer" -> SchemaNodeContent.IntegerSchema.ANY_INTEGER;
      case "float" -> SchemaNodeContent.FloatSchema.ANY_FLOAT;
      case "boolean" -> new SchemaNodeContent.BooleanSchema();
      case "null" -> new SchemaNodeContent.NullSchema();
      case "any" -> new SchemaNodeContent.AnySchema();
      case "array" -> new SchemaNodeContent.ArraySchema(anyNode.get(), null, null, false);
      case "map" -> new SchemaNodeContent.MapSchema(anyNode.get(), anyNode.get(), null, null);
      default -> null;
    });
  }

  /// True for dotted text that names a type
  static boolean isTypeExpression(String text) {
    return parse(text, false, () -> new SchemaNodeId(0)).isPresent();
  }
}
