package eure.schema;

import java.util.LinkedHashSet;

/// Follows chains of [SchemaNodeContent.ReferenceSchema] to the node they stand for
final class References {

  /// `id` is the first non-reference node, or null when `missing` names an undefined type
  record Resolved(SchemaNodeId id, String missing) {
    boolean dangling() {
      return missing != null;
    }
  }

  private References() {}

  /// Resolves `id` against the registry of `schema`
  /// @throws ValidatorException when `id` is outside the schema or the chain is a cycle
  static Resolved resolve(SchemaDocument schema, SchemaNodeId id) {
    var current = checked(schema, id);
    LinkedHashSet<String> seen = null;
    while (schema.node(current).content() instanceof SchemaNodeContent.ReferenceSchema ref) {
      if (seen == null) {
        seen = new LinkedHashSet<>();
      }
      if (!seen.add(ref.name())) {
        throw new ValidatorException("reference cycle without a document node in between: "
            + String.join(" -> ", seen) + " -> " + ref.name());
      }
      final var target = schema.type(ref.name());
      if (target.isEmpty()) {
        return new Resolved(null, ref.name());
      }
      current = checked(schema, target.get());
    }
    return new Resolved(current, null);
  }

  /// @throws ValidatorException when `id` is outside the schema
  static SchemaNodeId checked(SchemaDocument schema, SchemaNodeId id) {
    if (!schema.contains(id)) {
      throw new ValidatorException("schema node " + id + " is outside the schema table of " + schema.size() + " nodes");
    }
    return id;
  }
}
