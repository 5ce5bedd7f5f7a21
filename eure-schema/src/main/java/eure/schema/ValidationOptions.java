package eure.schema;

import java.util.Locale;
import java.util.Objects;

/// Options for [SchemaValidator].
///
/// `maxDepth` bounds the number of nested frames, so runaway recursion through
/// recursive named types becomes a `RECURSION_LIMIT` error.
public record ValidationOptions(UnionTagMode unionTagMode, int maxDepth) {

  public static final String UNION_TAG_MODE_PROPERTY = "eure.validation.unionTagMode";
  public static final String MAX_DEPTH_PROPERTY = "eure.validation.maxDepth";

  /// Explicit tags, depth 1024
  public static final ValidationOptions DEFAULT = new ValidationOptions(UnionTagMode.EXPLICIT, 1024);

  public ValidationOptions {
    Objects.requireNonNull(unionTagMode, "unionTagMode must not be null");
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
  }

  public ValidationOptions withUnionTagMode(UnionTagMode mode) {
    return new ValidationOptions(mode, maxDepth);
  }

  public ValidationOptions withMaxDepth(int depth) {
    return new ValidationOptions(unionTagMode, depth);
  }

  public String summary() {
    return "unionTagMode=" + unionTagMode + ", maxDepth=" + maxDepth;
  }

  /// These options with any system property overrides applied
  ValidationOptions withSystemOverrides() {
    var effective = this;
    final var mode = System.getProperty(UNION_TAG_MODE_PROPERTY);
    if (mode != null) {
      try {
        effective = effective.withUnionTagMode(UnionTagMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(UNION_TAG_MODE_PROPERTY + " must be explicit or lenient: " + mode, e);
      }
    }
    final var depth = System.getProperty(MAX_DEPTH_PROPERTY);
    if (depth != null) {
      try {
        effective = effective.withMaxDepth(Integer.parseInt(depth.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(MAX_DEPTH_PROPERTY + " must be an integer: " + depth, e);
      }
    }
    return effective;
  }
}
