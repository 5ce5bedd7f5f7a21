package eure.schema;

import java.util.Objects;

/// Convention that encodes which case of a union a value belongs to
public sealed interface VariantRepr {

  /// `{ variant-name = { ...fields } }`, a single key naming the variant
  record External() implements VariantRepr {}

  /// `{ tag = "variant-name", ...fields }`
  record Internal(String tag) implements VariantRepr {
    public Internal {
      Objects.requireNonNull(tag, "tag must not be null");
    }
  }

  /// `{ tag = "variant-name", content = { ...fields } }`
  record Adjacent(String tag, String content) implements VariantRepr {
    public Adjacent {
      Objects.requireNonNull(tag, "tag must not be null");
      Objects.requireNonNull(content, "content must not be null");
      if (tag.equals(content)) {
        throw new IllegalArgumentException("tag and content fields must differ: " + tag);
      }
    }
  }

  /// Variant named by the reserved `$variant` extension on the value itself
  record Tagged() implements VariantRepr {}

  static VariantRepr external() {
    return new External();
  }

  static VariantRepr tagged() {
    return new Tagged();
  }
}
