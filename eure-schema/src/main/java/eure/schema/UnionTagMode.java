package eure.schema;

/// How the validator finds the variant of a union value
public enum UnionTagMode {
  /// The representation's tag, or `$variant`, must be present
  EXPLICIT,
  /// Without a tag, infer the single variant the value's fields (or kind) fit.
  /// More than one candidate is an error, never a guess.
  LENIENT
}
