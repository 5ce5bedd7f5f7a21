package eure.schema;

/// What a record does with fields it does not declare
public enum UnknownFieldsPolicy {
  /// Undeclared fields are reported as `UNKNOWN_FIELD`
  DENY,
  /// Undeclared fields are skipped without further checks
  ALLOW
}
