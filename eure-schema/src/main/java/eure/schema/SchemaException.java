package eure.schema;

import eure.document.EurePath;

/// Structural defect found while extracting a schema from a document.
/// Aborts extraction; carries the path of the offending node.
public class SchemaException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public enum Kind {
    CONFLICTING_TYPE_ANNOTATIONS("conflicting type annotations: %s"),
    DUPLICATE_FIELD("duplicate field name: %s"),
    MALFORMED_CONSTRAINT("malformed constraint %s: %s"),
    DANGLING_TYPE_REFERENCE("reference to undefined type: %s"),
    EMPTY_VARIANT("%s"),
    INVALID_TYPE_EXPRESSION("invalid type expression: %s"),
    INVALID_VARIANT_REPR("invalid variant representation: %s"),
    INVALID_RENAME_RULE("unknown rename rule: %s");

    private final String messageTemplate;

    Kind(String messageTemplate) {
      this.messageTemplate = messageTemplate;
    }

    public String message(Object... args) {
      return String.format(messageTemplate, args);
    }
  }

  private final Kind kind;
  private final EurePath path;

  public SchemaException(Kind kind, EurePath path, Object... args) {
    super(path + ": " + kind.message(args));
    this.kind = kind;
    this.path = path;
  }

  public Kind kind() {
    return kind;
  }

  public EurePath path() {
    return path;
  }
}
