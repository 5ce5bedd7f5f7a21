package eure.document;

/// Construction-mode resolution or assignment hit a node of the wrong shape
public class InsertException extends DocumentException {

  private static final long serialVersionUID = 1L;

  public enum Kind {
    ALREADY_ASSIGNED("node at %s already holds %s"),
    EXPECTED_MAP("expected map at %s, found %s"),
    EXPECTED_ARRAY("expected array at %s, found %s"),
    EXPECTED_TUPLE("expected tuple at %s, found %s"),
    TUPLE_INDEX_OUT_OF_RANGE("tuple index at %s skips past size %s"),
    ARRAY_INDEX_OUT_OF_RANGE("array index at %s skips past size %s");

    private final String messageTemplate;

    Kind(String messageTemplate) {
      this.messageTemplate = messageTemplate;
    }

    public String message(Object... args) {
      return String.format(messageTemplate, args);
    }
  }

  private final Kind kind;

  public InsertException(Kind kind, EurePath path, Object detail) {
    super(kind.message(path, detail), path);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
