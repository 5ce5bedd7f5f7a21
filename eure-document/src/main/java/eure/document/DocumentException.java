package eure.document;

/// Base class for failures while navigating or constructing a [Document]
public class DocumentException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final EurePath path;

  public DocumentException(String message, EurePath path) {
    super(message);
    this.path = path;
  }

  /// Path the failing operation was working on
  public EurePath path() {
    return path;
  }
}
