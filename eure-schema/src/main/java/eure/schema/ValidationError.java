package eure.schema;

import eure.document.EurePath;

import java.util.Objects;

/// A document-level mismatch at `path`. Validation continues after it.
public record ValidationError(ErrorKind kind, EurePath path, String message) {

  public ValidationError {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(path, "path must not be null");
    if (message == null || message.isEmpty()) {
      throw new IllegalArgumentException("Error message cannot be null or empty");
    }
  }

  static ValidationError of(ErrorKind kind, EurePath path, Object... args) {
    return new ValidationError(kind, path, kind.message(args));
  }

  public String title() {
    return kind.title();
  }

  @Override
  public String toString() {
    return path + ": " + message;
  }
}
