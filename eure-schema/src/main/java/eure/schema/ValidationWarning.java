package eure.schema;

import eure.document.EurePath;

import java.util.Objects;

public record ValidationWarning(WarningKind kind, EurePath path, String message) {

  public ValidationWarning {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }

  static ValidationWarning of(WarningKind kind, EurePath path, Object... args) {
    return new ValidationWarning(kind, path, kind.message(args));
  }

  public String title() {
    return kind.title();
  }

  @Override
  public String toString() {
    return path + ": " + message;
  }
}
