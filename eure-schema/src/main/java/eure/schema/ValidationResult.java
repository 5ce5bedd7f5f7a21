package eure.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Outcome of a validation run that completed. Errors and warnings keep traversal order.
public record ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {

  private static final ValidationResult SUCCESS = new ValidationResult(List.of(), List.of());

  public ValidationResult {
    errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
    warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
  }

  public static ValidationResult success() {
    return SUCCESS;
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  /// Errors of the given kind, in order
  public List<ValidationError> errorsOf(ErrorKind kind) {
    return errors.stream().filter(e -> e.kind() == kind).toList();
  }

  /// This result followed by `later`
  public ValidationResult merge(ValidationResult later) {
    if (later.errors.isEmpty() && later.warnings.isEmpty()) {
      return this;
    }
    final var allErrors = new ArrayList<>(errors);
    allErrors.addAll(later.errors);
    final var allWarnings = new ArrayList<>(warnings);
    allWarnings.addAll(later.warnings);
    return new ValidationResult(allErrors, allWarnings);
  }
}
