package eure.schema;

/// The schema handed to a [SchemaValidator] is corrupt, so validation cannot run.
///
/// Document mistakes never raise this; they are reported as [ValidationError]s.
public class ValidatorException extends RuntimeException {

  public ValidatorException(String message) {
    super(message);
  }

  public ValidatorException(String message, Throwable cause) {
    super(message, cause);
  }
}
