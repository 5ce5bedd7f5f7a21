package eure.schema;

import java.util.logging.Logger;

/// Shared logger for extraction and validation.
/// Classes use it via `import static eure.schema.SchemaLogging.LOG;`
final class SchemaLogging {
  static final Logger LOG = Logger.getLogger("eure.schema");

  private SchemaLogging() {}
}
