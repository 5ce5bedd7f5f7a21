package eure.schema;

/// Kinds of [ValidationWarning]. Warnings never make a document invalid.
public enum WarningKind {
  DEPRECATED_FIELD("Deprecated field", "field '%s' is deprecated"),
  UNKNOWN_EXTENSION("Unknown extension", "extension $%s is not interpreted");

  private final String title;
  private final String messageTemplate;

  WarningKind(String title, String messageTemplate) {
    this.title = title;
    this.messageTemplate = messageTemplate;
  }

  public String title() {
    return title;
  }

  public String message(Object... args) {
    return String.format(messageTemplate, args);
  }
}
