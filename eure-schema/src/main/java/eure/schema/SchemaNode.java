package eure.schema;

import java.util.Objects;

public record SchemaNode(SchemaNodeContent content, SchemaMetadata metadata) {
  public SchemaNode {
    Objects.requireNonNull(content, "content must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
  }

  public static SchemaNode of(SchemaNodeContent content) {
    return new SchemaNode(content, SchemaMetadata.EMPTY);
  }
}
