package eure.schema;

/// Opaque handle into the node table of one [SchemaDocument].
/// Recursive types refer to each other by name, never by id, so ids form no cycles.
public record SchemaNodeId(int index) {
  public SchemaNodeId {
    if (index < 0) {
      throw new IllegalArgumentException("schema node index must not be negative: " + index);
    }
  }

  @Override
  public String toString() {
    return "s" + index;
  }
}
