package eure.document;

/// Opaque handle into the node table of exactly one [Document].
/// Ids are only issued by a [DocumentBuilder] and mean nothing to any other document.
public record NodeId(int index) {
  public NodeId {
    if (index < 0) {
      throw new IllegalArgumentException("node index must not be negative: " + index);
    }
  }

  @Override
  public String toString() {
    return "#" + index;
  }
}
