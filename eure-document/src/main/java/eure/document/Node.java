package eure.document;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// One addressable unit of a [Document]: its content plus extension slots (`$name`)
public record Node(NodeValue content, Map<String, NodeId> extensions) {
  public Node {
    Objects.requireNonNull(content, "content must not be null");
    Objects.requireNonNull(extensions, "extensions must not be null");
  }

  public Optional<NodeId> extension(String name) {
    return Optional.ofNullable(extensions.get(name));
  }

  public boolean isHole() {
    return content instanceof NodeValue.Hole;
  }
}
