package eure.document;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Content of a single document node. The set of cases is closed.
///
/// Collections held by the nodes of a finalized [Document] are unmodifiable.
public sealed interface NodeValue {

  /// Declared but not yet filled. Drives the completeness pass of validation.
  record Hole(String label) implements NodeValue {}

  record Primitive(Value.Primitive value) implements NodeValue {
    public Primitive {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  /// Ordered mapping with unique keys
  record NodeMap(Map<ObjectKey, NodeId> entries) implements NodeValue {
    public NodeMap {
      Objects.requireNonNull(entries, "entries must not be null");
    }

    public Optional<NodeId> get(ObjectKey key) {
      return Optional.ofNullable(entries.get(key));
    }

    public int size() {
      return entries.size();
    }
  }

  record NodeArray(List<NodeId> items) implements NodeValue {
    public NodeArray {
      Objects.requireNonNull(items, "items must not be null");
    }
  }

  /// Fixed arity sequence, at most 256 elements
  record NodeTuple(List<NodeId> items) implements NodeValue {
    public NodeTuple {
      Objects.requireNonNull(items, "items must not be null");
    }
  }

  default String kindName() {
    if (this instanceof Hole) return "hole";
    if (this instanceof Primitive p) return p.value().kindName();
    if (this instanceof NodeMap) return "map";
    if (this instanceof NodeArray) return "array";
    return "tuple";
  }
}
