package eure.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A schema: an arena of [SchemaNode]s, a root, and a registry of named types.
///
/// Instances are immutable and may be shared between concurrent validations.
public final class SchemaDocument {

  private final List<SchemaNode> nodes;
  private final SchemaNodeId root;
  private final Map<String, SchemaNodeId> types;
  private final NamingOptions naming;

  private SchemaDocument(List<SchemaNode> nodes, SchemaNodeId root, Map<String, SchemaNodeId> types, NamingOptions naming) {
    this.nodes = nodes;
    this.root = root;
    this.types = types;
    this.naming = naming;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SchemaNodeId root() {
    return root;
  }

  public int size() {
    return nodes.size();
  }

  public boolean contains(SchemaNodeId id) {
    return id != null && id.index() < nodes.size();
  }

  public SchemaNode node(SchemaNodeId id) {
    if (!contains(id)) {
      throw new IllegalArgumentException("SchemaNodeId " + id + " is not part of this schema");
    }
    return nodes.get(id.index());
  }

  /// Named types in declaration order
  public Map<String, SchemaNodeId> types() {
    return types;
  }

  public Optional<SchemaNodeId> type(String name) {
    return Optional.ofNullable(types.get(name));
  }

  public NamingOptions naming() {
    return naming;
  }

  /// Copy of this schema whose registry lacks `name`. References to it become dangling.
  public SchemaDocument withoutType(String name) {
    final var remaining = new LinkedHashMap<>(types);
    remaining.remove(name);
    return new SchemaDocument(nodes, root, Collections.unmodifiableMap(remaining), naming);
  }

  /// Equality of the schema graphs reachable from the root and from every named type.
  /// Node numbering and registry order do not matter.
  public boolean structurallyEquals(SchemaDocument other) {
    Objects.requireNonNull(other, "other must not be null");
    if (!naming.equals(other.naming) || !types.keySet().equals(other.types.keySet())) {
      return false;
    }
    for (final var entry : types.entrySet()) {
      if (!sameShape(entry.getValue(), other, other.types.get(entry.getKey()))) {
        return false;
      }
    }
    return sameShape(root, other, other.root);
  }

  private boolean sameShape(SchemaNodeId mine, SchemaDocument other, SchemaNodeId theirs) {
    final var a = node(mine);
    final var b = other.node(theirs);
    if (!a.metadata().equals(b.metadata()) || a.content().getClass() != b.content().getClass()) {
      return false;
    }
    final var x = a.content();
    final var y = b.content();
    if (x instanceof SchemaNodeContent.RecordSchema rx) {
      final var ry = (SchemaNodeContent.RecordSchema) y;
      if (rx.unknownFields() != ry.unknownFields() || !rx.fields().keySet().equals(ry.fields().keySet())) {
        return false;
      }
      for (final var field : rx.fields().entrySet()) {
        final var theirField = ry.fields().get(field.getKey());
        if (field.getValue().optional() != theirField.optional()
            || !sameShape(field.getValue().schema(), other, theirField.schema())) {
          return false;
        }
      }
      return true;
    }
    if (x instanceof SchemaNodeContent.ArraySchema ax) {
      final var ay = (SchemaNodeContent.ArraySchema) y;
      return Objects.equals(ax.minLength(), ay.minLength()) && Objects.equals(ax.maxLength(), ay.maxLength())
          && ax.unique() == ay.unique() && sameShape(ax.item(), other, ay.item());
    }
    if (x instanceof SchemaNodeContent.MapSchema mx) {
      final var my = (SchemaNodeContent.MapSchema) y;
      return Objects.equals(mx.minSize(), my.minSize()) && Objects.equals(mx.maxSize(), my.maxSize())
          && sameShape(mx.key(), other, my.key()) && sameShape(mx.value(), other, my.value());
    }
    if (x instanceof SchemaNodeContent.TupleSchema tx) {
      final var ty = (SchemaNodeContent.TupleSchema) y;
      if (tx.elements().size() != ty.elements().size()) {
        return false;
      }
      for (int i = 0; i < tx.elements().size(); i++) {
        if (!sameShape(tx.elements().get(i), other, ty.elements().get(i))) {
          return false;
        }
      }
      return true;
    }
    if (x instanceof SchemaNodeContent.UnionSchema ux) {
      final var uy = (SchemaNodeContent.UnionSchema) y;
      if (!ux.repr().equals(uy.repr()) || !ux.variants().keySet().equals(uy.variants().keySet())) {
        return false;
      }
      for (final var variant : ux.variants().entrySet()) {
        if (!sameShape(variant.getValue(), other, uy.variants().get(variant.getKey()))) {
          return false;
        }
      }
      return true;
    }
    // remaining kinds hold no child ids
    return x.equals(y);
  }

  @Override
  public String toString() {
    return "SchemaDocument[nodes=" + nodes.size() + ", root=" + root + ", types=" + types.keySet() + "]";
  }

  /// Accumulates nodes bottom-up; children must be added before their parents
  public static final class Builder {
    private final List<SchemaNode> nodes = new ArrayList<>();
    private final Map<String, SchemaNodeId> types = new LinkedHashMap<>();
    private SchemaNodeId root;
    private NamingOptions naming = NamingOptions.NONE;

    private Builder() {}

    public SchemaNodeId add(SchemaNode node) {
      Objects.requireNonNull(node, "node must not be null");
      final var id = new SchemaNodeId(nodes.size());
      nodes.add(node);
      return id;
    }

    public SchemaNodeId add(SchemaNodeContent content) {
      return add(SchemaNode.of(content));
    }

    public Builder root(SchemaNodeId id) {
      this.root = checkOwned(id);
      return this;
    }

    /// Registers a named type
    /// @throws IllegalArgumentException if the name is already registered
    public Builder type(String name, SchemaNodeId id) {
      Objects.requireNonNull(name, "name must not be null");
      checkOwned(id);
      if (types.putIfAbsent(name, id) != null) {
        throw new IllegalArgumentException("type already registered: " + name);
      }
      return this;
    }

    SchemaNode peek(SchemaNodeId id) {
      return nodes.get(checkOwned(id).index());
    }

    public boolean hasType(String name) {
      return types.containsKey(name);
    }

    public Builder naming(NamingOptions naming) {
      this.naming = Objects.requireNonNull(naming, "naming must not be null");
      return this;
    }

    /// A builder without an explicit root gets an `Any` root
    public SchemaDocument build() {
      final var effectiveRoot = root != null ? root : add(new SchemaNodeContent.AnySchema());
      return new SchemaDocument(List.copyOf(nodes), effectiveRoot,
          Collections.unmodifiableMap(new LinkedHashMap<>(types)), naming);
    }

    private SchemaNodeId checkOwned(SchemaNodeId id) {
      Objects.requireNonNull(id, "id must not be null");
      if (id.index() >= nodes.size()) {
        throw new IllegalArgumentException("SchemaNodeId " + id + " was not added to this builder");
      }
      return id;
    }
  }
}
