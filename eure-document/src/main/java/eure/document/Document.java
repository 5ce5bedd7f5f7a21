package eure.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Finalized, immutable tree of addressable nodes.
///
/// A document owns every [Node] it contains and is the only issuer of their
/// [NodeId]s. Instances are produced by [DocumentBuilder#build()] and may be
/// shared freely between threads.
public final class Document {

  private static final Logger LOG = Logger.getLogger(Document.class.getName());

  private final List<Node> nodes;
  private final NodeId root;

  Document(List<Node> nodes, NodeId root) {
    this.nodes = List.copyOf(nodes);
    this.root = root;
  }

  public static DocumentBuilder builder() {
    return new DocumentBuilder();
  }

  /// Rebuilds a document from its value projection
  public static Document fromValue(Value value) {
    return new DocumentBuilder().set(EurePath.root(), value).build();
  }

  public NodeId root() {
    return root;
  }

  public Node rootNode() {
    return node(root);
  }

  public int size() {
    return nodes.size();
  }

  /// Dereferences an id issued by this document
  public Node node(NodeId id) {
    Objects.requireNonNull(id, "id must not be null");
    if (id.index() >= nodes.size()) {
      throw new IllegalArgumentException("NodeId " + id + " was not issued by this document");
    }
    return nodes.get(id.index());
  }

  public NodeId resolve(EurePath path) {
    return resolve(root, path);
  }

  /// Read-mode resolution
  /// @throws PathNotFoundException naming the first segment that does not exist
  public NodeId resolve(NodeId start, EurePath path) {
    Objects.requireNonNull(path, "path must not be null");
    NodeId current = start;
    for (int i = 0; i < path.size(); i++) {
      final var next = child(current, path.segments().get(i));
      if (next.isEmpty()) {
        final int failed = i;
        LOG.finest(() -> "resolve failed at segment " + failed + " of " + path);
        throw new PathNotFoundException(path, i);
      }
      current = next.get();
    }
    return current;
  }

  public Optional<NodeId> find(EurePath path) {
    return find(root, path);
  }

  public Optional<NodeId> find(NodeId start, EurePath path) {
    Objects.requireNonNull(path, "path must not be null");
    NodeId current = start;
    for (final var segment : path.segments()) {
      final var next = child(current, segment);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      current = next.get();
    }
    return Optional.of(current);
  }

  /// Single read-mode step. The append position `[]` never resolves.
  public Optional<NodeId> child(NodeId parent, PathSegment segment) {
    final var node = node(parent);
    if (segment instanceof PathSegment.Extension e) {
      return node.extension(e.name());
    }
    final var content = node.content();
    if (segment instanceof PathSegment.Ident || segment instanceof PathSegment.ValueKey) {
      return content instanceof NodeValue.NodeMap map ? map.get(segment.toKey()) : Optional.empty();
    }
    if (segment instanceof PathSegment.TupleIndex t) {
      return content instanceof NodeValue.NodeTuple tuple && t.index() < tuple.items().size()
          ? Optional.of(tuple.items().get(t.index()))
          : Optional.empty();
    }
    final var index = ((PathSegment.ArrayIndex) segment).index();
    return content instanceof NodeValue.NodeArray array && index != null && index < array.items().size()
        ? Optional.of(array.items().get(index))
        : Optional.empty();
  }

  public Value toValue() {
    return toValue(root);
  }

  /// Lossless projection of the subtree at `id`, extensions included
  public Value toValue(NodeId id) {
    return project(id, true);
  }

  /// Projection of the subtree at `id` with every extension dropped.
  /// Two nodes are structurally equal as data when their content values are equal.
  public Value toContentValue(NodeId id) {
    return project(id, false);
  }

  /// Pending projection of one node; children are projected before `assembled` is set
  private record Projection(NodeId id, boolean withExtensions, boolean assembled) {}

  private Value project(NodeId start, boolean withExtensions) {
    final var done = new HashMap<NodeId, Value>();
    final var stack = new ArrayDeque<Projection>();
    stack.push(new Projection(start, withExtensions, false));
    while (!stack.isEmpty()) {
      final var task = stack.pop();
      final var node = node(task.id());
      if (task.assembled()) {
        done.put(task.id(), assemble(node, task.withExtensions(), done));
        continue;
      }
      stack.push(new Projection(task.id(), task.withExtensions(), true));
      if (task.withExtensions()) {
        node.extensions().values().forEach(child -> stack.push(new Projection(child, true, false)));
      }
      for (final var child : contentChildren(node.content())) {
        stack.push(new Projection(child, task.withExtensions(), false));
      }
    }
    return done.get(start);
  }

  private static List<NodeId> contentChildren(NodeValue content) {
    if (content instanceof NodeValue.NodeMap map) {
      return List.copyOf(map.entries().values());
    }
    if (content instanceof NodeValue.NodeArray array) {
      return array.items();
    }
    if (content instanceof NodeValue.NodeTuple tuple) {
      return tuple.items();
    }
    return List.of();
  }

  private static Value assemble(Node node, boolean withExtensions, Map<NodeId, Value> done) {
    final Value content;
    if (node.content() instanceof NodeValue.Hole hole) {
      content = new Value.HoleValue(hole.label());
    } else if (node.content() instanceof NodeValue.Primitive primitive) {
      content = primitive.value();
    } else if (node.content() instanceof NodeValue.NodeMap map) {
      final var entries = new LinkedHashMap<ObjectKey, Value>();
      map.entries().forEach((key, child) -> entries.put(key, done.get(child)));
      content = new Value.MapValue(entries);
    } else if (node.content() instanceof NodeValue.NodeArray array) {
      content = new Value.ArrayValue(collect(array.items(), done));
    } else {
      content = new Value.TupleValue(collect(((NodeValue.NodeTuple) node.content()).items(), done));
    }
    if (!withExtensions || node.extensions().isEmpty()) {
      return content;
    }
    final var exts = new LinkedHashMap<String, Value>();
    node.extensions().forEach((name, child) -> exts.put(name, done.get(child)));
    return new Value.AnnotatedValue(content, exts);
  }

  private static List<Value> collect(List<NodeId> ids, Map<NodeId, Value> done) {
    final var out = new ArrayList<Value>(ids.size());
    for (final var id : ids) {
      out.add(done.get(id));
    }
    return out;
  }

  static Node freeze(NodeValue content, Map<String, NodeId> extensions) {
    final NodeValue frozen;
    if (content instanceof NodeValue.NodeMap map) {
      frozen = new NodeValue.NodeMap(Collections.unmodifiableMap(new LinkedHashMap<>(map.entries())));
    } else if (content instanceof NodeValue.NodeArray array) {
      frozen = new NodeValue.NodeArray(List.copyOf(array.items()));
    } else if (content instanceof NodeValue.NodeTuple tuple) {
      frozen = new NodeValue.NodeTuple(List.copyOf(tuple.items()));
    } else {
      frozen = content;
    }
    final Map<String, NodeId> frozenExtensions = extensions.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    return new Node(frozen, frozenExtensions);
  }

  @Override
  public String toString() {
    return "Document[nodes=" + nodes.size() + ", root=" + root + "]";
  }
}
