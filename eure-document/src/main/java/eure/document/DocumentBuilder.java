package eure.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Mutable, single-owner construction of a [Document].
///
/// Every node starts out as a [NodeValue.Hole]. Construction-mode resolution turns a
/// Hole into the container the next segment needs: a map for identifier and key
/// segments, an array for `[i]` and `[]`, a tuple for `#i`. Extension segments
/// attach to any node kind. Once [#build()] has been called the builder refuses
/// further use, so a finalized document is never mutated in place.
public final class DocumentBuilder {

  private static final Logger LOG = Logger.getLogger(DocumentBuilder.class.getName());

  private final List<NodeValue> contents = new ArrayList<>();
  private final List<Map<String, NodeId>> extensions = new ArrayList<>();
  private final NodeId root;
  private boolean built;

  public DocumentBuilder() {
    this.root = allocate();
  }

  public NodeId root() {
    return root;
  }

  /// Resolves `path` from the root, creating missing nodes on the way
  public NodeId resolveOrCreate(EurePath path) {
    return resolveOrCreate(root, path);
  }

  /// Resolves `path` from `start`, creating missing nodes on the way
  /// @throws InsertException if an existing node cannot hold the next segment
  public NodeId resolveOrCreate(NodeId start, EurePath path) {
    Objects.requireNonNull(path, "path must not be null");
    checkOpen();
    checkIssued(start);
    NodeId current = start;
    for (int i = 0; i < path.size(); i++) {
      current = step(current, path.segments().get(i), new EurePath(path.segments().subList(0, i + 1)));
    }
    return current;
  }

  /// Assigns `value` at `path`. The target must still be a Hole.
  public DocumentBuilder set(EurePath path, Value value) {
    Objects.requireNonNull(value, "value must not be null");
    final var target = resolveOrCreate(path);
    assign(target, value, path);
    return this;
  }

  public DocumentBuilder set(String path, Value value) {
    return set(EurePath.parse(path), value);
  }

  /// Declares an unlabelled Hole at `path`
  public DocumentBuilder hole(String path) {
    return set(EurePath.parse(path), Value.hole());
  }

  /// Finalizes the tree. The builder cannot be used afterwards.
  public Document build() {
    checkOpen();
    built = true;
    final var nodes = new ArrayList<Node>(contents.size());
    for (int i = 0; i < contents.size(); i++) {
      nodes.add(Document.freeze(contents.get(i), extensions.get(i)));
    }
    LOG.fine(() -> "DocumentBuilder finalized with " + nodes.size() + " nodes");
    return new Document(nodes, root);
  }

  private NodeId allocate() {
    final var id = new NodeId(contents.size());
    contents.add(new NodeValue.Hole(null));
    extensions.add(new LinkedHashMap<>());
    return id;
  }

  private NodeId step(NodeId current, PathSegment segment, EurePath at) {
    if (segment instanceof PathSegment.Extension e) {
      final var slots = extensions.get(current.index());
      final var existing = slots.get(e.name());
      if (existing != null) {
        return existing;
      }
      final var created = allocate();
      slots.put(e.name(), created);
      return created;
    }
    if (segment instanceof PathSegment.Ident || segment instanceof PathSegment.ValueKey) {
      return stepMap(current, segment.toKey(), at);
    }
    if (segment instanceof PathSegment.TupleIndex t) {
      return stepTuple(current, t.index(), at);
    }
    return stepArray(current, ((PathSegment.ArrayIndex) segment).index(), at);
  }

  private NodeId stepMap(NodeId current, ObjectKey key, EurePath at) {
    var content = contents.get(current.index());
    if (content instanceof NodeValue.Hole) {
      content = new NodeValue.NodeMap(new LinkedHashMap<>());
      contents.set(current.index(), content);
    }
    if (!(content instanceof NodeValue.NodeMap map)) {
      throw new InsertException(InsertException.Kind.EXPECTED_MAP, at.parent(), content.kindName());
    }
    final var existing = map.entries().get(key);
    if (existing != null) {
      return existing;
    }
    final var created = allocate();
    map.entries().put(key, created);
    return created;
  }

  private NodeId stepTuple(NodeId current, int index, EurePath at) {
    var content = contents.get(current.index());
    if (content instanceof NodeValue.Hole) {
      content = new NodeValue.NodeTuple(new ArrayList<>());
      contents.set(current.index(), content);
    }
    if (!(content instanceof NodeValue.NodeTuple tuple)) {
      throw new InsertException(InsertException.Kind.EXPECTED_TUPLE, at.parent(), content.kindName());
    }
    final var items = tuple.items();
    if (index < items.size()) {
      return items.get(index);
    }
    if (index > items.size()) {
      throw new InsertException(InsertException.Kind.TUPLE_INDEX_OUT_OF_RANGE, at, items.size());
    }
    final var created = allocate();
    items.add(created);
    return created;
  }

  private NodeId stepArray(NodeId current, Integer index, EurePath at) {
    var content = contents.get(current.index());
    if (content instanceof NodeValue.Hole) {
      content = new NodeValue.NodeArray(new ArrayList<>());
      contents.set(current.index(), content);
    }
    if (!(content instanceof NodeValue.NodeArray array)) {
      throw new InsertException(InsertException.Kind.EXPECTED_ARRAY, at.parent(), content.kindName());
    }
    final var items = array.items();
    if (index != null && index < items.size()) {
      return items.get(index);
    }
    if (index != null && index > items.size()) {
      throw new InsertException(InsertException.Kind.ARRAY_INDEX_OUT_OF_RANGE, at, items.size());
    }
    final var created = allocate();
    items.add(created);
    return created;
  }

  /// A value still to be written into a freshly resolved node
  private record Assignment(NodeId target, Value value, EurePath at) {}

  private void assign(NodeId target, Value value, EurePath at) {
    final var stack = new ArrayDeque<Assignment>();
    stack.push(new Assignment(target, value, at));
    while (!stack.isEmpty()) {
      final var task = stack.pop();
      final var current = contents.get(task.target().index());
      if (!(current instanceof NodeValue.Hole)) {
        throw new InsertException(InsertException.Kind.ALREADY_ASSIGNED, task.at(), current.kindName());
      }
      final var pending = new ArrayList<Assignment>();
      var content = task.value();
      if (content instanceof Value.AnnotatedValue annotated) {
        content = annotated.value();
        pending.addAll(fill(task.target(), content, task.at()));
        for (final var ext : annotated.extensions().entrySet()) {
          final var slotPath = task.at().appendExtension(ext.getKey());
          pending.add(new Assignment(step(task.target(), new PathSegment.Extension(ext.getKey()), slotPath),
              ext.getValue(), slotPath));
        }
      } else {
        pending.addAll(fill(task.target(), content, task.at()));
      }
      for (int i = pending.size() - 1; i >= 0; i--) {
        stack.push(pending.get(i));
      }
    }
  }

  /// Writes one level of `value` into `target` and returns the child assignments it leaves open
  private List<Assignment> fill(NodeId target, Value value, EurePath at) {
    final var children = new ArrayList<Assignment>();
    if (value instanceof Value.Primitive primitive) {
      contents.set(target.index(), new NodeValue.Primitive(primitive));
    } else if (value instanceof Value.HoleValue hole) {
      contents.set(target.index(), new NodeValue.Hole(hole.label()));
    } else if (value instanceof Value.MapValue map) {
      final var entries = new LinkedHashMap<ObjectKey, NodeId>();
      contents.set(target.index(), new NodeValue.NodeMap(entries));
      for (final var entry : map.entries().entrySet()) {
        final var child = allocate();
        entries.put(entry.getKey(), child);
        children.add(new Assignment(child, entry.getValue(), at.appendKey(entry.getKey())));
      }
    } else if (value instanceof Value.ArrayValue array) {
      final var items = new ArrayList<NodeId>();
      contents.set(target.index(), new NodeValue.NodeArray(items));
      for (int i = 0; i < array.elements().size(); i++) {
        final var child = allocate();
        items.add(child);
        children.add(new Assignment(child, array.elements().get(i), at.appendArrayIndex(i)));
      }
    } else if (value instanceof Value.TupleValue tuple) {
      final var items = new ArrayList<NodeId>();
      contents.set(target.index(), new NodeValue.NodeTuple(items));
      for (int i = 0; i < tuple.elements().size(); i++) {
        final var child = allocate();
        items.add(child);
        children.add(new Assignment(child, tuple.elements().get(i), at.appendTupleIndex(i)));
      }
    }
    return children;
  }

  private void checkOpen() {
    if (built) {
      throw new IllegalStateException("DocumentBuilder has already been finalized");
    }
  }

  private void checkIssued(NodeId id) {
    Objects.requireNonNull(id, "id must not be null");
    if (id.index() >= contents.size()) {
      throw new IllegalArgumentException("NodeId " + id + " was not issued by this builder");
    }
  }
}
