package eure.document;

import java.util.Objects;

/// One step of an [EurePath]
public sealed interface PathSegment {

  /// Plain identifier, e.g. `name`
  record Ident(String name) implements PathSegment {
    public Ident {
      Identifiers.require(name, "identifier");
    }
  }

  /// Extension identifier, e.g. `$type`
  record Extension(String name) implements PathSegment {
    public Extension {
      Identifiers.require(name, "extension identifier");
    }
  }

  /// Literal map key, e.g. `"content-type"` or `42`
  record ValueKey(Value.Primitive key) implements PathSegment {
    public ValueKey {
      Objects.requireNonNull(key, "key must not be null");
      new ObjectKey.Literal(key);
    }
  }

  /// Tuple position, `#0` to `#255`
  record TupleIndex(int index) implements PathSegment {
    public static final int MAX = 255;

    public TupleIndex {
      if (index < 0 || index > MAX) {
        throw new IllegalArgumentException("tuple index must be within 0.." + MAX + ": " + index);
      }
    }
  }

  /// Array position. A null index is the append position `[]`.
  record ArrayIndex(Integer index) implements PathSegment {
    public ArrayIndex {
      if (index != null && index < 0) {
        throw new IllegalArgumentException("array index must not be negative: " + index);
      }
    }

    public static ArrayIndex append() {
      return new ArrayIndex(null);
    }
  }

  /// Map key this segment reads through, when it addresses map content
  default ObjectKey toKey() {
    if (this instanceof Ident i) return new ObjectKey.Ident(i.name());
    if (this instanceof Extension e) return new ObjectKey.Extension(e.name());
    if (this instanceof ValueKey v) return new ObjectKey.Literal(v.key());
    throw new IllegalStateException("segment " + this + " does not address a key");
  }
}
