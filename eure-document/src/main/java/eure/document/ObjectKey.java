package eure.document;

import java.util.Objects;
import java.util.Optional;

/// Key of a map entry or extension slot.
///
/// Plain identifiers and extension identifiers live in separate namespaces:
/// `name` and `$name` on the same node never collide. Extension keys address
/// [Node#extensions()], the other two forms address [NodeValue.NodeMap] entries.
public sealed interface ObjectKey {

  /// Plain identifier key such as `name`
  record Ident(String name) implements ObjectKey {
    public Ident {
      Identifiers.require(name, "identifier");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /// Extension identifier key such as `$type`
  record Extension(String name) implements ObjectKey {
    public Extension {
      Identifiers.require(name, "extension identifier");
    }

    @Override
    public String toString() {
      return "$" + name;
    }
  }

  /// Literal key. Only plaintext text and integers are valid map keys.
  record Literal(Value.Primitive value) implements ObjectKey {
    public Literal {
      Objects.requireNonNull(value, "value must not be null");
      final boolean plainText = value instanceof Value.TextValue t && t.isPlaintext();
      if (!plainText && !(value instanceof Value.IntegerValue)) {
        throw new IllegalArgumentException("literal keys must be plaintext or integer, got " + value.kindName());
      }
    }

    @Override
    public String toString() {
      return EurePath.of(new PathSegment.ValueKey(value)).toString();
    }
  }

  static ObjectKey ident(String name) {
    return new Ident(name);
  }

  static ObjectKey text(String key) {
    return new Literal(Value.text(key));
  }

  static ObjectKey integer(long key) {
    return new Literal(Value.integer(key));
  }

  /// Field name this key stands for in a record, if it has one.
  /// Identifiers and text literals name fields; integer keys do not.
  default Optional<String> fieldName() {
    if (this instanceof Ident i) {
      return Optional.of(i.name());
    }
    if (this instanceof Literal l && l.value() instanceof Value.TextValue t) {
      return Optional.of(t.content());
    }
    return Optional.empty();
  }

  /// Path segment that navigates through this key
  default PathSegment toSegment() {
    if (this instanceof Ident i) {
      return new PathSegment.Ident(i.name());
    }
    if (this instanceof Extension e) {
      return new PathSegment.Extension(e.name());
    }
    return new PathSegment.ValueKey(((Literal) this).value());
  }
}
