package eure.document;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Address of a node, as a sequence of [PathSegment]s from a start node.
///
/// Every diagnostic carries one of these. The rendering is deterministic:
/// `(root)` for the empty path, then `a.b`, `$ext`, `"quoted key"`, `42`, `#0`, `[3]`
/// and `[]` for the append position. [#parse(String)] reads that syntax back.
public record EurePath(List<PathSegment> segments) {

  private static final EurePath ROOT = new EurePath(List.of());

  public EurePath {
    segments = List.copyOf(segments);
  }

  public static EurePath root() {
    return ROOT;
  }

  public static EurePath of(PathSegment... segments) {
    return new EurePath(List.of(segments));
  }

  /// Parses the rendered form
  /// @throws PathParseException if the text is not a valid path
  public static EurePath parse(String text) {
    Objects.requireNonNull(text, "text must not be null");
    return EurePathParser.parse(text);
  }

  public EurePath append(PathSegment segment) {
    Objects.requireNonNull(segment, "segment must not be null");
    final var next = new ArrayList<PathSegment>(segments.size() + 1);
    next.addAll(segments);
    next.add(segment);
    return new EurePath(next);
  }

  public EurePath appendIdent(String name) {
    return append(new PathSegment.Ident(name));
  }

  public EurePath appendExtension(String name) {
    return append(new PathSegment.Extension(name));
  }

  public EurePath appendKey(ObjectKey key) {
    return append(key.toSegment());
  }

  public EurePath appendTupleIndex(int index) {
    return append(new PathSegment.TupleIndex(index));
  }

  public EurePath appendArrayIndex(int index) {
    return append(new PathSegment.ArrayIndex(index));
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  public int size() {
    return segments.size();
  }

  public EurePath parent() {
    if (isRoot()) {
      throw new IllegalStateException("root path has no parent");
    }
    return new EurePath(segments.subList(0, segments.size() - 1));
  }

  public Optional<PathSegment> lastSegment() {
    return isRoot() ? Optional.empty() : Optional.of(segments.get(segments.size() - 1));
  }

  /// True when this path equals `prefix` or lies below it
  public boolean startsWith(EurePath prefix) {
    return prefix.size() <= size() && segments.subList(0, prefix.size()).equals(prefix.segments());
  }

  @Override
  public String toString() {
    if (segments.isEmpty()) {
      return "(root)";
    }
    final var sb = new StringBuilder();
    boolean first = true;
    for (final var segment : segments) {
      if (segment instanceof PathSegment.ArrayIndex a) {
        sb.append('[');
        if (a.index() != null) sb.append(a.index());
        sb.append(']');
      } else {
        if (!first) sb.append('.');
        renderDotted(segment, sb);
      }
      first = false;
    }
    return sb.toString();
  }

  private static void renderDotted(PathSegment segment, StringBuilder sb) {
    if (segment instanceof PathSegment.Ident i) {
      sb.append(i.name());
    } else if (segment instanceof PathSegment.Extension e) {
      sb.append('$').append(e.name());
    } else if (segment instanceof PathSegment.TupleIndex t) {
      sb.append('#').append(t.index());
    } else if (segment instanceof PathSegment.ValueKey v) {
      if (v.key() instanceof Value.TextValue text) {
        quote(text.content(), sb);
      } else {
        final BigInteger n = ((Value.IntegerValue) v.key()).value();
        sb.append(n);
      }
    }
  }

  static void quote(String s, StringBuilder sb) {
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }
}
