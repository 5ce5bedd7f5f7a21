package eure.document;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.logging.Logger;

/// Recursive descent parser for the rendered form of [EurePath].
///
/// Grammar:
/// - `(root)` or the empty string : root path
/// - `name` : identifier
/// - `$name` : extension identifier
/// - `"text"` : text key, with `\"`, `\\`, `\n`, `\r`, `\t` and four-digit unicode escapes
/// - `42`, `-1` : integer key
/// - `#3` : tuple index
/// - `[3]` or `[]` : array index or append position, written without a leading dot
final class EurePathParser {

  private static final Logger LOG = Logger.getLogger(EurePathParser.class.getName());

  private final String path;
  private int pos;

  private EurePathParser(String path) {
    this.path = path;
    this.pos = 0;
  }

  static EurePath parse(String path) {
    LOG.finer(() -> "Parsing EurePath: " + path);
    if (path.isEmpty() || path.equals("(root)")) {
      return EurePath.root();
    }
    return new EurePathParser(path).parsePath();
  }

  private EurePath parsePath() {
    final var segments = new ArrayList<PathSegment>();
    boolean first = true;
    while (pos < path.length()) {
      final char c = path.charAt(pos);
      if (c == '[') {
        segments.add(parseArrayIndex());
      } else if (first) {
        segments.add(parseDotted());
      } else if (c == '.') {
        pos++;
        if (pos >= path.length()) {
          throw new PathParseException("Unexpected end of path after '.'", path, pos);
        }
        segments.add(parseDotted());
      } else {
        throw new PathParseException("Expected '.' or '['", path, pos);
      }
      first = false;
    }
    return new EurePath(segments);
  }

  private PathSegment parseDotted() {
    final char c = path.charAt(pos);
    if (c == '$') {
      pos++;
      return new PathSegment.Extension(parseIdentifier());
    }
    if (c == '#') {
      pos++;
      final int start = pos;
      final var digits = parseDigits();
      final var index = new BigInteger(digits);
      if (index.compareTo(BigInteger.valueOf(PathSegment.TupleIndex.MAX)) > 0) {
        throw new PathParseException("Tuple index out of range 0.." + PathSegment.TupleIndex.MAX, path, start);
      }
      return new PathSegment.TupleIndex(index.intValue());
    }
    if (c == '"') {
      return new PathSegment.ValueKey(Value.text(parseQuoted()));
    }
    if (c == '-' || isDigit(c)) {
      final boolean negative = c == '-';
      if (negative) pos++;
      final var digits = parseDigits();
      return new PathSegment.ValueKey(new Value.IntegerValue(new BigInteger(negative ? "-" + digits : digits)));
    }
    return new PathSegment.Ident(parseIdentifier());
  }

  private PathSegment.ArrayIndex parseArrayIndex() {
    pos++; // skip [
    if (pos < path.length() && path.charAt(pos) == ']') {
      pos++;
      return PathSegment.ArrayIndex.append();
    }
    final int start = pos;
    final var digits = parseDigits();
    if (pos >= path.length() || path.charAt(pos) != ']') {
      throw new PathParseException("Expected ']'", path, pos);
    }
    pos++;
    final var index = new BigInteger(digits);
    if (index.bitLength() > 31) {
      throw new PathParseException("Array index too large", path, start);
    }
    return new PathSegment.ArrayIndex(index.intValue());
  }

  private String parseIdentifier() {
    final int start = pos;
    while (pos < path.length()) {
      final char c = path.charAt(pos);
      if (c == '.' || c == '[' || c == '"') break;
      pos++;
    }
    final var name = path.substring(start, pos);
    if (!Identifiers.isValid(name)) {
      throw new PathParseException("Invalid identifier '" + name + "'", path, start);
    }
    return name;
  }

  private String parseDigits() {
    final int start = pos;
    while (pos < path.length() && isDigit(path.charAt(pos))) {
      pos++;
    }
    if (start == pos) {
      throw new PathParseException("Expected digits", path, pos);
    }
    return path.substring(start, pos);
  }

  private String parseQuoted() {
    pos++; // skip opening quote
    final var sb = new StringBuilder();
    while (pos < path.length()) {
      final char c = path.charAt(pos);
      if (c == '"') {
        pos++;
        return sb.toString();
      }
      if (c == '\\') {
        pos++;
        if (pos >= path.length()) {
          throw new PathParseException("Unterminated escape sequence", path, pos);
        }
        final char escaped = path.charAt(pos);
        switch (escaped) {
          case '"' -> sb.append('"');
          case '\\' -> sb.append('\\');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 >= path.length()) {
              throw new PathParseException("Truncated unicode escape", path, pos);
            }
            try {
              sb.append((char) Integer.parseInt(path.substring(pos + 1, pos + 5), 16));
            } catch (NumberFormatException e) {
              throw new PathParseException("Invalid unicode escape", path, pos);
            }
            pos += 4;
          }
          default -> throw new PathParseException("Unknown escape '\\" + escaped + "'", path, pos);
        }
        pos++;
      } else {
        sb.append(c);
        pos++;
      }
    }
    throw new PathParseException("Unterminated quoted key", path, pos);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
