package eure.document;

/// Thrown when the text form of an [EurePath] cannot be parsed.
/// Unchecked, as a malformed path literal is a programming error.
public class PathParseException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int position;
  private final String path;

  public PathParseException(String message, String path, int position) {
    super(formatMessage(message, path, position));
    this.position = position;
    this.path = path;
  }

  /// Position in the input where parsing stopped
  public int position() {
    return position;
  }

  public String path() {
    return path;
  }

  private static String formatMessage(String message, String path, int position) {
    final var sb = new StringBuilder();
    sb.append(message);
    sb.append(" at position ").append(position);
    sb.append(" in path: ").append(path);
    if (position < path.length()) {
      sb.append(" (near '").append(path.charAt(position)).append("')");
    }
    return sb.toString();
  }
}
