package eure.document;

/// Read-mode resolution reached a segment that does not exist
public class PathNotFoundException extends DocumentException {

  private static final long serialVersionUID = 1L;

  private final int failedSegment;

  public PathNotFoundException(EurePath path, int failedSegment) {
    super("path not found: " + path + " (no segment " + failedSegment + " '"
        + EurePath.of(path.segments().get(failedSegment)) + "')", path);
    this.failedSegment = failedSegment;
  }

  /// Index into [EurePath#segments()] of the first segment that did not resolve
  public int failedSegment() {
    return failedSegment;
  }
}
