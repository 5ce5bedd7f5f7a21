package eure.document;

import java.util.regex.Pattern;

/// Lexical rules for plain and extension identifiers
public final class Identifiers {

  private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_-]*");

  private Identifiers() {}

  /// True when `name` can be written as a bare key, e.g. `user_name` or `variant-repr`
  public static boolean isValid(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }

  static String require(String name, String what) {
    if (!isValid(name)) {
      throw new IllegalArgumentException("invalid " + what + ": '" + name + "'");
    }
    return name;
  }
}
