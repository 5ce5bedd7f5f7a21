package eure.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Naming convention applied by code generators when mapping document keys to native names.
/// Informational only: it never changes what the validator accepts.
public enum RenameRule {
  CAMEL_CASE("camelCase"),
  SNAKE_CASE("snake_case"),
  KEBAB_CASE("kebab-case"),
  PASCAL_CASE("PascalCase"),
  LOWERCASE("lowercase"),
  UPPERCASE("UPPERCASE");

  private final String spelling;

  RenameRule(String spelling) {
    this.spelling = spelling;
  }

  /// Spelling used in `$rename-all`
  public String spelling() {
    return spelling;
  }

  public static Optional<RenameRule> fromSpelling(String text) {
    for (final var rule : values()) {
      if (rule.spelling.equals(text)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  /// Re-spells `name`. Word boundaries are `_`, `-` and lower-to-upper case changes.
  public String apply(String name) {
    final var words = words(name);
    final var sb = new StringBuilder();
    for (int i = 0; i < words.size(); i++) {
      final var word = words.get(i).toLowerCase(Locale.ROOT);
      switch (this) {
        case CAMEL_CASE -> sb.append(i == 0 ? word : capitalize(word));
        case PASCAL_CASE -> sb.append(capitalize(word));
        case SNAKE_CASE -> sb.append(i == 0 ? "" : "_").append(word);
        case KEBAB_CASE -> sb.append(i == 0 ? "" : "-").append(word);
        case LOWERCASE -> sb.append(word);
        case UPPERCASE -> sb.append(word.toUpperCase(Locale.ROOT));
      }
    }
    return sb.toString();
  }

  private static List<String> words(String name) {
    final var words = new ArrayList<String>();
    final var current = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (c == '_' || c == '-') {
        flush(current, words);
      } else {
        if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(name.charAt(i - 1))) {
          flush(current, words);
        }
        current.append(c);
      }
    }
    flush(current, words);
    return words;
  }

  private static void flush(StringBuilder current, List<String> words) {
    if (current.length() > 0) {
      words.add(current.toString());
      current.setLength(0);
    }
  }

  private static String capitalize(String word) {
    return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
  }
}
