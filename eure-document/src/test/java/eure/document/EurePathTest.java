package eure.document;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Rendering and parsing of [EurePath]
class EurePathTest extends DocumentTestBase {

  @Test
  void rootRendersAsRootMarker() {
    assertThat(EurePath.root()).hasToString("(root)");
    assertThat(EurePath.parse("(root)").isRoot()).isTrue();
    assertThat(EurePath.parse("").isRoot()).isTrue();
  }

  @Test
  void rendersEverySegmentKind() {
    final var path = EurePath.root()
        .appendIdent("config")
        .appendExtension("variant-repr")
        .append(new PathSegment.ValueKey(Value.text("content type")))
        .append(new PathSegment.ValueKey(Value.integer(-7)))
        .appendTupleIndex(2)
        .appendArrayIndex(3)
        .append(PathSegment.ArrayIndex.append());

    assertThat(path).hasToString("config.$variant-repr.\"content type\".-7.#2[3][]");
  }

  @Test
  void arrayIndexAtStartHasNoDot() {
    assertThat(EurePath.root().appendArrayIndex(0).appendIdent("name")).hasToString("[0].name");
  }

  @Test
  void quotedKeysEscapeSpecialCharacters() {
    final var path = EurePath.of(new PathSegment.ValueKey(Value.text("a\"b\\c\nd")));
    assertThat(path).hasToString("\"a\\\"b\\\\c\\nd\"");
    assertThat(EurePath.parse(path.toString())).isEqualTo(path);
  }

  @Test
  void quotedKeysAcceptFourDigitUnicodeEscapes() {
    assertThat(EurePath.parse("\"caf\\u00e9\"").segments())
        .containsExactly(new PathSegment.ValueKey(Value.text("caf\u00e9")));
    assertThatThrownBy(() -> EurePath.parse("\"\\u00\""))
        .isInstanceOf(PathParseException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "a",
      "a.b.c",
      "$types.User",
      "items[0].name",
      "items[]",
      "point.#0",
      "#1.#2",
      "map.\"with space\".x",
      "codes.404",
      "offsets.-1",
      "日本語.名前",
      "$variants.click.x.$optional"
  })
  void parseThenRenderIsIdentity(String text) {
    assertThat(EurePath.parse(text)).hasToString(text);
  }

  @Test
  void parseProducesTypedSegments() {
    final var path = EurePath.parse("$types.Point.#1[4].\"k\".12");
    assertThat(path.segments()).containsExactly(
        new PathSegment.Extension("types"),
        new PathSegment.Ident("Point"),
        new PathSegment.TupleIndex(1),
        new PathSegment.ArrayIndex(4),
        new PathSegment.ValueKey(Value.text("k")),
        new PathSegment.ValueKey(new Value.IntegerValue(BigInteger.valueOf(12))));
  }

  @Test
  void parentAndLastSegment() {
    final var path = EurePath.parse("a.b.#0");
    assertThat(path.parent()).hasToString("a.b");
    assertThat(path.lastSegment()).contains(new PathSegment.TupleIndex(0));
    assertThat(path.startsWith(EurePath.parse("a"))).isTrue();
    assertThat(path.startsWith(EurePath.parse("b"))).isFalse();
    assertThat(EurePath.root().lastSegment()).isEmpty();
    assertThatThrownBy(() -> EurePath.root().parent()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void tupleIndexIsLimitedTo255() {
    assertThat(EurePath.parse("#255").segments()).containsExactly(new PathSegment.TupleIndex(255));
    assertThatThrownBy(() -> EurePath.parse("#256"))
        .isInstanceOf(PathParseException.class)
        .hasMessageContaining("Tuple index out of range");
    assertThatThrownBy(() -> new PathSegment.TupleIndex(256)).isInstanceOf(IllegalArgumentException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {"a..b", "a.", "a b", "[x]", "[1", "\"open", "a.$", "a#1", "a.\"bad\\q\""})
  void malformedPathsReportPosition(String text) {
    assertThatThrownBy(() -> EurePath.parse(text))
        .isInstanceOf(PathParseException.class)
        .satisfies(e -> {
          final var ex = (PathParseException) e;
          assertThat(ex.path()).isEqualTo(text);
          assertThat(ex.position()).isBetween(0, text.length());
        });
  }

  @Test
  void languageTaggedTextIsNotAValidKey() {
    assertThatThrownBy(() -> new PathSegment.ValueKey(Value.text("x", "rust")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PathSegment.ValueKey(Value.bool(true)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
