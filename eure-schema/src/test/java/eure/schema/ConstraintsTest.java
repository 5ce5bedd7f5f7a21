package eure.schema;

import eure.document.Document;
import eure.document.DocumentBuilder;
import eure.document.EurePath;
import eure.document.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Constraint annotations and their malformed forms
class ConstraintsTest extends SchemaTestBase {

  private static SchemaNodeContent field(String type, UnaryOperator<DocumentBuilder> annotations) {
    final var schema = extract(annotations.apply(Document.builder().set("f", Value.text(type))).build());
    final var root = (SchemaNodeContent.RecordSchema) schema.node(schema.root()).content();
    return schema.node(root.fields().get("f").schema()).content();
  }

  private static SchemaException malformed(String type, UnaryOperator<DocumentBuilder> annotations) {
    final var doc = annotations.apply(Document.builder().set("f", Value.text(type))).build();
    try {
      SchemaExtractor.extract(doc);
    } catch (SchemaException e) {
      assertThat(e.kind()).isEqualTo(SchemaException.Kind.MALFORMED_CONSTRAINT);
      return e;
    }
    throw new AssertionError("expected MALFORMED_CONSTRAINT");
  }

  @Test
  void textLengthAndPattern() {
    final var text = field(".text", b -> b
        .set("f.$min-length", Value.integer(2))
        .set("f.$max-length", Value.integer(8))
        .set("f.$pattern", Value.text("^[a-z]+$")));
    assertThat(text).isEqualTo(new SchemaNodeContent.TextSchema(2, 8, "^[a-z]+$", null));
  }

  /// `$length` is exact for an integer, a range for a tuple with open ends as null
  @Test
  void lengthShorthand() {
    assertThat(field(".text", b -> b.set("f.$length", Value.integer(4))))
        .isEqualTo(new SchemaNodeContent.TextSchema(4, 4, null, null));
    assertThat(field(".text", b -> b
        .set("f.$length.#0", Value.integer(1))
        .set("f.$length.#1", Value.nul())))
        .isEqualTo(new SchemaNodeContent.TextSchema(1, null, null, null));
  }

  @Test
  void integerBoundsAndMultipleOf() {
    final var integer = (SchemaNodeContent.IntegerSchema) field(".integer", b -> b
        .set("f.$exclusive-min", Value.integer(0))
        .set("f.$max", Value.integer(100))
        .set("f.$multiple-of", Value.integer(5)));
    assertThat(integer.min()).isEqualTo(Bound.exclusive(BigInteger.ZERO));
    assertThat(integer.max()).isEqualTo(Bound.inclusive(BigInteger.valueOf(100)));
    assertThat(integer.multipleOf()).isEqualTo(BigInteger.valueOf(5));
  }

  /// Tuple ends are inclusive; null is open
  @Test
  void rangeTuple() {
    final var integer = (SchemaNodeContent.IntegerSchema) field(".integer", b -> b
        .set("f.$range.#0", Value.nul())
        .set("f.$range.#1", Value.integer(10)));
    assertThat(integer.min()).isEqualTo(Bound.<BigInteger>unbounded());
    assertThat(integer.max()).isEqualTo(Bound.inclusive(BigInteger.TEN));
  }

  @ParameterizedTest
  @CsvSource(delimiter = ';', value = {
      "[0, 100);[0, 100)",
      "(0, 1];(0, 1]",
      "[, 5];(-inf, 5]",
      "(-1.5, ];(-1.5, +inf)"
  })
  void intervalText(String interval, String described) {
    final var floating = (SchemaNodeContent.FloatSchema) field(".float", b -> b.set("f.$range", Value.text(interval)));
    assertThat(Bound.describe(floating.min(), floating.max())).isEqualTo(described);
  }

  @Test
  void floatBoundsAreExactDecimals() {
    final var floating = (SchemaNodeContent.FloatSchema) field(".float", b -> b
        .set("f.$min", Value.floating(0.1))
        .set("f.$multiple-of", Value.floating(0.05)));
    assertThat(floating.min()).isEqualTo(Bound.inclusive(new BigDecimal("0.1")));
    assertThat(floating.multipleOf()).isEqualTo(new BigDecimal("0.05"));
  }

  @Test
  void arrayAndMapConstraints() {
    final var array = (SchemaNodeContent.ArraySchema) field(".array", b -> b
        .set("f.$min-length", Value.integer(1))
        .set("f.$unique", Value.bool(true)));
    assertThat(array.minLength()).isEqualTo(1);
    assertThat(array.unique()).isTrue();

    final var map = (SchemaNodeContent.MapSchema) field(".map", b -> b
        .set("f.$min-size", Value.integer(1))
        .set("f.$max-size", Value.integer(3)));
    assertThat(map.minSize()).isEqualTo(1);
    assertThat(map.maxSize()).isEqualTo(3);
  }

  @Test
  void floatBoundOnIntegerIsMalformed() {
    final var e = malformed(".integer", b -> b.set("f.$min", Value.floating(1.5)));
    assertThat(e.path()).isEqualTo(EurePath.parse("f.$min"));
    assertThat(e.getMessage()).contains("float bound on an integer type");
  }

  @Test
  void constraintOnWrongKind() {
    final var e = malformed(".boolean", b -> b.set("f.$min", Value.integer(0)));
    assertThat(e.getMessage()).contains("does not apply to boolean");
    malformed(".integer", b -> b.set("f.$pattern", Value.text("x")));
    malformed(".text", b -> b.set("f.$unique", Value.bool(true)));
  }

  @Test
  void conflictingBoundForms() {
    malformed(".integer", b -> b.set("f.$min", Value.integer(0)).set("f.$exclusive-min", Value.integer(0)));
    malformed(".integer", b -> b.set("f.$min", Value.integer(0)).set("f.$range", Value.text("[0, 5]")));
    malformed(".text", b -> b.set("f.$length", Value.integer(3)).set("f.$min-length", Value.integer(1)));
  }

  @Test
  void emptyRangesAreMalformed() {
    malformed(".integer", b -> b.set("f.$min", Value.integer(10)).set("f.$max", Value.integer(1)));
    malformed(".integer", b -> b.set("f.$range", Value.text("[5, 5)")));
    malformed(".text", b -> b.set("f.$min-length", Value.integer(5)).set("f.$max-length", Value.integer(2)));
  }

  @Test
  void malformedValues() {
    malformed(".integer", b -> b.set("f.$multiple-of", Value.integer(0)));
    malformed(".integer", b -> b.set("f.$range", Value.text("0..10")));
    malformed(".float", b -> b.set("f.$max", Value.floating(Double.POSITIVE_INFINITY)));
    malformed(".text", b -> b.set("f.$min-length", Value.integer(-1)));
    malformed(".text", b -> b.set("f.$pattern", Value.text("(unclosed")));
    malformed(".text", b -> b.set("f.$max-length", Value.text("ten")));
  }

  @Test
  void schemaRecordsRejectInvalidProgrammaticBounds() {
    assertThatThrownBy(() -> new SchemaNodeContent.TextSchema(5, 2, null, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SchemaNodeContent.IntegerSchema(Bound.unbounded(), Bound.unbounded(), BigInteger.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
