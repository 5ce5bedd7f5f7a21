package eure.schema;

import eure.document.Document;
import eure.document.EurePath;
import eure.document.ObjectKey;
import eure.document.Value;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/// Structural defects in schema sources abort extraction with a located SchemaException
class ExtractionErrorsTest extends SchemaTestBase {

  private static SchemaException failure(Document doc) {
    final var e = catchThrowableOfType(() -> SchemaExtractor.extract(doc), SchemaException.class);
    assertThat(e).as("expected extraction to fail").isNotNull();
    return e;
  }

  @Test
  void twoTypeBearingAnnotationsConflict() {
    final var e = failure(Document.builder()
        .set("x.$type", Value.text(".integer"))
        .set("x.$array", Value.text(".text"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.CONFLICTING_TYPE_ANNOTATIONS);
    assertThat(e.path()).isEqualTo(EurePath.parse("x"));
    assertThat(e.getMessage()).startsWith("x: conflicting type annotations");
  }

  /// A type expression value plus `$type` declares the type twice
  @Test
  void typeExpressionValueConflictsWithTypeAnnotation() {
    final var e = failure(Document.builder()
        .set("x", Value.text(".text"))
        .set("x.$type", Value.text(".integer"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.CONFLICTING_TYPE_ANNOTATIONS);
  }

  /// `name` and `"name"` are the same field
  @Test
  void identifierAndTextKeyDuplicate() {
    final var entries = new LinkedHashMap<ObjectKey, Value>();
    entries.put(ObjectKey.ident("name"), Value.text(".text"));
    entries.put(ObjectKey.text("name"), Value.text(".integer"));
    final var e = failure(Document.fromValue(new Value.MapValue(entries)));
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.DUPLICATE_FIELD);
    assertThat(e.path()).isEqualTo(EurePath.root().appendKey(ObjectKey.text("name")));
  }

  @Test
  void danglingTypeReferenceIsReportedAtTheReference() {
    final var e = failure(Document.builder()
        .set("owner.$type", Value.text(".$types.Missing"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.DANGLING_TYPE_REFERENCE);
    assertThat(e.path()).isEqualTo(EurePath.parse("owner.$type"));
    assertThat(e.getMessage()).contains("Missing");
  }

  @Test
  void emptyVariantsMap() {
    final var entries = new LinkedHashMap<ObjectKey, Value>();
    final var doc = Document.builder()
        .set("shape.$variants", new Value.MapValue(entries))
        .build();
    assertThat(failure(doc).kind()).isEqualTo(SchemaException.Kind.EMPTY_VARIANT);
  }

  /// Adjacent content needs at least one field to carry
  @Test
  void emptyRecordVariantUnderAdjacentRepresentation() {
    final var doc = Document.builder()
        .set("shape.$variants.none", new Value.MapValue(new LinkedHashMap<>()))
        .set("shape.$variant-repr.tag", Value.text("t"))
        .set("shape.$variant-repr.content", Value.text("c"))
        .build();
    final var e = failure(doc);
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.EMPTY_VARIANT);
    assertThat(e.path()).isEqualTo(EurePath.parse("shape.$variants.none"));
  }

  @Test
  void variantReprWithoutVariants() {
    final var e = failure(Document.builder()
        .set("x", Value.text(".text"))
        .set("x.$variant-repr", Value.text("external"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.INVALID_VARIANT_REPR);
  }

  @Test
  void unknownVariantReprSpelling() {
    final var e = failure(Document.builder()
        .set("x.$variants.a", Value.text(".text"))
        .set("x.$variant-repr", Value.text("untagged-ish"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.INVALID_VARIANT_REPR);
    assertThat(e.path()).isEqualTo(EurePath.parse("x.$variant-repr"));
  }

  @Test
  void adjacentTagAndContentMustDiffer() {
    final var e = failure(Document.builder()
        .set("x.$variants.a.v", Value.text(".text"))
        .set("x.$variant-repr.tag", Value.text("same"))
        .set("x.$variant-repr.content", Value.text("same"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.INVALID_VARIANT_REPR);
  }

  @Test
  void typeOperandMustBeAType() {
    final var e = failure(Document.builder()
        .set("x.$type", Value.text("banana"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.INVALID_TYPE_EXPRESSION);
    assertThat(e.path()).isEqualTo(EurePath.parse("x.$type"));
  }

  @Test
  void namedTypeMustDeclareSomething() {
    final var e = failure(Document.builder()
        .set("$types.Broken", Value.integer(5))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.INVALID_TYPE_EXPRESSION);
    assertThat(e.path()).isEqualTo(EurePath.parse("$types.Broken"));
  }

  @Test
  void unknownRenameRule() {
    final var e = failure(Document.builder()
        .set("$rename-all", Value.text("SCREAMING"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.INVALID_RENAME_RULE);
    assertThat(e.getMessage()).contains("SCREAMING");
  }

  @Test
  void optionalMustBeBoolean() {
    final var e = failure(Document.builder()
        .set("x", Value.text(".text"))
        .set("x.$optional", Value.text("yes"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.MALFORMED_CONSTRAINT);
    assertThat(e.path()).isEqualTo(EurePath.parse("x.$optional"));
  }

  @Test
  void unknownFieldsPolicySpelling() {
    final var e = failure(Document.builder()
        .set("x", Value.text(".text"))
        .set("$unknown-fields", Value.text("maybe"))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.MALFORMED_CONSTRAINT);
  }

  /// Constraints need a declared type to narrow
  @Test
  void constraintOnPlainData() {
    final var e = failure(Document.builder()
        .set("x", Value.integer(3))
        .set("x.$min", Value.integer(0))
        .build());
    assertThat(e.kind()).isEqualTo(SchemaException.Kind.MALFORMED_CONSTRAINT);
    assertThat(e.path()).isEqualTo(EurePath.parse("x.$min"));
  }

  @Test
  void mapRequiresValueType() {
    assertThatThrownBy(() -> SchemaExtractor.extract(Document.builder()
        .set("m.$map.key", Value.text(".text"))
        .build()))
        .isInstanceOf(SchemaException.class)
        .hasMessageContaining("value");
  }
}
