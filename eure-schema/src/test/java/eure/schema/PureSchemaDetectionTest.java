package eure.schema;

import eure.document.Document;
import eure.document.Value;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/// Telling schema files apart from self-describing data
class PureSchemaDetectionTest extends SchemaTestBase {

  @Test
  void declarationsOnlyIsPure() {
    final var doc = Document.builder()
        .set("$types.User.name", Value.text(".text"))
        .set("user", Value.text(".$types.User"))
        .set("tags[]", Value.text(".text"))
        .set("port.$type", Value.text(".integer"))
        .set("port.$min", Value.integer(1))
        .build();
    assertThat(SchemaExtractor.isPureSchema(doc)).isTrue();
    assertThat(SchemaExtractor.extract(doc).pureSchema()).isTrue();
  }

  /// Example data anywhere outside annotations makes the document self-describing
  @Test
  void exampleDataIsNotPure() {
    final var doc = Document.builder()
        .set("name", Value.text(".text"))
        .set("port", Value.integer(8080))
        .set("port.$type", Value.text(".integer"))
        .build();
    assertThat(SchemaExtractor.isPureSchema(doc)).isFalse();
    assertThat(SchemaExtractor.extract(doc).pureSchema()).isFalse();
  }

  /// Undotted text in value position is data, not a type
  @Test
  void undottedTextIsData() {
    final var doc = Document.builder().set("kind", Value.text("integer")).build();
    assertThat(SchemaExtractor.isPureSchema(doc)).isFalse();
  }

  @Test
  void languageTaggedTextIsData() {
    final var doc = Document.builder().set("code", Value.text(".text", "rust")).build();
    assertThat(SchemaExtractor.isPureSchema(doc)).isFalse();
  }

  @Test
  void holesDoNotCount() {
    final var doc = Document.builder()
        .set("name", Value.text(".text"))
        .hole("later")
        .build();
    assertThat(SchemaExtractor.isPureSchema(doc)).isTrue();
  }
}
