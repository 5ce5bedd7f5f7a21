package eure.schema;

import eure.document.Document;
import eure.document.EurePath;
import eure.document.ObjectKey;
import eure.document.Value;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Arrays, maps and tuples
class CollectionValidationTest extends SchemaTestBase {

  private static Value tuple(Value... elements) {
    return new Value.TupleValue(List.of(elements));
  }

  private static Value array(Value... elements) {
    return new Value.ArrayValue(List.of(elements));
  }

  /// A length mismatch is one error, never one per slot
  @Test
  void tupleArityMismatchIsASingleError() {
    final var schema = Document.builder()
        .set("#0", Value.text(".text"))
        .set("#1", Value.text(".integer"))
        .build();
    final var result = validate(schema, Document.fromValue(tuple(Value.text("a"), Value.integer(1), Value.bool(true))));

    assertThat(result.errors()).hasSize(1);
    final var error = result.errors().get(0);
    assertThat(error.kind()).isEqualTo(ErrorKind.ARITY_MISMATCH);
    assertThat(error.message()).isEqualTo("expected 2 elements, got 3");
  }

  /// Positions present in both are still checked
  @Test
  void tupleOverlappingPositionsAreValidated() {
    final var schema = Document.builder()
        .set("#0", Value.text(".text"))
        .set("#1", Value.text(".integer"))
        .build();
    final var result = validate(schema, Document.fromValue(tuple(Value.integer(5))));
    assertThat(result.errors()).extracting(ValidationError::kind)
        .containsExactly(ErrorKind.ARITY_MISMATCH, ErrorKind.TYPE_MISMATCH);
    assertThat(result.errors().get(1).path()).isEqualTo(EurePath.parse("#0"));
  }

  @Test
  void arrayItemsAreValidatedWithIndexedPaths() {
    final var schema = Document.builder().set("ports[]", Value.text(".integer")).build();
    final var result = validate(schema, Document.builder()
        .set("ports", array(Value.integer(80), Value.text("http"), Value.integer(443)))
        .build());
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).path().toString()).isEqualTo("ports[1]");
  }

  @Test
  void arrayLengthAndUniqueness() {
    final var schema = Document.builder()
        .set("tags.$array", Value.text(".text"))
        .set("tags.$max-length", Value.integer(2))
        .set("tags.$unique", Value.bool(true))
        .build();
    final var result = validate(schema, Document.builder()
        .set("tags", array(Value.text("a"), Value.text("b"), Value.text("a")))
        .build());
    assertThat(result.errors()).extracting(ValidationError::kind)
        .containsExactly(ErrorKind.ARRAY_LENGTH_OUT_OF_BOUNDS, ErrorKind.ARRAY_NOT_UNIQUE);
    assertThat(result.errors().get(1).path().toString()).isEqualTo("tags[2]");
    assertThat(result.errors().get(1).message()).isEqualTo("element 2 repeats element 0");
  }

  @Test
  void mapKeysAndValuesAreChecked() {
    final var entries = new LinkedHashMap<ObjectKey, Value>();
    entries.put(ObjectKey.integer(80), Value.text("http"));
    entries.put(ObjectKey.text("https"), Value.integer(443));
    final var keyed = Document.builder()
        .set("ports.$map.key", Value.text(".integer"))
        .set("ports.$map.value", Value.text(".text"))
        .build();
    final var result = validate(keyed, Document.builder().set("ports", new Value.MapValue(entries)).build());

    assertThat(result.errors()).extracting(ValidationError::kind)
        .containsExactly(ErrorKind.TYPE_MISMATCH, ErrorKind.TYPE_MISMATCH);
    assertThat(result.errors()).extracting(e -> e.path().toString())
        .containsExactly("ports.\"https\"", "ports.\"https\"");
  }

  @Test
  void mapSizeBounds() {
    final var schema = Document.builder()
        .set("env.$map.value", Value.text(".text"))
        .set("env.$min-size", Value.integer(1))
        .build();
    final var result = validate(schema, Document.builder()
        .set("env", new Value.MapValue(new LinkedHashMap<>()))
        .build());
    assertThat(result.errors()).extracting(ValidationError::kind).containsExactly(ErrorKind.MAP_SIZE_OUT_OF_BOUNDS);
  }

  /// Only primitive kinds can describe keys
  @Test
  void compositeKeySchemaIsInvalid() {
    final var builder = SchemaDocument.builder();
    final var key = builder.add(new SchemaNodeContent.ArraySchema(builder.add(new SchemaNodeContent.AnySchema()), null, null, false));
    final var value = builder.add(new SchemaNodeContent.AnySchema());
    builder.root(builder.add(new SchemaNodeContent.MapSchema(key, value, null, null)));
    final var entries = new LinkedHashMap<ObjectKey, Value>();
    entries.put(ObjectKey.ident("a"), Value.integer(1));

    final var result = SchemaValidator.of(builder.build()).validate(Document.fromValue(new Value.MapValue(entries)));
    assertThat(result.errors()).extracting(ValidationError::kind).containsExactly(ErrorKind.INVALID_KEY_TYPE);
  }

  @Test
  void collectionKindMismatches() {
    final var schema = Document.builder()
        .set("list[]", Value.text(".integer"))
        .set("pair.#0", Value.text(".integer"))
        .set("pair.#1", Value.text(".integer"))
        .build();
    final var result = validate(schema, Document.builder()
        .set("list", tuple(Value.integer(1)))
        .set("pair", array(Value.integer(1), Value.integer(2)))
        .build());
    assertThat(result.errors()).extracting(ValidationError::message)
        .containsExactly("expected array, got tuple", "expected tuple, got array");
  }
}
