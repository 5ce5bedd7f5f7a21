package eure.schema;

import eure.document.Document;
import eure.document.DocumentBuilder;
import eure.document.ObjectKey;
import eure.document.Value;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based checks over generated schema sources.
/// Each generated shape is rendered to annotations, extracted, and checked against a conforming instance.
class ExtractionPropertyTest extends SchemaTestBase {

  private static final List<String> FIELD_NAMES = List.of("alpha", "beta", "gamma");
  private static final List<String> PRIMITIVES = List.of(".text", ".integer", ".float", ".boolean");

  sealed interface Shape permits Primitive, Fields, ListOf {}

  record Primitive(String type) implements Shape {}

  record Fields(Map<String, Shape> fields) implements Shape {}

  record ListOf(Shape item) implements Shape {}

  private static Arbitrary<Shape> shapes(int depth) {
    final Arbitrary<Shape> primitives = Arbitraries.of(PRIMITIVES).map(Primitive::new);
    if (depth == 0) {
      return primitives;
    }
    return Arbitraries.oneOf(primitives, fields(depth - 1), shapes(depth - 1).map(ListOf::new));
  }

  private static Arbitrary<Shape> fields(int depth) {
    return shapes(depth).list().ofMinSize(1).ofMaxSize(FIELD_NAMES.size()).map(children -> {
      final var named = new LinkedHashMap<String, Shape>();
      for (int i = 0; i < children.size(); i++) {
        named.put(FIELD_NAMES.get(i), children.get(i));
      }
      return new Fields(named);
    });
  }

  @Provide
  Arbitrary<Shape> roots() {
    return fields(2);
  }

  private static void render(Shape shape, String path, DocumentBuilder builder) {
    if (shape instanceof Primitive primitive) {
      builder.set(path, Value.text(primitive.type()));
    } else if (shape instanceof Fields fields) {
      fields.fields().forEach((name, child) -> render(child, path.isEmpty() ? name : path + "." + name, builder));
    } else {
      render(((ListOf) shape).item(), path + ".$array", builder);
    }
  }

  private static Document source(Shape root) {
    final var builder = Document.builder();
    render(root, "", builder);
    return builder.build();
  }

  private static Value conforming(Shape shape) {
    if (shape instanceof Primitive primitive) {
      return switch (primitive.type()) {
        case ".text" -> Value.text("value");
        case ".integer" -> Value.integer(7);
        case ".float" -> Value.floating(2.5);
        default -> Value.bool(true);
      };
    }
    if (shape instanceof Fields fields) {
      final var entries = new LinkedHashMap<ObjectKey, Value>();
      fields.fields().forEach((name, child) -> entries.put(ObjectKey.ident(name), conforming(child)));
      return new Value.MapValue(entries);
    }
    final var item = conforming(((ListOf) shape).item());
    return new Value.ArrayValue(List.of(item, item));
  }

  /// Extracting the same source twice yields structurally equal schemas
  @Property(tries = 200)
  void extractionIsRepeatable(@ForAll("roots") Shape root) {
    final var first = SchemaExtractor.extract(source(root));
    final var second = SchemaExtractor.extract(source(root));
    assertThat(first.schema().structurallyEquals(second.schema())).isTrue();
    assertThat(first.pureSchema()).isTrue();
  }

  @Property(tries = 200)
  void conformingInstanceIsValid(@ForAll("roots") Shape root) {
    final var validator = SchemaValidator.of(extract(source(root)));
    final var result = validator.validate(Document.fromValue(conforming(root)));
    LOG.finer(() -> "Generated " + root + " gave " + result.errors());
    assertThat(result.errors()).isEmpty();
  }

  /// Pure schemas deny what they do not declare
  @Property(tries = 100)
  void extraFieldIsTheOnlyError(@ForAll("roots") Shape root) {
    final var validator = SchemaValidator.of(extract(source(root)));
    final var entries = new LinkedHashMap<>(((Value.MapValue) conforming(root)).entries());
    entries.put(ObjectKey.ident("unexpected"), Value.nul());
    final var result = validator.validate(Document.fromValue(new Value.MapValue(entries)));
    assertThat(result.errors()).extracting(ValidationError::kind).containsExactly(ErrorKind.UNKNOWN_FIELD);
  }
}
