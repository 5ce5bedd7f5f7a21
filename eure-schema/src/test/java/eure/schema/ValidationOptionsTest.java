package eure.schema;

import eure.document.Document;
import eure.document.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationOptionsTest extends SchemaTestBase {

  @AfterEach
  void clearOverrides() {
    System.clearProperty(ValidationOptions.UNION_TAG_MODE_PROPERTY);
    System.clearProperty(ValidationOptions.MAX_DEPTH_PROPERTY);
  }

  @Test
  void defaults() {
    assertThat(ValidationOptions.DEFAULT.unionTagMode()).isEqualTo(UnionTagMode.EXPLICIT);
    assertThat(ValidationOptions.DEFAULT.maxDepth()).isEqualTo(1024);
    assertThat(ValidationOptions.DEFAULT.summary()).isEqualTo("unionTagMode=EXPLICIT, maxDepth=1024");
  }

  @Test
  void copiesLeaveTheOriginalUntouched() {
    final var lenient = ValidationOptions.DEFAULT.withUnionTagMode(UnionTagMode.LENIENT).withMaxDepth(16);
    assertThat(lenient).isEqualTo(new ValidationOptions(UnionTagMode.LENIENT, 16));
    assertThat(ValidationOptions.DEFAULT.unionTagMode()).isEqualTo(UnionTagMode.EXPLICIT);
  }

  @Test
  void depthMustBePositive() {
    assertThatThrownBy(() -> ValidationOptions.DEFAULT.withMaxDepth(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  /// System properties win over the options passed in, and are read when the validator is created
  @Test
  void systemPropertiesOverride() {
    System.setProperty(ValidationOptions.UNION_TAG_MODE_PROPERTY, "lenient");
    System.setProperty(ValidationOptions.MAX_DEPTH_PROPERTY, " 8 ");
    final var validator = SchemaValidator.of(SchemaDocument.builder().build());
    assertThat(validator.options()).isEqualTo(new ValidationOptions(UnionTagMode.LENIENT, 8));

    System.clearProperty(ValidationOptions.UNION_TAG_MODE_PROPERTY);
    assertThat(validator.options().unionTagMode()).isEqualTo(UnionTagMode.LENIENT);
  }

  /// Lenient mode from a property changes how unions are resolved
  @Test
  void overriddenModeAppliesToValidation() {
    final var schema = extract(Document.builder()
        .set("$variants.A.x", Value.text(".integer"))
        .set("$variants.B.y", Value.text(".text"))
        .build());
    final var instance = Document.builder().set("x", Value.integer(1)).build();
    assertThat(SchemaValidator.of(schema).validate(instance).isValid()).isFalse();

    System.setProperty(ValidationOptions.UNION_TAG_MODE_PROPERTY, "LENIENT");
    assertThat(SchemaValidator.of(schema).validate(instance).isValid()).isTrue();
  }

  @Test
  void badOverridesAreRejected() {
    System.setProperty(ValidationOptions.UNION_TAG_MODE_PROPERTY, "sometimes");
    assertThatThrownBy(() -> SchemaValidator.of(SchemaDocument.builder().build()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(ValidationOptions.UNION_TAG_MODE_PROPERTY);

    System.clearProperty(ValidationOptions.UNION_TAG_MODE_PROPERTY);
    System.setProperty(ValidationOptions.MAX_DEPTH_PROPERTY, "deep");
    assertThatThrownBy(() -> SchemaValidator.of(SchemaDocument.builder().build()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(ValidationOptions.MAX_DEPTH_PROPERTY);
  }
}
