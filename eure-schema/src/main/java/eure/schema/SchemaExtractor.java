package eure.schema;

import eure.document.Document;
import eure.document.EurePath;
import eure.document.Node;
import eure.document.NodeId;
import eure.document.NodeValue;
import eure.document.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static eure.schema.Annotations.*;
import static eure.schema.SchemaLogging.LOG;

/// Synthesizes a [SchemaDocument] from the extension annotations of a document.
///
/// Three kinds of declaration are recognised:
/// - inline overlays on data fields, e.g. `age.$type = .integer` next to `age = 42`
/// - named types under `$types.<Name>`, registered in [SchemaDocument#types()]
/// - variant schemas under `$variants.<name>` of a union declaration
///
/// Unannotated example data gets no schema node. A record that mixes such data with
/// declarations allows unknown fields unless `$unknown-fields` says otherwise.
/// Extraction is a pure function of the document; repeated calls give structurally
/// equal results.
public final class SchemaExtractor {

  /// Where a node sits, which decides how bare values are read
  private enum Mode {
    /// document root; declares nothing unless it has fields
    ROOT,
    /// ordinary field; text is a type only when dotted, anything else is data
    FIELD,
    /// operand of an annotation such as `$type` or `$variants.x`; must declare a type
    OPERAND
  }

  private record PendingReference(String name, EurePath path) {}

  private final Document doc;
  private final SchemaDocument.Builder builder = SchemaDocument.builder();
  private final List<PendingReference> references = new ArrayList<>();
  private SchemaNodeId anyNode;

  private SchemaExtractor(Document doc) {
    this.doc = doc;
  }

  /// Extracts the schema declared by `document`
  /// @throws SchemaException on conflicting annotations, duplicate names, malformed
  ///         constraints, dangling type references or empty variants
  public static ExtractedSchema extract(Document document) {
    Objects.requireNonNull(document, "document must not be null");
    LOG.fine(() -> "SchemaExtractor extracting from " + document);
    return new SchemaExtractor(document).run();
  }

  /// True when every plain leaf outside extension annotations is a type expression,
  /// i.e. the document declares types and carries no example data
  public static boolean isPureSchema(Document document) {
    final var stack = new ArrayDeque<NodeId>();
    stack.push(document.root());
    while (!stack.isEmpty()) {
      final var content = document.node(stack.pop()).content();
      if (content instanceof NodeValue.Primitive p) {
        if (!(p.value() instanceof Value.TextValue t && t.isPlaintext() && TypeExpression.isTypeExpression(t.content()))) {
          return false;
        }
      } else if (content instanceof NodeValue.NodeMap map) {
        map.entries().values().forEach(stack::push);
      } else if (content instanceof NodeValue.NodeArray array) {
        array.items().forEach(stack::push);
      } else if (content instanceof NodeValue.NodeTuple tuple) {
        tuple.items().forEach(stack::push);
      }
    }
    return true;
  }

  private ExtractedSchema run() {
    final var rootNode = doc.rootNode();
    final var naming = namingOptions(rootNode);
    extractTypes(rootNode);

    final var declared = extractNode(doc.root(), EurePath.root(), Mode.ROOT);
    builder.root(declared != null ? declared : builder.add(new SchemaNodeContent.AnySchema()));
    builder.naming(naming);

    for (final var reference : references) {
      if (!builder.hasType(reference.name())) {
        throw new SchemaException(SchemaException.Kind.DANGLING_TYPE_REFERENCE, reference.path(), reference.name());
      }
    }

    final var schema = builder.build();
    final boolean pure = isPureSchema(doc);
    final var schemaRef = rootNode.extension(SCHEMA)
        .map(id -> plainText(id, EurePath.root().appendExtension(SCHEMA)))
        .orElse(null);
    StructuredLog.fine(LOG, "extract.done",
        "nodes", schema.size(), "types", schema.types().size(), "pure", pure, "schemaRef", schemaRef);
    return new ExtractedSchema(schema, pure, schemaRef);
  }

  private NamingOptions namingOptions(Node rootNode) {
    final var global = rootNode.extension(RENAME_ALL)
        .map(id -> renameRule(id, EurePath.root().appendExtension(RENAME_ALL)))
        .orElse(null);
    final var perType = new LinkedHashMap<String, RenameRule>();
    rootNode.extension(TYPES).ifPresent(typesId -> {
      if (doc.node(typesId).content() instanceof NodeValue.NodeMap map) {
        map.entries().forEach((key, typeId) -> key.fieldName().ifPresent(name ->
            doc.node(typeId).extension(RENAME_ALL).ifPresent(ruleId -> perType.put(name,
                renameRule(ruleId, EurePath.root().appendExtension(TYPES).appendKey(key).appendExtension(RENAME_ALL))))));
      }
    });
    return new NamingOptions(global, perType);
  }

  private RenameRule renameRule(NodeId id, EurePath path) {
    final var spelling = plainText(id, path);
    return RenameRule.fromSpelling(spelling)
        .orElseThrow(() -> new SchemaException(SchemaException.Kind.INVALID_RENAME_RULE, path, spelling));
  }

  private void extractTypes(Node rootNode) {
    final var typesId = rootNode.extension(TYPES);
    if (typesId.isEmpty()) {
      return;
    }
    final var typesPath = EurePath.root().appendExtension(TYPES);
    final var content = doc.node(typesId.get()).content();
    if (content instanceof NodeValue.Hole) {
      return;
    }
    if (!(content instanceof NodeValue.NodeMap map)) {
      throw new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, typesPath,
          "$types must be a map of named types, got " + content.kindName());
    }
    for (final var entry : map.entries().entrySet()) {
      final var typePath = typesPath.appendKey(entry.getKey());
      final var name = entry.getKey().fieldName()
          .orElseThrow(() -> new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, typePath,
              "type name must be an identifier or text"));
      if (builder.hasType(name)) {
        throw new SchemaException(SchemaException.Kind.DUPLICATE_FIELD, typePath, name);
      }
      final var id = requireOperand(entry.getValue(), typePath);
      builder.type(name, id);
      LOG.finer(() -> "Registered type " + name + " as " + id);
    }
  }

  /// Adds the schema declared at `id`, or returns null when the node is plain data
  private SchemaNodeId extractNode(NodeId id, EurePath path, Mode mode) {
    final var node = doc.node(id);
    var content = declaredContent(id, node, path, mode);
    if (content == null) {
      if (Constraints.present(node)) {
        final var first = CONSTRAINTS.stream().filter(node.extensions()::containsKey).findFirst().orElseThrow();
        throw new SchemaException(SchemaException.Kind.MALFORMED_CONSTRAINT, path.appendExtension(first),
            "$" + first, "constraint on a node that declares no type");
      }
      return null;
    }
    content = Constraints.apply(doc, id, path, content);
    final var schemaId = builder.add(new SchemaNode(content, metadata(node, path)));
    StructuredLog.finestSampled(LOG, "extract.node", 1, "path", path, "kind", content.kindName(), "id", schemaId);
    return schemaId;
  }

  private SchemaNodeContent declaredContent(NodeId id, Node node, EurePath path, Mode mode) {
    final var annotations = TYPE_BEARING.stream().filter(node.extensions()::containsKey).toList();
    if (annotations.size() > 1) {
      throw new SchemaException(SchemaException.Kind.CONFLICTING_TYPE_ANNOTATIONS, path,
          "$" + annotations.get(0) + " and $" + annotations.get(1));
    }
    if (node.extensions().containsKey(VARIANT_REPR) && !annotations.contains(VARIANTS)) {
      throw new SchemaException(SchemaException.Kind.INVALID_VARIANT_REPR, path.appendExtension(VARIANT_REPR),
          "$variant-repr requires $variants on the same node");
    }
    final var valueType = mode == Mode.OPERAND ? Optional.<String>empty() : dottedTypeText(node);
    if (!annotations.isEmpty()) {
      if (valueType.isPresent()) {
        throw new SchemaException(SchemaException.Kind.CONFLICTING_TYPE_ANNOTATIONS, path,
            "$" + annotations.get(0) + " and type expression " + valueType.get());
      }
      return fromAnnotation(annotations.get(0), node, path);
    }
    return structural(id, node, path, mode);
  }

  private Optional<String> dottedTypeText(Node node) {
    if (node.content() instanceof NodeValue.Primitive p
        && p.value() instanceof Value.TextValue t
        && t.isPlaintext()
        && TypeExpression.isTypeExpression(t.content())) {
      return Optional.of(t.content());
    }
    return Optional.empty();
  }

  private SchemaNodeContent fromAnnotation(String annotation, Node node, EurePath path) {
    final var operandId = node.extension(annotation).orElseThrow();
    final var operandPath = path.appendExtension(annotation);
    switch (annotation) {
      case TYPE -> {
        return operand(operandId, operandPath);
      }
      case ARRAY -> {
        return new SchemaNodeContent.ArraySchema(requireOperand(operandId, operandPath), null, null, false);
      }
      case MAP -> {
        return mapDeclaration(operandId, operandPath);
      }
      case LITERAL -> {
        return new SchemaNodeContent.LiteralSchema(doc.toContentValue(operandId));
      }
      default -> {
        return union(operandId, operandPath, node, path);
      }
    }
  }

  /// Content of a type operand, without a schema node of its own
  private SchemaNodeContent operand(NodeId id, EurePath path) {
    final var content = declaredContent(id, doc.node(id), path, Mode.OPERAND);
    if (content == null) {
      throw new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, path,
          describe(doc.node(id).content()));
    }
    return content;
  }

  private SchemaNodeId requireOperand(NodeId id, EurePath path) {
    final var schemaId = extractNode(id, path, Mode.OPERAND);
    if (schemaId == null) {
      throw new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, path,
          describe(doc.node(id).content()));
    }
    return schemaId;
  }

  private SchemaNodeContent structural(NodeId id, Node node, EurePath path, Mode mode) {
    final var content = node.content();
    if (content instanceof NodeValue.Primitive p) {
      if (p.value() instanceof Value.TextValue t && t.isPlaintext()) {
        final var parsed = TypeExpression.parse(t.content(), mode == Mode.OPERAND, this::anyNode);
        parsed.filter(c -> c instanceof SchemaNodeContent.ReferenceSchema)
            .ifPresent(ref -> references.add(new PendingReference(((SchemaNodeContent.ReferenceSchema) ref).name(), path)));
        return parsed.orElse(null);
      }
      return null;
    }
    if (content instanceof NodeValue.NodeMap map) {
      return record(map, node, path, mode);
    }
    final var childMode = mode == Mode.ROOT ? Mode.FIELD : mode;
    if (content instanceof NodeValue.NodeArray array) {
      if (array.items().size() != 1) {
        return null;
      }
      final var item = extractNode(array.items().get(0), path.appendArrayIndex(0), childMode);
      return item == null ? null : new SchemaNodeContent.ArraySchema(item, null, null, false);
    }
    if (content instanceof NodeValue.NodeTuple tuple) {
      final var elements = new ArrayList<SchemaNodeId>(tuple.items().size());
      for (int i = 0; i < tuple.items().size(); i++) {
        final var element = extractNode(tuple.items().get(i), path.appendTupleIndex(i), childMode);
        if (element == null) {
          return null;
        }
        elements.add(element);
      }
      return new SchemaNodeContent.TupleSchema(elements);
    }
    return null;
  }

  private SchemaNodeContent record(NodeValue.NodeMap map, Node node, EurePath path, Mode mode) {
    final var fields = new LinkedHashMap<String, SchemaNodeContent.RecordField>();
    final var seen = new HashSet<String>();
    boolean mixedWithData = false;
    for (final var entry : map.entries().entrySet()) {
      final var fieldPath = path.appendKey(entry.getKey());
      final var name = entry.getKey().fieldName();
      if (name.isEmpty()) {
        mixedWithData = true;
        continue;
      }
      if (!seen.add(name.get())) {
        throw new SchemaException(SchemaException.Kind.DUPLICATE_FIELD, fieldPath, name.get());
      }
      final var fieldSchema = extractNode(entry.getValue(), fieldPath, Mode.FIELD);
      if (fieldSchema == null) {
        mixedWithData = true;
        continue;
      }
      final boolean optional = doc.node(entry.getValue()).extension(OPTIONAL)
          .map(id -> bool(id, fieldPath.appendExtension(OPTIONAL)))
          .orElse(false);
      fields.put(name.get(), new SchemaNodeContent.RecordField(fieldSchema, optional));
    }
    if (fields.isEmpty() && mode != Mode.OPERAND) {
      return null;
    }
    final var policy = node.extension(UNKNOWN_FIELDS)
        .map(id -> unknownFieldsPolicy(id, path.appendExtension(UNKNOWN_FIELDS)))
        .orElse(mixedWithData ? UnknownFieldsPolicy.ALLOW : UnknownFieldsPolicy.DENY);
    return new SchemaNodeContent.RecordSchema(fields, policy);
  }

  private SchemaNodeContent mapDeclaration(NodeId id, EurePath path) {
    if (!(doc.node(id).content() instanceof NodeValue.NodeMap map)) {
      throw new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, path,
          "$map expects { key, value }");
    }
    SchemaNodeId key = null;
    SchemaNodeId value = null;
    for (final var entry : map.entries().entrySet()) {
      final var entryPath = path.appendKey(entry.getKey());
      final var name = entry.getKey().fieldName().orElse("");
      if (name.equals("key")) {
        key = requireOperand(entry.getValue(), entryPath);
      } else if (name.equals("value")) {
        value = requireOperand(entry.getValue(), entryPath);
      } else {
        throw new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, entryPath,
            "$map accepts only key and value");
      }
    }
    if (value == null) {
      throw new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, path, "$map requires a value type");
    }
    if (key == null) {
      key = builder.add(SchemaNodeContent.TextSchema.ANY_TEXT);
    }
    return new SchemaNodeContent.MapSchema(key, value, null, null);
  }

  private SchemaNodeContent union(NodeId variantsId, EurePath variantsPath, Node node, EurePath path) {
    if (!(doc.node(variantsId).content() instanceof NodeValue.NodeMap map)) {
      throw new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, variantsPath,
          "$variants must be a map of variant declarations");
    }
    if (map.entries().isEmpty()) {
      throw new SchemaException(SchemaException.Kind.EMPTY_VARIANT, variantsPath, "union declares no variants");
    }
    final var repr = node.extension(VARIANT_REPR)
        .map(id -> variantRepr(id, path.appendExtension(VARIANT_REPR)))
        .orElse(VariantRepr.tagged());
    final var variants = new LinkedHashMap<String, SchemaNodeId>();
    for (final var entry : map.entries().entrySet()) {
      final var variantPath = variantsPath.appendKey(entry.getKey());
      final var name = entry.getKey().fieldName()
          .orElseThrow(() -> new SchemaException(SchemaException.Kind.INVALID_TYPE_EXPRESSION, variantPath,
              "variant name must be an identifier or text"));
      if (variants.containsKey(name)) {
        throw new SchemaException(SchemaException.Kind.DUPLICATE_FIELD, variantPath, name);
      }
      final var variantId = requireOperand(entry.getValue(), variantPath);
      if (repr instanceof VariantRepr.Adjacent
          && builder.peek(variantId).content() instanceof SchemaNodeContent.RecordSchema r
          && r.fields().isEmpty()) {
        throw new SchemaException(SchemaException.Kind.EMPTY_VARIANT, variantPath,
            "variant '" + name + "' has no fields but the adjacent representation requires content");
      }
      variants.put(name, variantId);
    }
    return new SchemaNodeContent.UnionSchema(variants, repr);
  }

  private VariantRepr variantRepr(NodeId id, EurePath path) {
    final var content = doc.node(id).content();
    if (content instanceof NodeValue.Primitive p && p.value() instanceof Value.TextValue t) {
      return switch (t.content()) {
        case "external" -> VariantRepr.external();
        case "tagged" -> VariantRepr.tagged();
        default -> throw new SchemaException(SchemaException.Kind.INVALID_VARIANT_REPR, path,
            "'" + t.content() + "' (expected \"external\", \"tagged\", { tag } or { tag, content })");
      };
    }
    if (content instanceof NodeValue.NodeMap map) {
      String tag = null;
      String contentField = null;
      for (final var entry : map.entries().entrySet()) {
        final var entryPath = path.appendKey(entry.getKey());
        final var name = entry.getKey().fieldName().orElse("");
        if (name.equals("tag")) {
          tag = plainText(entry.getValue(), entryPath);
        } else if (name.equals("content")) {
          contentField = plainText(entry.getValue(), entryPath);
        } else {
          throw new SchemaException(SchemaException.Kind.INVALID_VARIANT_REPR, entryPath,
              "unexpected key, only tag and content are allowed");
        }
      }
      if (tag == null) {
        throw new SchemaException(SchemaException.Kind.INVALID_VARIANT_REPR, path, "missing tag");
      }
      if (contentField == null) {
        return new VariantRepr.Internal(tag);
      }
      if (tag.equals(contentField)) {
        throw new SchemaException(SchemaException.Kind.INVALID_VARIANT_REPR, path,
            "tag and content must name different fields");
      }
      return new VariantRepr.Adjacent(tag, contentField);
    }
    throw new SchemaException(SchemaException.Kind.INVALID_VARIANT_REPR, path, content.kindName());
  }

  private UnknownFieldsPolicy unknownFieldsPolicy(NodeId id, EurePath path) {
    final var text = plainText(id, path);
    return switch (text) {
      case "deny" -> UnknownFieldsPolicy.DENY;
      case "allow" -> UnknownFieldsPolicy.ALLOW;
      default -> throw new SchemaException(SchemaException.Kind.MALFORMED_CONSTRAINT, path,
          "$" + UNKNOWN_FIELDS, "expected \"deny\" or \"allow\", got \"" + text + "\"");
    };
  }

  private SchemaMetadata metadata(Node node, EurePath path) {
    if (node.extensions().isEmpty()) {
      return SchemaMetadata.EMPTY;
    }
    final var description = node.extension(DESCRIPTION)
        .map(id -> plainText(id, path.appendExtension(DESCRIPTION)))
        .orElse(null);
    final boolean deprecated = node.extension(DEPRECATED)
        .map(id -> bool(id, path.appendExtension(DEPRECATED)))
        .orElse(false);
    final var defaultValue = node.extension(DEFAULT).map(doc::toContentValue).orElse(null);
    final var examples = new ArrayList<Value>();
    node.extension(EXAMPLES).ifPresent(id -> {
      if (!(doc.node(id).content() instanceof NodeValue.NodeArray array)) {
        throw new SchemaException(SchemaException.Kind.MALFORMED_CONSTRAINT, path.appendExtension(EXAMPLES),
            "$" + EXAMPLES, "expected an array of examples");
      }
      array.items().forEach(item -> examples.add(doc.toContentValue(item)));
    });
    final var preserved = new LinkedHashMap<String, Value>();
    for (final Map.Entry<String, NodeId> ext : node.extensions().entrySet()) {
      if (!isReserved(ext.getKey()) || ext.getKey().equals(RENAME)) {
        preserved.put(ext.getKey(), doc.toValue(ext.getValue()));
      }
    }
    return new SchemaMetadata(description, deprecated, defaultValue, examples, preserved);
  }

  private SchemaNodeId anyNode() {
    if (anyNode == null) {
      anyNode = builder.add(new SchemaNodeContent.AnySchema());
    }
    return anyNode;
  }

  private String plainText(NodeId id, EurePath path) {
    if (doc.node(id).content() instanceof NodeValue.Primitive p
        && p.value() instanceof Value.TextValue t
        && t.isPlaintext()) {
      return t.content();
    }
    throw new SchemaException(SchemaException.Kind.MALFORMED_CONSTRAINT, path,
        label(path), "expected plaintext");
  }

  private boolean bool(NodeId id, EurePath path) {
    if (doc.node(id).content() instanceof NodeValue.Primitive p && p.value() instanceof Value.BooleanValue b) {
      return b.value();
    }
    throw new SchemaException(SchemaException.Kind.MALFORMED_CONSTRAINT, path,
        label(path), "expected a boolean");
  }

  private static String label(EurePath path) {
    return path.lastSegment().map(segment -> EurePath.of(segment).toString()).orElse(path.toString());
  }

  private static String describe(NodeValue content) {
    if (content instanceof NodeValue.Primitive p && p.value() instanceof Value.TextValue t) {
      return "\"" + t.content() + "\"";
    }
    return content.kindName() + " does not declare a type";
  }
}
