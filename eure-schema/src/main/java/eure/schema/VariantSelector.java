package eure.schema;

import eure.document.Document;
import eure.document.EurePath;
import eure.document.NodeId;
import eure.document.NodeValue;
import eure.document.ObjectKey;
import eure.document.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;

import static eure.schema.SchemaLogging.LOG;

/// Picks the variant of a union value.
///
/// The `$variant` extension and the representation's own tag are combined:
/// - both present and equal, or only the representation's tag: use the representation
/// - only `$variant`: the value itself is the variant content
/// - both present and different: `CONFLICTING_VARIANT_TAGS`
/// - neither: `MISSING_VARIANT_TAG`, or inference under [UnionTagMode#LENIENT]
final class VariantSelector {

  sealed interface Selection {
    /// `target` is validated against `schema` at `targetPath`; `exemptField` is the Internal tag
    record Selected(String name, SchemaNodeId schema, NodeId target, EurePath targetPath, String exemptField)
        implements Selection {}

    record Failed(ValidationError error) implements Selection {}
  }

  private final SchemaDocument schema;
  private final Document doc;
  private final UnionTagMode mode;

  VariantSelector(SchemaDocument schema, Document doc, UnionTagMode mode) {
    this.schema = schema;
    this.doc = doc;
    this.mode = mode;
  }

  Selection select(NodeId nodeId, EurePath path, SchemaNodeContent.UnionSchema union) {
    final var node = doc.node(nodeId);
    String explicit = null;
    final var variantExt = node.extension(Annotations.VARIANT);
    if (variantExt.isPresent()) {
      final var tagPath = path.appendExtension(Annotations.VARIANT);
      final var name = plaintext(variantExt.get());
      if (name.isEmpty()) {
        return failed(ErrorKind.INVALID_VARIANT_TAG, tagPath, doc.node(variantExt.get()).content().kindName());
      }
      explicit = name.get();
      if (!union.variants().containsKey(explicit)) {
        return failed(ErrorKind.UNKNOWN_VARIANT, tagPath, explicit, union.variants().keySet());
      }
    }

    final var repr = node.content() instanceof NodeValue.NodeMap map
        ? byRepresentation(nodeId, map, path, union, explicit != null)
        : null;
    if (repr instanceof Selection.Failed) {
      return repr;
    }
    if (repr instanceof Selection.Selected selected) {
      if (explicit != null && !explicit.equals(selected.name())) {
        return failed(ErrorKind.CONFLICTING_VARIANT_TAGS, path, explicit, selected.name());
      }
      LOG.finer(() -> "Variant " + selected.name() + " selected by " + union.repr() + " at " + path);
      return selected;
    }
    if (explicit != null) {
      final var chosen = explicit;
      LOG.finer(() -> "Variant " + chosen + " selected by $variant at " + path);
      return new Selection.Selected(explicit, union.variants().get(explicit), nodeId, path, null);
    }
    if (mode == UnionTagMode.LENIENT) {
      return infer(nodeId, path, union);
    }
    return failed(ErrorKind.MISSING_VARIANT_TAG, path, expectedTag(union.repr()));
  }

  /// Selection through the representation's own tag, null when the value carries none
  private Selection byRepresentation(NodeId nodeId, NodeValue.NodeMap map, EurePath path,
                                     SchemaNodeContent.UnionSchema union, boolean hasExplicit) {
    final var repr = union.repr();
    if (repr instanceof VariantRepr.External) {
      if (map.size() != 1) {
        return hasExplicit ? null : failed(ErrorKind.VARIANT_KEY_COUNT, path, map.size());
      }
      final var entry = map.entries().entrySet().iterator().next();
      final var keyPath = path.appendKey(entry.getKey());
      final var name = entry.getKey().fieldName();
      // with $variant present, a key that names no variant is plain content
      if (hasExplicit && (name.isEmpty() || !union.variants().containsKey(name.get()))) {
        return null;
      }
      if (name.isEmpty()) {
        return failed(ErrorKind.INVALID_VARIANT_TAG, keyPath, entry.getKey());
      }
      return named(union, name.get(), keyPath, entry.getValue(), keyPath, null);
    }
    if (repr instanceof VariantRepr.Internal internal) {
      final var tag = entryNamed(map, internal.tag());
      if (tag.isEmpty()) {
        return null;
      }
      final var tagPath = path.appendKey(tag.get().getKey());
      final var name = plaintext(tag.get().getValue());
      if (name.isEmpty()) {
        return failed(ErrorKind.INVALID_VARIANT_TAG, tagPath, doc.node(tag.get().getValue()).content().kindName());
      }
      return named(union, name.get(), tagPath, nodeId, path, internal.tag());
    }
    if (repr instanceof VariantRepr.Adjacent adjacent) {
      final var tag = entryNamed(map, adjacent.tag());
      if (tag.isEmpty()) {
        return null;
      }
      final var tagPath = path.appendKey(tag.get().getKey());
      final var name = plaintext(tag.get().getValue());
      if (name.isEmpty()) {
        return failed(ErrorKind.INVALID_VARIANT_TAG, tagPath, doc.node(tag.get().getValue()).content().kindName());
      }
      final var body = entryNamed(map, adjacent.content());
      if (body.isEmpty()) {
        return failed(ErrorKind.MISSING_FIELD, path, adjacent.content());
      }
      return named(union, name.get(), tagPath, body.get().getValue(), path.appendKey(body.get().getKey()), null);
    }
    return null;
  }

  private static Selection named(SchemaNodeContent.UnionSchema union, String name, EurePath tagPath,
                                 NodeId target, EurePath targetPath, String exemptField) {
    final var variant = union.variants().get(name);
    if (variant == null) {
      return failed(ErrorKind.UNKNOWN_VARIANT, tagPath, name, union.variants().keySet());
    }
    return new Selection.Selected(name, variant, target, targetPath, exemptField);
  }

  private Selection infer(NodeId nodeId, EurePath path, SchemaNodeContent.UnionSchema union) {
    final var node = doc.node(nodeId);
    final var candidates = new ArrayList<String>();
    for (final var variant : union.variants().entrySet()) {
      final var resolved = References.resolve(schema, variant.getValue());
      if (resolved.dangling()) {
        continue;
      }
      final var content = schema.node(resolved.id()).content();
      final boolean fits;
      if (content instanceof SchemaNodeContent.RecordSchema variantRecord && node.content() instanceof NodeValue.NodeMap map) {
        fits = presentFields(map).containsAll(variantRecord.requiredFields());
      } else {
        fits = accepts(content, nodeId);
      }
      if (fits) {
        candidates.add(variant.getKey());
      }
    }
    StructuredLog.finer(LOG, "union.infer", "path", path, "candidates", candidates);
    if (candidates.size() == 1) {
      final var name = candidates.get(0);
      return new Selection.Selected(name, union.variants().get(name), nodeId, path, null);
    }
    if (candidates.isEmpty()) {
      return failed(ErrorKind.NO_VARIANT_MATCHED, path, union.variants().keySet());
    }
    return failed(ErrorKind.AMBIGUOUS_VARIANT, path, candidates);
  }

  /// Shallow kind check: could a value of this node's kind satisfy `content`
  boolean accepts(SchemaNodeContent content, NodeId nodeId) {
    final var value = doc.node(nodeId).content();
    if (value instanceof NodeValue.Hole
        || content instanceof SchemaNodeContent.AnySchema
        || content instanceof SchemaNodeContent.UnionSchema) {
      return true;
    }
    if (content instanceof SchemaNodeContent.LiteralSchema literal) {
      return literal.value().equals(doc.toContentValue(nodeId));
    }
    if (content instanceof SchemaNodeContent.RecordSchema || content instanceof SchemaNodeContent.MapSchema) {
      return value instanceof NodeValue.NodeMap;
    }
    if (content instanceof SchemaNodeContent.ArraySchema) {
      return value instanceof NodeValue.NodeArray;
    }
    if (content instanceof SchemaNodeContent.TupleSchema) {
      return value instanceof NodeValue.NodeTuple;
    }
    if (!(value instanceof NodeValue.Primitive p)) {
      return false;
    }
    final var primitive = p.value();
    if (content instanceof SchemaNodeContent.TextSchema) return primitive instanceof Value.TextValue;
    if (content instanceof SchemaNodeContent.IntegerSchema) return primitive instanceof Value.IntegerValue;
    if (content instanceof SchemaNodeContent.FloatSchema) return primitive instanceof Value.FloatValue;
    if (content instanceof SchemaNodeContent.BooleanSchema) return primitive instanceof Value.BooleanValue;
    if (content instanceof SchemaNodeContent.NullSchema) return primitive instanceof Value.NullValue;
    return false;
  }

  private static HashSet<String> presentFields(NodeValue.NodeMap map) {
    final var names = new HashSet<String>();
    map.entries().keySet().forEach(key -> key.fieldName().ifPresent(names::add));
    return names;
  }

  static Optional<Map.Entry<ObjectKey, NodeId>> entryNamed(NodeValue.NodeMap map, String name) {
    return map.entries().entrySet().stream()
        .filter(e -> e.getKey().fieldName().filter(name::equals).isPresent())
        .findFirst();
  }

  private Optional<String> plaintext(NodeId id) {
    if (doc.node(id).content() instanceof NodeValue.Primitive p
        && p.value() instanceof Value.TextValue t
        && t.isPlaintext()) {
      return Optional.of(t.content());
    }
    return Optional.empty();
  }

  private static String expectedTag(VariantRepr repr) {
    if (repr instanceof VariantRepr.Internal internal) return "field '" + internal.tag() + "' or $variant";
    if (repr instanceof VariantRepr.Adjacent adjacent) return "field '" + adjacent.tag() + "' or $variant";
    if (repr instanceof VariantRepr.External) return "a single key naming the variant or $variant";
    return "$variant";
  }

  private static Selection.Failed failed(ErrorKind kind, EurePath path, Object... args) {
    return new Selection.Failed(ValidationError.of(kind, path, args));
  }
}
