package eure.schema;

import eure.document.Document;
import eure.document.EurePath;
import eure.document.NodeValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import static eure.schema.SchemaLogging.LOG;

/// Second validation pass: every Hole that fills a required position is a `MISSING_FIELD`.
///
/// Follows the same schema/document pairing as the structural pass but reports nothing
/// else; shape mismatches were already reported there and simply stop the descent here.
final class CompletenessChecker {

  private final SchemaDocument schema;
  private final Document doc;
  private final ValidationOptions options;
  private final VariantSelector selector;

  CompletenessChecker(SchemaDocument schema, Document doc, ValidationOptions options) {
    this.schema = schema;
    this.doc = doc;
    this.options = options;
    this.selector = new VariantSelector(schema, doc, options.unionTagMode());
  }

  ValidationResult check(SchemaNodeId start) {
    final var errors = new ArrayList<ValidationError>();
    final var stack = new ArrayDeque<Frame>();
    stack.push(new Frame(doc.root(), start, EurePath.root(), 0));
    while (!stack.isEmpty()) {
      final var frame = stack.pop();
      if (frame.depth() > options.maxDepth()) {
        continue;
      }
      final var node = doc.node(frame.node());
      if (node.content() instanceof NodeValue.Hole hole) {
        if (!frame.optional()) {
          final var label = hole.label() == null ? "" : " (hole " + hole.label() + ")";
          errors.add(new ValidationError(ErrorKind.MISSING_FIELD, frame.path(),
              ErrorKind.MISSING_FIELD.message(describe(frame.path())) + label));
        }
        continue;
      }
      final var resolved = References.resolve(schema, frame.schema());
      if (resolved.dangling()) {
        continue;
      }
      final var children = new ArrayList<Frame>();
      descend(frame, schema.node(resolved.id()).content(), children);
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    StructuredLog.fine(LOG, "completeness.done", "missing", errors.size());
    return errors.isEmpty() ? ValidationResult.success() : new ValidationResult(errors, List.of());
  }

  private void descend(Frame frame, SchemaNodeContent content, List<Frame> children) {
    final var value = doc.node(frame.node()).content();
    if (content instanceof SchemaNodeContent.RecordSchema rec && value instanceof NodeValue.NodeMap map) {
      for (final var field : rec.fields().entrySet()) {
        VariantSelector.entryNamed(map, field.getKey()).ifPresent(entry -> children.add(new Frame(
            entry.getValue(), field.getValue().schema(), frame.path().appendKey(entry.getKey()),
            null, field.getValue().optional(), frame.depth() + 1)));
      }
    } else if (content instanceof SchemaNodeContent.ArraySchema array && value instanceof NodeValue.NodeArray items) {
      for (int i = 0; i < items.items().size(); i++) {
        children.add(frame.child(items.items().get(i), array.item(), frame.path().appendArrayIndex(i)));
      }
    } else if (content instanceof SchemaNodeContent.MapSchema mapSchema && value instanceof NodeValue.NodeMap map) {
      map.entries().forEach((key, child) ->
          children.add(frame.child(child, mapSchema.value(), frame.path().appendKey(key))));
    } else if (content instanceof SchemaNodeContent.TupleSchema tuple && value instanceof NodeValue.NodeTuple items) {
      for (int i = 0; i < Math.min(tuple.elements().size(), items.items().size()); i++) {
        children.add(frame.child(items.items().get(i), tuple.elements().get(i), frame.path().appendTupleIndex(i)));
      }
    } else if (content instanceof SchemaNodeContent.UnionSchema union) {
      if (selector.select(frame.node(), frame.path(), union) instanceof VariantSelector.Selection.Selected selected) {
        children.add(new Frame(selected.target(), selected.schema(), selected.targetPath(),
            selected.exemptField(), frame.optional(), frame.depth() + 1));
      }
    }
  }

  private static String describe(EurePath path) {
    return path.lastSegment().map(segment -> EurePath.of(segment).toString()).orElse(path.toString());
  }
}
