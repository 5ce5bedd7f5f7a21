package eure.schema;

import eure.document.EurePath;
import eure.document.NodeId;

/// Work item of the validation stack.
///
/// `exemptField` names a map key the record check must skip (the Internal union tag).
/// `optional` is set when the node fills an optional record field.
record Frame(NodeId node, SchemaNodeId schema, EurePath path, String exemptField, boolean optional, int depth) {

  Frame(NodeId node, SchemaNodeId schema, EurePath path, int depth) {
    this(node, schema, path, null, false, depth);
  }

  Frame child(NodeId childNode, SchemaNodeId childSchema, EurePath childPath) {
    return new Frame(childNode, childSchema, childPath, null, false, depth + 1);
  }

  @Override
  public String toString() {
    return "Frame[node=" + node + ", schema=" + schema + ", path=" + path + ", depth=" + depth
        + (exemptField == null ? "" : ", exempt=" + exemptField) + (optional ? ", optional" : "") + "]";
  }
}
