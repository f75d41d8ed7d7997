package com.memo.ontology.graph;

/**
 * Filter for listing an owner's nodes; null fields do not filter. The review inbox is {@code
 * NodeQuery.inbox()}.
 */
public record NodeQuery(
    GovernanceStatus status, NodeType type, String folderId, String tag, int limit) {

  public static NodeQuery all() {
    return new NodeQuery(null, null, null, null, 0);
  }

  public static NodeQuery inbox() {
    return new NodeQuery(GovernanceStatus.EXPERIMENTAL, null, null, null, 0);
  }

  public boolean matches(Node node) {
    return (status == null || node.status() == status)
        && (type == null || node.type() == type)
        && (folderId == null || folderId.equals(node.folderId()))
        && (tag == null || node.tags().contains(tag));
  }
}
