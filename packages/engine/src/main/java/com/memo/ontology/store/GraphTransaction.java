package com.memo.ontology.store;

import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.ProvenanceLogEntry;
import java.util.List;
import java.util.Optional;

/**
 * Primitive owner-scoped operations available inside a {@link GraphStore} unit of work. Lookups
 * of another owner's rows behave as if the row did not exist.
 */
public interface GraphTransaction {

  Optional<Node> findNode(String ownerId, String nodeId);

  /** All nodes of the owner, in no particular order. */
  List<Node> nodes(String ownerId);

  void putNode(Node node);

  void removeNode(String ownerId, String nodeId);

  Optional<Edge> findEdge(String ownerId, String edgeId);

  Optional<Edge> findEdge(String ownerId, String sourceId, String targetId, EdgeType type);

  /** Edges where the node is either endpoint, any status. */
  List<Edge> edgesTouching(String ownerId, String nodeId);

  void putEdge(Edge edge);

  void removeEdge(String ownerId, String edgeId);

  void appendLog(ProvenanceLogEntry entry);

  /** Log entries of the owner in append order. */
  List<ProvenanceLogEntry> logEntries(String ownerId);

  /** Nulls {@code target_node_id} on every entry referencing the node. */
  void clearNodeReferences(String ownerId, String nodeId);

  /** Nulls {@code target_edge_id} on every entry referencing the edge. */
  void clearEdgeReferences(String ownerId, String edgeId);
}
