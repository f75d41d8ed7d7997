package com.memo.ontology.store;

import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.Node;

/**
 * One supports/refutes relationship around a claim.
 *
 * @param counterpart the node at the other end of the edge
 * @param outgoing true when the claim is the edge source
 */
public record ArgumentLink(Edge edge, Node counterpart, boolean outgoing) {

  public boolean supporting() {
    return edge.type() == EdgeType.SUPPORTS;
  }
}
