package com.memo.ontology.retrieval;

import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.Node;

/**
 * One node reached by {@link RetrievalEngine#neighborContext}.
 *
 * @param edgeId the edge that first reached the node
 * @param depth hop count from the origin, starting at 1
 */
public record NeighborContext(
    Node node, String edgeId, EdgeType edgeType, double weight, Direction direction, int depth) {}
