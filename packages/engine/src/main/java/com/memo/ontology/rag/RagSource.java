package com.memo.ontology.rag;

import com.memo.ontology.graph.Node;
import com.memo.ontology.retrieval.NeighborContext;
import java.util.List;

/** A retrieved node with its similarity and one-hop graph context. */
public record RagSource(Node node, double similarity, List<NeighborContext> context) {
  public RagSource {
    context = List.copyOf(context);
  }
}
