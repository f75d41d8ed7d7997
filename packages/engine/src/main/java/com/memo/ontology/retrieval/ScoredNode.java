package com.memo.ontology.retrieval;

import com.memo.ontology.graph.Node;
import java.util.Comparator;

/** A search hit: the node and its similarity or rank in [0, 1]. */
public record ScoredNode(Node node, double score) {

  /** Score descending, ties broken by node id. */
  public static final Comparator<ScoredNode> RANKING =
      Comparator.comparingDouble(ScoredNode::score)
          .reversed()
          .thenComparing(s -> s.node().id());
}
