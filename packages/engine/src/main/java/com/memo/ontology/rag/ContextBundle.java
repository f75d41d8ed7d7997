package com.memo.ontology.rag;

import com.memo.ontology.retrieval.NeighborContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders retrieved sources into the numbered text blocks the answer cites as {@code [Source N]}.
 */
public final class ContextBundle {
  static final String SEPARATOR = "\n\n---\n\n";

  private ContextBundle() {}

  public static String render(List<RagSource> sources) {
    List<String> blocks = new ArrayList<>();
    for (int i = 0; i < sources.size(); i++) {
      blocks.add(block(i + 1, sources.get(i)));
    }
    return String.join(SEPARATOR, blocks);
  }

  static String block(int number, RagSource source) {
    StringBuilder sb = new StringBuilder();
    sb.append("[Source ")
        .append(number)
        .append(": \"")
        .append(source.node().title())
        .append("\" (")
        .append(source.node().type().wireName())
        .append(", similarity: ")
        .append(Math.round(source.similarity() * 100))
        .append("%)]\n")
        .append(source.node().content())
        .append('\n');
    if (source.context().isEmpty()) {
      sb.append("(No connections)");
    } else {
      sb.append("Connected notes:");
      for (NeighborContext c : source.context()) {
        sb.append("\n  - [")
            .append(c.edgeType().wireName())
            .append("] ")
            .append(c.node().title())
            .append(" (")
            .append(c.direction().wireName())
            .append(')');
      }
    }
    return sb.toString();
  }
}
