package com.memo.ontology.rag;

import java.util.List;

/**
 * A cited answer.
 *
 * @param model provider:model that produced the answer
 * @param logId id of the {@code summarize} audit entry
 */
public record GraphRagAnswer(String answer, List<RagSource> sources, String model, String logId) {
  public GraphRagAnswer {
    sources = List.copyOf(sources);
  }
}
