package com.memo.ontology.governance;

import java.util.List;

/** Toulmin-style summary of one node: the key claim, its grounds and a qualifier. */
public record NodeSummary(
    String nodeId,
    String summary,
    String claim,
    List<String> grounds,
    Double qualifier,
    String model,
    String logId) {

  public NodeSummary {
    grounds = List.copyOf(grounds);
  }
}
