package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.memo.ontology.exception.ValidationException;

/** Kinds of audit entries written to the provenance log. */
public enum ProvenanceAction {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete"),
  MERGE("merge"),
  SPLIT("split"),
  APPROVE("approve"),
  DEPRECATE("deprecate"),
  EXTRACT_GRAPH("extract_graph"),
  SUMMARIZE("summarize"),
  LINK_SUGGEST("link_suggest");

  private final String wireName;

  ProvenanceAction(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static ProvenanceAction fromWire(String value) {
    for (ProvenanceAction a : values()) {
      if (a.wireName.equals(value)) return a;
    }
    throw new ValidationException("Unknown provenance action '" + value + "'");
  }
}
