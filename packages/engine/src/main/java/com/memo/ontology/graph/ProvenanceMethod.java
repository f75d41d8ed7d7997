package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.memo.ontology.exception.ValidationException;

/** How an entity came to exist. */
public enum ProvenanceMethod {
  MANUAL("manual"),
  EXTRACT_GRAPH("extract_graph"),
  SUMMARIZE("summarize"),
  LINK_SUGGEST("link_suggest");

  private final String wireName;

  ProvenanceMethod(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static ProvenanceMethod fromWire(String value) {
    for (ProvenanceMethod m : values()) {
      if (m.wireName.equals(value)) return m;
    }
    throw new ValidationException("Unknown provenance method '" + value + "'");
  }
}
