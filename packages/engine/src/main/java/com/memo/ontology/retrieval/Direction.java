package com.memo.ontology.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/** Orientation of a traversed edge relative to the node being expanded. */
public enum Direction {
  OUTGOING("outgoing"),
  INCOMING("incoming");

  private final String wireName;

  Direction(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
