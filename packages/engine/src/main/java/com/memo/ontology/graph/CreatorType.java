package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.memo.ontology.exception.ValidationException;

public enum CreatorType {
  USER("User"),
  AI("AI");

  private final String wireName;

  CreatorType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static CreatorType fromWire(String value) {
    for (CreatorType t : values()) {
      if (t.wireName.equals(value)) return t;
    }
    throw new ValidationException("Unknown creator '" + value + "', expected User or AI");
  }
}
