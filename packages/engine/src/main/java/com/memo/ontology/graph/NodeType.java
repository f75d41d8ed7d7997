package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.memo.ontology.exception.ValidationException;
import java.util.Arrays;
import java.util.Map;

/** Semantic type of a knowledge unit. */
public enum NodeType {
  NOTE("Note"),
  CLAIM("Claim"),
  EVIDENCE("Evidence"),
  SOURCE("Source"),
  PERSON("Person"),
  DEFINITION("Definition");

  private final String wireName;

  NodeType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static NodeType fromWire(String value) {
    for (NodeType t : values()) {
      if (t.wireName.equals(value)) return t;
    }
    throw new ValidationException(
        "Unknown node type '" + value + "'",
        Map.of("field", "type", "allowed", Arrays.stream(values()).map(NodeType::wireName).toList()));
  }
}
