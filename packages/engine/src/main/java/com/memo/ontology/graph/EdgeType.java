package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.memo.ontology.exception.ValidationException;
import java.util.Arrays;
import java.util.Map;

/** Relationship semantics of a directed edge. */
public enum EdgeType {
  RELATED_TO("related_to"),
  SUPPORTS("supports"),
  REFUTES("refutes"),
  DEFINES("defines"),
  CAUSED_BY("caused_by"),
  DERIVED_FROM("derived_from"),
  EXAMPLE_OF("example_of"),
  PART_OF("part_of");

  private final String wireName;

  EdgeType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static EdgeType fromWire(String value) {
    for (EdgeType t : values()) {
      if (t.wireName.equals(value)) return t;
    }
    throw new ValidationException(
        "Unknown edge type '" + value + "'",
        Map.of("field", "type", "allowed", Arrays.stream(values()).map(EdgeType::wireName).toList()));
  }
}
