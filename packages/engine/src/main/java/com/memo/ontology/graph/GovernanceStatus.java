package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.memo.ontology.exception.InvalidTransitionException;
import com.memo.ontology.exception.ValidationException;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle stage shared by nodes and edges.
 *
 * <p>Legal moves are {@code Experimental -> Active} (approve) and {@code Active|Experimental ->
 * Deprecated} (deprecate). Deprecated is terminal.
 */
public enum GovernanceStatus {
  ACTIVE("Active"),
  EXPERIMENTAL("Experimental"),
  DEPRECATED("Deprecated");

  private final String wireName;

  GovernanceStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static GovernanceStatus fromWire(String value) {
    for (GovernanceStatus s : values()) {
      if (s.wireName.equals(value)) return s;
    }
    throw new ValidationException(
        "Unknown governance status '" + value + "'", Map.of("field", "status"));
  }

  /**
   * Resolves the audit action for moving from this status to {@code target}.
   *
   * @return the action to log, or empty when the entity is already in the requested state of a
   *     legal action (approve on Active, deprecate on Deprecated)
   * @throws InvalidTransitionException for every other move
   */
  public Optional<ProvenanceAction> transitionTo(GovernanceStatus target) {
    if (target == ACTIVE) {
      if (this == EXPERIMENTAL) return Optional.of(ProvenanceAction.APPROVE);
      if (this == ACTIVE) return Optional.empty();
    } else if (target == DEPRECATED) {
      if (this == DEPRECATED) return Optional.empty();
      return Optional.of(ProvenanceAction.DEPRECATE);
    }
    throw new InvalidTransitionException(
        "Illegal governance transition %s -> %s".formatted(wireName, target.wireName),
        Map.of("from", wireName, "to", target.wireName));
  }
}
