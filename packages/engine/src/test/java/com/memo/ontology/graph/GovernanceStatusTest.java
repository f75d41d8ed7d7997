package com.memo.ontology.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.exception.InvalidTransitionException;
import com.memo.ontology.exception.ValidationException;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GovernanceStatusTest {

  @Test
  @DisplayName("Experimental -> Active is an approval")
  void approve() {
    assertEquals(
        Optional.of(ProvenanceAction.APPROVE),
        GovernanceStatus.EXPERIMENTAL.transitionTo(GovernanceStatus.ACTIVE));
  }

  @Test
  @DisplayName("Active and Experimental can be deprecated")
  void deprecate() {
    assertEquals(
        Optional.of(ProvenanceAction.DEPRECATE),
        GovernanceStatus.ACTIVE.transitionTo(GovernanceStatus.DEPRECATED));
    assertEquals(
        Optional.of(ProvenanceAction.DEPRECATE),
        GovernanceStatus.EXPERIMENTAL.transitionTo(GovernanceStatus.DEPRECATED));
  }

  @Test
  @DisplayName("Repeating a legal action on its target state is a no-op")
  void idempotentMoves() {
    assertTrue(GovernanceStatus.ACTIVE.transitionTo(GovernanceStatus.ACTIVE).isEmpty());
    assertTrue(GovernanceStatus.DEPRECATED.transitionTo(GovernanceStatus.DEPRECATED).isEmpty());
  }

  @Test
  @DisplayName("Moving back to Experimental or out of Deprecated is rejected")
  void illegalMoves() {
    assertThrows(
        InvalidTransitionException.class,
        () -> GovernanceStatus.ACTIVE.transitionTo(GovernanceStatus.EXPERIMENTAL));
    assertThrows(
        InvalidTransitionException.class,
        () -> GovernanceStatus.EXPERIMENTAL.transitionTo(GovernanceStatus.EXPERIMENTAL));
    assertThrows(
        InvalidTransitionException.class,
        () -> GovernanceStatus.DEPRECATED.transitionTo(GovernanceStatus.ACTIVE));
    assertThrows(
        InvalidTransitionException.class,
        () -> GovernanceStatus.DEPRECATED.transitionTo(GovernanceStatus.EXPERIMENTAL));
  }

  @Test
  @DisplayName("Wire names round-trip and unknown values are rejected")
  void wireNames() {
    assertEquals(GovernanceStatus.EXPERIMENTAL, GovernanceStatus.fromWire("Experimental"));
    assertEquals(EdgeType.CAUSED_BY, EdgeType.fromWire("caused_by"));
    assertThrows(ValidationException.class, () -> GovernanceStatus.fromWire("active"));
    assertThrows(ValidationException.class, () -> NodeType.fromWire("Idea"));
  }
}
