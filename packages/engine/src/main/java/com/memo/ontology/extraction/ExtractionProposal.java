package com.memo.ontology.extraction;

import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.NodeType;
import java.util.List;

/**
 * Typed view of the model's decomposition. Relationship indexes address the claims first, then
 * the entities.
 */
public record ExtractionProposal(
    List<ProposedClaim> claims,
    List<ProposedRelationship> relationships,
    List<ProposedEntity> entities) {

  public ExtractionProposal {
    claims = List.copyOf(claims);
    relationships = List.copyOf(relationships);
    entities = List.copyOf(entities);
  }

  /** @param qualifier model confidence, may be null */
  public record ProposedClaim(String text, Double qualifier, NodeType type) {}

  /** @param weight relationship strength, may be null for the default */
  public record ProposedRelationship(
      int sourceIndex, int targetIndex, EdgeType type, Double weight) {}

  public record ProposedEntity(String name, NodeType type) {}
}
