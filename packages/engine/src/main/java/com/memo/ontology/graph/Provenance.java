package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.memo.ontology.exception.ValidationException;
import java.util.Map;
import java.util.Objects;

/**
 * Who or what produced an entity and with what confidence.
 *
 * @param sourceNodeId back-reference to the node the entity was derived from; not ownership
 * @param confidence value in [0, 1] or null when unknown
 */
public record Provenance(
    CreatorType creator,
    String model,
    @JsonProperty("model_version") String modelVersion,
    @JsonProperty("source_node_id") String sourceNodeId,
    Double confidence,
    ProvenanceMethod method) {

  public Provenance {
    Objects.requireNonNull(creator, "creator");
    if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
      throw new ValidationException(
          "Provenance confidence must be within [0, 1], got " + confidence,
          Map.of("field", "confidence", "value", confidence));
    }
  }

  /** Provenance for content authored by the given actor through the given method. */
  public static Provenance of(
      Actor actor, ProvenanceMethod method, String sourceNodeId, Double confidence) {
    return new Provenance(
        actor.creator(), actor.modelId(), actor.modelVersion(), sourceNodeId, confidence, method);
  }
}
