package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable audit record. Target references are weak: deleting the target nulls them, the entry
 * itself is never updated otherwise nor deleted.
 */
public record ProvenanceLogEntry(
    String id,
    @JsonProperty("owner_id") String ownerId,
    ProvenanceAction action,
    String description,
    CreatorType actor,
    @JsonProperty("model_id") String modelId,
    @JsonProperty("model_version") String modelVersion,
    @JsonProperty("target_node_id") String targetNodeId,
    @JsonProperty("target_edge_id") String targetEdgeId,
    @JsonProperty("before_state") Map<String, Object> beforeState,
    @JsonProperty("after_state") Map<String, Object> afterState,
    Map<String, Object> metadata,
    @JsonProperty("created_at") Instant createdAt) {

  public ProvenanceLogEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(actor, "actor");
    Objects.requireNonNull(createdAt, "createdAt");
    metadata = metadata == null ? Map.of() : metadata;
  }

  public ProvenanceLogEntry withoutNodeTarget() {
    return new ProvenanceLogEntry(
        id, ownerId, action, description, actor, modelId, modelVersion, null, targetEdgeId,
        beforeState, afterState, metadata, createdAt);
  }

  public ProvenanceLogEntry withoutEdgeTarget() {
    return new ProvenanceLogEntry(
        id, ownerId, action, description, actor, modelId, modelVersion, targetNodeId, null,
        beforeState, afterState, metadata, createdAt);
  }
}
