package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/** A directed, typed and weighted relationship between two distinct nodes of one owner. */
public record Edge(
    String id,
    @JsonProperty("owner_id") String ownerId,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("target_id") String targetId,
    EdgeType type,
    GovernanceStatus status,
    double weight,
    String label,
    Provenance provenance,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  public Edge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(provenance, "provenance");
  }

  public boolean touches(String nodeId) {
    return sourceId.equals(nodeId) || targetId.equals(nodeId);
  }

  /** The endpoint opposite to {@code nodeId}. */
  public String otherEnd(String nodeId) {
    return sourceId.equals(nodeId) ? targetId : sourceId;
  }

  public Edge withStatus(GovernanceStatus newStatus, Instant now) {
    return new Edge(
        id, ownerId, sourceId, targetId, type, newStatus, weight, label, provenance, createdAt, now);
  }

  public Edge withType(EdgeType newType, Instant now) {
    return new Edge(
        id, ownerId, sourceId, targetId, newType, status, weight, label, provenance, createdAt, now);
  }
}
