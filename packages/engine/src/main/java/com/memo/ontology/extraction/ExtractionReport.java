package com.memo.ontology.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of an extraction batch. A Committed report may still be partial: skipped items are
 * listed, never thrown.
 *
 * @param reason why the batch failed; null when committed
 * @param summaryLogId id of the {@code extract_graph} audit entry; null when failed
 */
public record ExtractionReport(
    ExtractionState state,
    String reason,
    String model,
    @JsonProperty("proposed_claims") int proposedClaims,
    @JsonProperty("proposed_relationships") int proposedRelationships,
    @JsonProperty("proposed_entities") int proposedEntities,
    @JsonProperty("node_ids") List<String> nodeIds,
    @JsonProperty("edge_ids") List<String> edgeIds,
    List<String> skipped,
    @JsonProperty("summary_log_id") String summaryLogId) {

  public ExtractionReport {
    nodeIds = List.copyOf(nodeIds);
    edgeIds = List.copyOf(edgeIds);
    skipped = List.copyOf(skipped);
  }

  static ExtractionReport failed(String model, String reason) {
    return new ExtractionReport(
        ExtractionState.FAILED, reason, model, 0, 0, 0, List.of(), List.of(), List.of(), null);
  }

  @JsonProperty("nodes_created")
  public int nodesCreated() {
    return nodeIds.size();
  }

  @JsonProperty("edges_created")
  public int edgesCreated() {
    return edgeIds.size();
  }

  public boolean committed() {
    return state == ExtractionState.COMMITTED;
  }
}
