package com.memo.ontology.graph;

/**
 * Caller-supplied fields for a new edge.
 *
 * @param type defaults to {@link EdgeType#RELATED_TO} when null
 * @param weight defaults to 1.0 when null
 * @param method provenance method, defaults to manual for users
 */
public record EdgeDraft(
    String sourceId,
    String targetId,
    EdgeType type,
    Double weight,
    String label,
    String sourceNodeId,
    Double confidence,
    ProvenanceMethod method) {

  public static EdgeDraft of(String sourceId, String targetId, EdgeType type, double weight) {
    return new EdgeDraft(sourceId, targetId, type, weight, null, null, null, null);
  }

  public EdgeDraft withLabel(String newLabel) {
    return new EdgeDraft(
        sourceId, targetId, type, weight, newLabel, sourceNodeId, confidence, method);
  }

  public EdgeType effectiveType() {
    return type == null ? EdgeType.RELATED_TO : type;
  }

  public double effectiveWeight() {
    return weight == null ? 1.0 : weight;
  }
}
