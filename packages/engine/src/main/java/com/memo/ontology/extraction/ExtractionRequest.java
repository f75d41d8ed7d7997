package com.memo.ontology.extraction;

import com.memo.ontology.model.ModelSelection;

/**
 * Text to decompose into a graph.
 *
 * @param sourceNodeId optional node the text came from; recorded in provenance
 * @param model optional model; the configured extraction model when null
 */
public record ExtractionRequest(
    String ownerId, String text, String sourceNodeId, ModelSelection model) {

  public static ExtractionRequest of(String ownerId, String text) {
    return new ExtractionRequest(ownerId, text, null, null);
  }

  public ExtractionRequest fromNode(String nodeId) {
    return new ExtractionRequest(ownerId, text, nodeId, model);
  }

  public ExtractionRequest using(ModelSelection selection) {
    return new ExtractionRequest(ownerId, text, sourceNodeId, selection);
  }
}
