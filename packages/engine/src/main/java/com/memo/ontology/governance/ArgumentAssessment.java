package com.memo.ontology.governance;

import java.util.List;

/**
 * Model assessment of how well a claim is argued.
 *
 * @param assessment one of strong, moderate, weak
 */
public record ArgumentAssessment(
    String claimId,
    String assessment,
    List<String> missingEvidence,
    List<String> potentialRebuttals,
    Double suggestedQualifier,
    String reasoning,
    String model,
    String logId) {

  public ArgumentAssessment {
    missingEvidence = List.copyOf(missingEvidence);
    potentialRebuttals = List.copyOf(potentialRebuttals);
  }
}
