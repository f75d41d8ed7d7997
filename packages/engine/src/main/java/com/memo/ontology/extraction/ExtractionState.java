package com.memo.ontology.extraction;

/** Lifecycle of one extraction batch. Committed and Failed are terminal. */
public enum ExtractionState {
  SUBMITTED,
  ANALYZED,
  COMMITTED,
  FAILED
}
