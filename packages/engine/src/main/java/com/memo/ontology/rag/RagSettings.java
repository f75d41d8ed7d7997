package com.memo.ontology.rag;

import org.apache.commons.configuration2.Configuration;

/** GraphRAG defaults, read from {@code memo.rag.*}. */
public record RagSettings(double threshold, int topK, int depth) {

  public static RagSettings defaults() {
    return new RagSettings(0.4, 5, 1);
  }

  public static RagSettings from(Configuration cfg) {
    RagSettings d = defaults();
    return new RagSettings(
        cfg.getDouble("memo.rag.threshold", d.threshold()),
        cfg.getInt("memo.rag.topK", d.topK()),
        cfg.getInt("memo.rag.depth", d.depth()));
  }
}
