package com.memo.ontology.retrieval;

import org.apache.commons.configuration2.Configuration;

/** Retrieval defaults, read from {@code memo.retrieval.*}. */
public record RetrievalSettings(
    double vectorThreshold,
    int vectorLimit,
    double textMatchThreshold,
    int textLimit,
    int defaultDepth) {

  public static RetrievalSettings defaults() {
    return new RetrievalSettings(0.7, 10, 0.3, 20, 1);
  }

  public static RetrievalSettings from(Configuration cfg) {
    RetrievalSettings d = defaults();
    return new RetrievalSettings(
        cfg.getDouble("memo.retrieval.vectorThreshold", d.vectorThreshold()),
        cfg.getInt("memo.retrieval.vectorLimit", d.vectorLimit()),
        cfg.getDouble("memo.retrieval.textMatchThreshold", d.textMatchThreshold()),
        cfg.getInt("memo.retrieval.textLimit", d.textLimit()),
        cfg.getInt("memo.retrieval.depth", d.defaultDepth()));
  }
}
