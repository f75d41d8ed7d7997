package com.memo.ontology.retrieval;

import java.util.List;
import java.util.Objects;

/** "Similar notes" lookup: embed a draft text and return its nearest existing nodes. */
public class SimilarityFinder {
  private final RetrievalEngine retrieval;
  private final EmbeddingIndexer embeddings;
  private final double threshold;
  private final int defaultTopK;

  public SimilarityFinder(
      RetrievalEngine retrieval, EmbeddingIndexer embeddings, double threshold, int defaultTopK) {
    this.retrieval = Objects.requireNonNull(retrieval, "retrieval");
    this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
    this.threshold = threshold;
    this.defaultTopK = defaultTopK;
  }

  public List<ScoredNode> findSimilar(String ownerId, String text) {
    return findSimilar(ownerId, text, defaultTopK);
  }

  public List<ScoredNode> findSimilar(String ownerId, String text, int topK) {
    float[] vector = embeddings.embedText(text);
    return retrieval.searchByVector(ownerId, vector, threshold, topK > 0 ? topK : defaultTopK);
  }
}
