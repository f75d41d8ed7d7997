package com.memo.ontology.retrieval;

import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Node;
import com.memo.ontology.model.LlmClientRegistry;
import com.memo.ontology.model.ModelSelection;
import com.memo.ontology.store.OntologyStore;
import com.memo.ontology.utility.StringUtility;
import java.util.Map;
import java.util.Objects;

/**
 * Produces embeddings of the deployment dimensionality. Input is cut to {@code maxInputChars};
 * provider vectors that are shorter are zero-padded, longer ones truncated.
 */
public class EmbeddingIndexer {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(EmbeddingIndexer.class);

  private final OntologyStore store;
  private final LlmClientRegistry models;
  private final int maxInputChars;

  public EmbeddingIndexer(OntologyStore store, LlmClientRegistry models, int maxInputChars) {
    this.store = Objects.requireNonNull(store, "store");
    this.models = Objects.requireNonNull(models, "models");
    this.maxInputChars = maxInputChars;
  }

  /** Embeds free text with the configured embedding model. */
  public float[] embedText(String text) {
    return embedText(text, null);
  }

  public float[] embedText(String text, ModelSelection selection) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Text to embed is required", Map.of("field", "text"));
    }
    ModelSelection resolved = models.resolveEmbedding(selection);
    float[] raw = models.embed(resolved, StringUtility.truncate(text, maxInputChars));
    int dims = store.embeddingDimensions();
    if (raw.length != dims) {
      log.debug("Fitting {}-dimension vector from {} to {}", raw.length, resolved, dims);
    }
    return VectorMath.fit(raw, dims);
  }

  /** Embeds {@code title + content} of the node and stores the vector. */
  public Node embedNode(String ownerId, String nodeId) {
    Node node = store.getNode(ownerId, nodeId);
    String text = (node.title() + "\n\n" + node.content()).trim();
    return store.setEmbedding(ownerId, nodeId, embedText(text));
  }
}
