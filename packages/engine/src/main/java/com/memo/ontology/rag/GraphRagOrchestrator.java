package com.memo.ontology.rag;

import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.model.LlmClient;
import com.memo.ontology.model.LlmClientRegistry;
import com.memo.ontology.model.ModelSelection;
import com.memo.ontology.prompt.PromptRepository;
import com.memo.ontology.retrieval.EmbeddingIndexer;
import com.memo.ontology.retrieval.RetrievalEngine;
import com.memo.ontology.retrieval.ScoredNode;
import com.memo.ontology.store.OntologyStore;
import com.memo.ontology.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Question answering over the graph: embed the question, find the closest nodes, add their
 * neighbors, let the model answer from that bundle only, and audit the query.
 *
 * <p>No store lock is held while the model runs. Embedding and completion failures propagate as
 * {@link com.memo.ontology.exception.ExternalCapabilityException}; there is no answer without
 * them.
 */
public class GraphRagOrchestrator {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(GraphRagOrchestrator.class);

  static final String PROMPT = "graph-rag";

  private final OntologyStore store;
  private final RetrievalEngine retrieval;
  private final EmbeddingIndexer embeddings;
  private final LlmClientRegistry models;
  private final PromptRepository prompts;
  private final RagSettings settings;

  public GraphRagOrchestrator(
      OntologyStore store,
      RetrievalEngine retrieval,
      EmbeddingIndexer embeddings,
      LlmClientRegistry models,
      PromptRepository prompts,
      RagSettings settings) {
    this.store = Objects.requireNonNull(store, "store");
    this.retrieval = Objects.requireNonNull(retrieval, "retrieval");
    this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
    this.models = Objects.requireNonNull(models, "models");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public GraphRagAnswer ask(String ownerId, String question) {
    return ask(ownerId, question, null);
  }

  /**
   * Answers {@code question} from the owner's graph. Zero hits still produce an answer from an
   * empty bundle.
   *
   * @param selection completion model; the configured default when null
   */
  public GraphRagAnswer ask(String ownerId, String question, ModelSelection selection) {
    OntologyStore.requireOwner(ownerId);
    if (question == null || question.isBlank()) {
      throw new ValidationException("Question is required", Map.of("field", "question"));
    }
    ModelSelection model = models.resolveCompletion(selection);

    float[] vector = embeddings.embedText(question);
    List<ScoredNode> hits =
        retrieval.searchByVector(ownerId, vector, settings.threshold(), settings.topK());

    List<RagSource> sources = new ArrayList<>();
    for (ScoredNode hit : hits) {
      sources.add(
          new RagSource(
              hit.node(),
              hit.score(),
              retrieval.neighborContext(hit.node().id(), ownerId, settings.depth())));
    }
    log.debug("GraphRAG for owner {}: {} source(s)", ownerId, sources.size());

    List<LlmClient.Message> messages =
        prompts
            .get(PROMPT)
            .newSession()
            .enable(
                "question",
                Map.of("context", ContextBundle.render(sources), "question", question))
            .renderMessages();
    String answer = models.client(model.provider()).complete(model.model(), messages);

    List<String> sourceIds = sources.stream().map(s -> s.node().id()).toList();
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("question", question);
    metadata.put("source_node_ids", sourceIds);
    metadata.put("source_count", sourceIds.size());
    ProvenanceLogEntry entry =
        store.recordActivity(
            ownerId,
            ProvenanceAction.SUMMARIZE,
            Actor.ai(model.model()),
            "GraphRAG query: \"%s\"".formatted(StringUtility.truncate(question, 100)),
            null,
            metadata);

    return new GraphRagAnswer(answer, sources, model.toString(), entry.id());
  }
}
