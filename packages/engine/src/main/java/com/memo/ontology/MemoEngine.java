package com.memo.ontology;

import com.memo.ontology.exception.StateException;
import com.memo.ontology.governance.GovernanceController;
import com.memo.ontology.extraction.ExtractionPipeline;
import com.memo.ontology.model.LlmClientRegistry;
import com.memo.ontology.prompt.PromptRepository;
import com.memo.ontology.prompt.PromptRepositoryFactory;
import com.memo.ontology.rag.GraphRagOrchestrator;
import com.memo.ontology.rag.RagSettings;
import com.memo.ontology.retrieval.EmbeddingIndexer;
import com.memo.ontology.retrieval.RetrievalEngine;
import com.memo.ontology.retrieval.RetrievalSettings;
import com.memo.ontology.retrieval.SimilarityFinder;
import com.memo.ontology.store.GraphStore;
import com.memo.ontology.store.GraphStoreFactory;
import com.memo.ontology.store.OntologyStore;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires the ontology engine from one configuration.
 *
 * <pre>
 *   memo.store.driver = in-memory | orientdb
 *   memo.embedding.dimensions = 1536
 *   memo.embedding.maxInputChars = 8000
 *   memo.similar.threshold = 0.5
 *   memo.similar.topK = 3
 *   memo.extraction.titleMaxChars = 100
 * </pre>
 */
public class MemoEngine implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(MemoEngine.class);

  private final Configuration configuration;
  private final GraphStore graphStore;
  private final LlmClientRegistry models;
  private final PromptRepository prompts;
  private final OntologyStore store;
  private final RetrievalEngine retrieval;
  private final EmbeddingIndexer embeddings;
  private final SimilarityFinder similarity;
  private final ExtractionPipeline extraction;
  private final GraphRagOrchestrator rag;
  private final GovernanceController governance;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public MemoEngine(Configuration configuration) {
    this(
        configuration,
        GraphStoreFactory.create(configuration),
        new LlmClientRegistry(configuration),
        Clock.systemUTC());
  }

  /** Assembles the engine over pre-built collaborators; the engine takes ownership of both. */
  public MemoEngine(
      Configuration configuration, GraphStore graphStore, LlmClientRegistry models, Clock clock) {
    this.configuration = configuration;
    this.graphStore = graphStore;
    this.models = models;
    if (!graphStore.isInitialized()) {
      graphStore.initialize();
    }
    this.prompts = PromptRepositoryFactory.create(configuration);
    this.store =
        new OntologyStore(
            graphStore, clock, configuration.getInt("memo.embedding.dimensions", 1536));
    this.retrieval = new RetrievalEngine(graphStore, RetrievalSettings.from(configuration));
    this.embeddings =
        new EmbeddingIndexer(
            store, models, configuration.getInt("memo.embedding.maxInputChars", 8000));
    this.similarity =
        new SimilarityFinder(
            retrieval,
            embeddings,
            configuration.getDouble("memo.similar.threshold", 0.5),
            configuration.getInt("memo.similar.topK", 3));
    this.extraction =
        new ExtractionPipeline(
            store, models, prompts, configuration.getInt("memo.extraction.titleMaxChars", 100));
    this.rag =
        new GraphRagOrchestrator(
            store, retrieval, embeddings, models, prompts, RagSettings.from(configuration));
    this.governance = new GovernanceController(store, models, prompts);
    log.info(
        "Ontology engine ready (store: {}, embedding dimensions: {})",
        graphStore.driverId(),
        store.embeddingDimensions());
  }

  public Configuration configuration() {
    return configuration;
  }

  public OntologyStore store() {
    ensureOpen();
    return store;
  }

  public RetrievalEngine retrieval() {
    ensureOpen();
    return retrieval;
  }

  public EmbeddingIndexer embeddings() {
    ensureOpen();
    return embeddings;
  }

  public SimilarityFinder similarity() {
    ensureOpen();
    return similarity;
  }

  public ExtractionPipeline extraction() {
    ensureOpen();
    return extraction;
  }

  public GraphRagOrchestrator rag() {
    ensureOpen();
    return rag;
  }

  public GovernanceController governance() {
    ensureOpen();
    return governance;
  }

  public LlmClientRegistry models() {
    return models;
  }

  public PromptRepository prompts() {
    return prompts;
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new StateException("Ontology engine has been closed");
    }
  }

  /** Releases the store and the inference executor. Safe to call more than once. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      try {
        models.close();
      } finally {
        graphStore.shutdown();
      }
      log.info("Ontology engine shut down");
    }
  }
}
