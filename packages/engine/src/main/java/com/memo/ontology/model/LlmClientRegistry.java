package com.memo.ontology.model;

import com.memo.ontology.exception.ConfigException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;

/**
 * Resolves {@link ModelSelection}s to {@link LlmClient}s.
 *
 * <p>Clients are created lazily from {@code llm.providers.<id>.*} through the {@link
 * LlmClientProvider} SPI and cached per provider. The registry owns the inference executor that
 * every client runs its calls on.
 *
 * <pre>
 *   llm.timeoutSeconds = 60
 *   llm.default.provider = gemini
 *   llm.default.model = gemini-2.5-flash
 *   llm.providers.gemini.apiKey = ${env:GOOGLE_API_KEY}
 * </pre>
 */
public final class LlmClientRegistry implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(LlmClientRegistry.class);

  private final Configuration configuration;
  private final ExecutorService executor;
  private final LlmCallOptions options;
  private final Map<String, LlmClient> clients = new ConcurrentHashMap<>();

  private final ModelSelection defaultSelection;
  private final ModelSelection extractionSelection;
  private final ModelSelection embeddingSelection;

  public LlmClientRegistry(Configuration configuration) {
    this.configuration = configuration;
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "memo-inference-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    this.options =
        new LlmCallOptions(
            executor, Duration.ofSeconds(configuration.getLong("llm.timeoutSeconds", 60L)));
    this.defaultSelection =
        ModelSelection.fromConfiguration(
            configuration, "llm.default", ModelSelection.of("gemini", null));
    this.extractionSelection =
        ModelSelection.fromConfiguration(configuration, "llm.extraction", defaultSelection);
    this.embeddingSelection =
        ModelSelection.fromConfiguration(configuration, "llm.embedding", defaultSelection);
  }

  public LlmCallOptions callOptions() {
    return options;
  }

  /** Registers a pre-built client, replacing any client of the same provider. */
  public LlmClientRegistry register(LlmClient client) {
    clients.put(client.providerId(), client);
    return this;
  }

  public ModelSelection defaultSelection() {
    return defaultSelection;
  }

  public ModelSelection extractionSelection() {
    return extractionSelection;
  }

  public ModelSelection embeddingSelection() {
    return embeddingSelection;
  }

  public LlmClient client(String providerId) {
    return clients.computeIfAbsent(providerId, this::createClient);
  }

  private LlmClient createClient(String providerId) {
    String prefix = "llm.providers." + providerId;
    Configuration subConfig = configuration.subset(prefix);
    List<String> known = new ArrayList<>();
    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      known.add(p.providerId());
      if (providerId.equals(p.providerId())) {
        log.info("Creating LLM client for provider '{}'", providerId);
        return p.create(subConfig, options);
      }
    }
    throw new ConfigException(
        "Unknown LLM provider '%s', available providers: %s".formatted(providerId, known));
  }

  /** Fills in the provider default model when the selection names none. */
  public ModelSelection resolveCompletion(ModelSelection selection) {
    ModelSelection s = selection != null ? selection : defaultSelection;
    return s.model() != null ? s : s.withModel(client(s.provider()).defaultModel());
  }

  public ModelSelection resolveEmbedding(ModelSelection selection) {
    ModelSelection s = selection != null ? selection : embeddingSelection;
    return s.model() != null ? s : s.withModel(client(s.provider()).defaultEmbeddingModel());
  }

  /** @param selection fully resolved selection, see {@link #resolveEmbedding} */
  public float[] embed(ModelSelection selection, String text) {
    return client(selection.provider()).embed(selection.model(), text);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
