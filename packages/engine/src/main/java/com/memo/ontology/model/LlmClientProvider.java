package com.memo.ontology.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable LLM providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in {@code
 * META-INF/services/com.memo.ontology.model.LlmClientProvider}. The registry selects one by
 * matching a {@link ModelSelection#provider()} to {@link #providerId()}.
 */
public interface LlmClientProvider {

  /** A stable, lowercase identifier for this provider (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured {@link LlmClient} instance.
   *
   * @param subConfiguration provider-specific configuration subset ({@code llm.providers.<id>.*})
   * @throws com.memo.ontology.exception.ConfigException when required keys are missing
   */
  LlmClient create(Configuration subConfiguration, LlmCallOptions options);
}
