package com.memo.ontology.model;

import com.google.genai.Client;
import com.memo.ontology.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for Google Gemini-based {@link LlmClient} implementations. */
public final class GeminiLlmClientProvider implements LlmClientProvider {
  static final String ID = "gemini";

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public LlmClient create(Configuration subConfiguration, LlmCallOptions options) {
    String apiKey = subConfiguration.getString("apiKey");
    // unresolved ${env:...} placeholders count as missing
    if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
      throw new ConfigException("Missing llm.providers.gemini.apiKey in configuration");
    }
    Client client = Client.builder().apiKey(apiKey).build();
    return new GeminiLlmClient(client, subConfiguration, options);
  }
}
