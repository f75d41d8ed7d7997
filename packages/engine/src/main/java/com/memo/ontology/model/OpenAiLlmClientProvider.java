package com.memo.ontology.model;

import com.memo.ontology.exception.ConfigException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for OpenAI-based {@link LlmClient} implementations. */
public final class OpenAiLlmClientProvider implements LlmClientProvider {
  static final String ID = "openai";

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public LlmClient create(Configuration subConfiguration, LlmCallOptions options) {
    String apiKey = subConfiguration.getString("apiKey");
    // unresolved ${env:...} placeholders count as missing
    if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
      throw new ConfigException("Missing llm.providers.openai.apiKey in configuration");
    }
    OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder().apiKey(apiKey);
    String baseUrl = subConfiguration.getString("baseUrl");
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    OpenAIClient client = builder.build();
    return new OpenAiLlmClient(client, subConfiguration, options);
  }
}
