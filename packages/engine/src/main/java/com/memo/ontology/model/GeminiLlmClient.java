package com.memo.ontology.model;

import com.google.genai.Client;
import com.google.genai.types.ContentEmbedding;
import com.google.genai.types.EmbedContentResponse;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.memo.ontology.exception.ExternalCapabilityException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** Google Gemini implementation of {@link LlmClient} using the google-genai SDK. */
public class GeminiLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(GeminiLlmClient.class);
  private final Client geminiClient;

  public GeminiLlmClient(Client geminiClient, Configuration configuration, LlmCallOptions options) {
    super(configuration, options);
    this.geminiClient = geminiClient;
  }

  @Override
  public String providerId() {
    return GeminiLlmClientProvider.ID;
  }

  @Override
  public String defaultModel() {
    return configuration.getString("model", "gemini-2.5-flash");
  }

  @Override
  public String defaultEmbeddingModel() {
    return configuration.getString("embeddingModel", "text-embedding-004");
  }

  @Override
  protected String runCompletion(String model, List<Message> messages) {
    GenerateContentConfig.Builder configBuilder =
        GenerateContentConfig.builder()
            .temperature(configuration.getFloat("options.temperature", 0.3f))
            .candidateCount(1);

    if (Message.contains(messages, Role.SYSTEM)) {
      configBuilder.systemInstruction(
          com.google.genai.types.Content.builder()
              .role("user")
              .parts(
                  com.google.genai.types.Part.fromText(
                      Message.findFirst(messages, Role.SYSTEM).content()))
              .build());
    }

    List<com.google.genai.types.Content> contents = new ArrayList<>();
    Message.allExcept(messages, Role.SYSTEM).forEach(m -> contents.add(asGeminiMessage(m)));

    log.trace("Running inference with model: {}", model);
    GenerateContentResponse response =
        geminiClient.models.generateContent(model, contents, configBuilder.build());
    String text = response.text();
    if (text == null) {
      throw new ExternalCapabilityException("Gemini returned no text for model " + model);
    }
    return text.trim();
  }

  @Override
  protected float[] runEmbedding(String model, String text) {
    EmbedContentResponse response = geminiClient.models.embedContent(model, text, null);
    List<Float> values =
        response
            .embeddings()
            .filter(list -> !list.isEmpty())
            .map(list -> list.get(0))
            .flatMap(ContentEmbedding::values)
            .orElseThrow(
                () ->
                    new ExternalCapabilityException(
                        "Gemini returned no embedding for model " + model));
    return toVector(values);
  }

  private com.google.genai.types.Content asGeminiMessage(Message message) {
    return com.google.genai.types.Content.builder()
        .role(message.role() == Role.ASSISTANT ? "model" : "user")
        .parts(com.google.genai.types.Part.fromText(message.content()))
        .build();
  }
}
