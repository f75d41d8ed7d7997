package com.memo.ontology.model;

import com.openai.client.OpenAIClient;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.memo.ontology.exception.ExternalCapabilityException;
import com.memo.ontology.exception.StateException;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** OpenAI implementation of {@link LlmClient} using the openai-java SDK. */
public class OpenAiLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(OpenAiLlmClient.class);
  private final OpenAIClient openAIClient;

  public OpenAiLlmClient(
      OpenAIClient openAIClient, Configuration configuration, LlmCallOptions options) {
    super(configuration, options);
    this.openAIClient = openAIClient;
  }

  @Override
  public String providerId() {
    return OpenAiLlmClientProvider.ID;
  }

  @Override
  public String defaultModel() {
    return configuration.getString("model", "gpt-4o-mini");
  }

  @Override
  public String defaultEmbeddingModel() {
    return configuration.getString("embeddingModel", "text-embedding-3-small");
  }

  @Override
  protected String runCompletion(String model, List<Message> messages) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .temperature(configuration.getDouble("options.temperature", 0.3));

    if (Message.contains(messages, Role.SYSTEM)) {
      builder.addSystemMessage(Message.findFirst(messages, Role.SYSTEM).content());
    }
    Message.allExcept(messages, Role.SYSTEM)
        .forEach(
            message -> {
              if (message.role() == Role.ASSISTANT) {
                builder.addAssistantMessage(message.content());
              } else if (message.role() == Role.USER) {
                builder.addUserMessage(message.content());
              } else {
                throw new StateException("Unknown message role: " + message.role());
              }
            });

    ChatCompletion completion = openAIClient.chat().completions().create(builder.build());
    if (completion.choices().isEmpty()) {
      throw new ExternalCapabilityException("OpenAI returned no choices for model " + model);
    }
    completion
        .usage()
        .ifPresent(u -> log.debug("[Inference] - OpenAI: total tokens {}", u.totalTokens()));
    return completion.choices().get(0).message().content().map(String::trim).orElse("");
  }

  @Override
  protected float[] runEmbedding(String model, String text) {
    CreateEmbeddingResponse response =
        openAIClient
            .embeddings()
            .create(EmbeddingCreateParams.builder().input(text).model(model).build());
    if (response.data().isEmpty()) {
      throw new ExternalCapabilityException("OpenAI returned no embedding for model " + model);
    }
    return toVector(response.data().get(0).embedding());
  }
}
