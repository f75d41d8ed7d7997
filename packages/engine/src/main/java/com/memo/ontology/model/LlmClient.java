package com.memo.ontology.model;

import java.util.List;

/**
 * Reasoning capability exposed by a model provider: chat completion and text embedding.
 *
 * <p>Implementations encapsulate provider SDKs and are selected per request through a {@link
 * ModelSelection} resolved by the {@link LlmClientRegistry}. Failures, timeouts included, surface
 * as {@link com.memo.ontology.exception.ExternalCapabilityException}.
 */
public interface LlmClient {

  /** A stable, lowercase identifier of the provider (e.g. "openai"). */
  String providerId();

  /** Model used for completions when a selection names none. */
  String defaultModel();

  /** Model used for embeddings when a selection names none. */
  String defaultEmbeddingModel();

  /**
   * Runs a single-turn completion.
   *
   * @param model provider model id, never null
   * @return the model's text answer, trimmed
   */
  String complete(String model, List<Message> messages);

  /** Embeds {@code text} with the given embedding model. */
  float[] embed(String model, String text);

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    static List<Message> allExcept(List<Message> messages, Role role) {
      return messages.stream().filter(m -> !m.role().equals(role)).toList();
    }

    static boolean contains(List<Message> messages, Role role) {
      return messages.stream().anyMatch(m -> m.role().equals(role));
    }

    static Message findFirst(List<Message> messages, Role role) {
      return messages.stream().filter(m -> m.role().equals(role)).findFirst().orElseThrow();
    }
  }
}
