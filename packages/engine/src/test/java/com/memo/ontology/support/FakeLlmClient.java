package com.memo.ontology.support;

import com.memo.ontology.exception.ExternalCapabilityException;
import com.memo.ontology.model.LlmClient;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted {@link LlmClient}: completions are served from a queue, embeddings from a text lookup
 * with a fallback vector. Every call is captured for assertions.
 */
public class FakeLlmClient implements LlmClient {
  public static final String PROVIDER = "fake";

  private final Deque<String> completions = new ArrayDeque<>();
  private final Map<String, float[]> vectors = new HashMap<>();
  private float[] fallbackVector = {0f, 0f, 1f};

  public final List<List<Message>> completionCalls = new ArrayList<>();
  public final List<String> embeddedTexts = new ArrayList<>();

  public FakeLlmClient reply(String completion) {
    completions.add(completion);
    return this;
  }

  public FakeLlmClient vector(String text, float... vector) {
    vectors.put(text, vector);
    return this;
  }

  public FakeLlmClient fallbackVector(float... vector) {
    this.fallbackVector = vector;
    return this;
  }

  @Override
  public String providerId() {
    return PROVIDER;
  }

  @Override
  public String defaultModel() {
    return "fake-chat";
  }

  @Override
  public String defaultEmbeddingModel() {
    return "fake-embed";
  }

  @Override
  public String complete(String model, List<Message> messages) {
    completionCalls.add(messages);
    if (completions.isEmpty()) {
      throw new ExternalCapabilityException("No scripted completion left");
    }
    return completions.poll();
  }

  @Override
  public float[] embed(String model, String text) {
    embeddedTexts.add(text);
    return vectors.getOrDefault(text, fallbackVector).clone();
  }

  /** Text of the last user message sent to {@link #complete}. */
  public String lastUserMessage() {
    List<Message> last = completionCalls.get(completionCalls.size() - 1);
    for (int i = last.size() - 1; i >= 0; i--) {
      if (last.get(i).role() == Role.USER) return last.get(i).content();
    }
    throw new AssertionError("No user message captured");
  }
}
