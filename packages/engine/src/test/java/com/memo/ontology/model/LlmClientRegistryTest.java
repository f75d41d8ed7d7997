package com.memo.ontology.model;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.ConfigurationProvider;
import com.memo.ontology.exception.ConfigException;
import com.memo.ontology.support.FakeLlmClient;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LlmClientRegistryTest {
  private LlmClientRegistry registry;

  @BeforeEach
  void setUp() {
    Configuration cfg =
        ConfigurationProvider.fromYaml(
            """
            llm:
              timeoutSeconds: 7
              default:
                provider: fake
              extraction:
                provider: fake
                model: precise
            """);
    registry = new LlmClientRegistry(cfg);
  }

  @AfterEach
  void tearDown() {
    registry.close();
  }

  @Test
  @DisplayName("Selections come from configuration and defaults fill missing models")
  void selections() {
    FakeLlmClient fake = new FakeLlmClient();
    registry.register(fake);

    assertEquals(Duration.ofSeconds(7), registry.callOptions().timeout());
    assertEquals("fake:precise", registry.extractionSelection().toString());
    assertEquals(registry.defaultSelection(), registry.embeddingSelection());
    assertEquals("fake:fake-chat", registry.resolveCompletion(null).toString());
    assertEquals("fake:fake-embed", registry.resolveEmbedding(null).toString());
    assertEquals(
        "fake:other", registry.resolveCompletion(ModelSelection.parse("fake:other")).toString());
  }

  @Test
  @DisplayName("Unknown providers are a configuration error")
  void unknownProvider() {
    assertThrows(ConfigException.class, () -> registry.client("acme"));
  }

  @Test
  @DisplayName("Built-in providers refuse to start without an API key")
  void missingApiKey() {
    assertThrows(ConfigException.class, () -> registry.client("openai"));
    assertThrows(ConfigException.class, () -> registry.client("gemini"));
  }
}
