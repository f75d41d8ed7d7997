package com.memo.ontology.model;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.ConfigurationProvider;
import com.memo.ontology.exception.ValidationException;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ModelSelectionTest {

  @Test
  @DisplayName("provider:model is parsed and the provider lower-cased")
  void parse() {
    ModelSelection s = ModelSelection.parse("OpenAI:gpt-4o-mini");
    assertEquals("openai", s.provider());
    assertEquals("gpt-4o-mini", s.model());
    assertEquals("openai:gpt-4o-mini", s.toString());

    ModelSelection bare = ModelSelection.parse("gemini");
    assertNull(bare.model());
    assertEquals("gemini", bare.toString());
  }

  @Test
  @DisplayName("Blank selections are rejected")
  void blank() {
    assertThrows(ValidationException.class, () -> ModelSelection.parse(" "));
    assertThrows(ValidationException.class, () -> ModelSelection.of("", "m"));
  }

  @Test
  @DisplayName("Configuration falls back when the provider key is absent")
  void fromConfiguration() {
    Configuration cfg =
        ConfigurationProvider.fromYaml(
            """
            llm:
              extraction:
                provider: openai
                model: gpt-4o
            """);
    ModelSelection fallback = ModelSelection.of("gemini", null);

    assertEquals(
        ModelSelection.of("openai", "gpt-4o"),
        ModelSelection.fromConfiguration(cfg, "llm.extraction", fallback));
    assertSame(fallback, ModelSelection.fromConfiguration(cfg, "llm.embedding", fallback));
  }
}
