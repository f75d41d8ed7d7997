package com.memo.ontology.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.memo.ontology.exception.PromptException;
import com.memo.ontology.model.LlmClient;
import com.memo.ontology.prompt.PromptTemplate;
import com.memo.ontology.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/** Parses the prompt YAML layout shared by the repositories. */
final class PromptYaml {
  private PromptYaml() {}

  static PromptTemplate parse(String id, String yamlContent) throws Exception {
    JsonNode root = JacksonUtility.getYamlMapper().readTree(yamlContent);
    JsonNode arr = root == null ? null : root.get("sections");
    if (arr == null || !arr.isArray()) {
      throw new PromptException("Prompt YAML must contain a 'sections' array: " + id);
    }

    List<PromptTemplate.PromptSection> sections = new ArrayList<>();
    for (JsonNode n : arr) {
      String roleStr = n.path("role").asText(null);
      if (roleStr == null) {
        throw new PromptException("Missing role for a section in prompt: " + id);
      }
      LlmClient.Role role =
          switch (roleStr.toLowerCase()) {
            case "user" -> LlmClient.Role.USER;
            case "assistant" -> LlmClient.Role.ASSISTANT;
            case "system" -> LlmClient.Role.SYSTEM;
            default -> throw new PromptException(
                "Unknown role '" + roleStr + "' in prompt: " + id);
          };

      String sectionId = n.path("id").asText(null);
      if (sectionId == null || sectionId.isBlank()) {
        throw new PromptException("Missing section id in prompt: " + id);
      }
      boolean enabled = n.path("enabled").asBoolean(true);
      String content = n.path("content").asText("");
      if (content.isBlank()) {
        throw new PromptException(
            "Empty content for section '" + sectionId + "' in prompt: " + id);
      }
      sections.add(new PromptTemplate.PromptSection(role, sectionId, enabled, content));
    }
    return new PebblePromptTemplate(id, sections);
  }
}
