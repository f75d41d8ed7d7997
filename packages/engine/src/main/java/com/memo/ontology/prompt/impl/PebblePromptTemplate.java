package com.memo.ontology.prompt.impl;

import com.memo.ontology.exception.PromptException;
import com.memo.ontology.model.LlmClient;
import com.memo.ontology.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles every section once with Pebble. Variables are strict, so a missing one fails the
 * render instead of producing a half-filled prompt. Output is plain text and is not escaped.
 */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder()
          .strictVariables(true)
          .autoEscaping(false)
          .newLineTrimming(false)
          .build();

  private final String id;
  private final List<PromptSection> sections;
  private final Map<String, PebbleTemplate> compiled;

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    Map<String, PebbleTemplate> templates = new LinkedHashMap<>();
    for (PromptSection s : this.sections) {
      if (templates.put(s.id(), ENGINE.getLiteralTemplate(s.content())) != null) {
        throw new PromptException("Duplicate section '" + s.id() + "' in prompt: " + id);
      }
    }
    this.compiled = Map.copyOf(templates);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public PromptSession newSession() {
    Map<String, Map<String, Object>> bindings = new HashMap<>();
    for (PromptSection s : sections) {
      if (s.enabledByDefault()) bindings.put(s.id(), Map.of());
    }
    return new Session(bindings);
  }

  private String render(PromptSection section, Map<String, Object> vars) {
    StringWriter out = new StringWriter();
    try {
      compiled.get(section.id()).evaluate(out, vars);
    } catch (IOException | PebbleException e) {
      throw new PromptException(
          "Failed to render section '%s' of prompt '%s'".formatted(section.id(), id), e);
    }
    return out.toString();
  }

  private final class Session implements PromptSession {
    private final Map<String, Map<String, Object>> bindings;

    private Session(Map<String, Map<String, Object>> bindings) {
      this.bindings = bindings;
    }

    @Override
    public PromptSession enable(String sectionId, Map<String, Object> vars) {
      if (!compiled.containsKey(sectionId)) {
        throw new PromptException("Unknown section '" + sectionId + "' in prompt: " + id);
      }
      bindings.put(sectionId, vars == null ? Map.of() : new HashMap<>(vars));
      return this;
    }

    @Override
    public List<LlmClient.Message> renderMessages() {
      return sections.stream()
          .filter(s -> bindings.containsKey(s.id()))
          .map(s -> new LlmClient.Message(s.role(), render(s, bindings.get(s.id()))))
          .toList();
    }
  }
}
