package com.memo.ontology.prompt;

import com.memo.ontology.model.LlmClient;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named prompt made of role-tagged sections. Sections declared {@code enabled: false} stay out
 * of the rendered conversation until a session enables them.
 */
public interface PromptTemplate {
  /** File name without extension, e.g. "extract-graph". */
  String id();

  List<PromptSection> sections();

  default Optional<PromptSection> section(String sectionId) {
    return sections().stream().filter(s -> s.id().equals(sectionId)).findFirst();
  }

  PromptSession newSession();

  record PromptSection(LlmClient.Role role, String id, boolean enabledByDefault, String content) {}

  /** Variables bound for one rendering. Not thread-safe; create one per call. */
  interface PromptSession {
    /**
     * Includes the section and binds its variables.
     *
     * @throws com.memo.ontology.exception.PromptException when the template has no such section
     */
    PromptSession enable(String sectionId, Map<String, Object> vars);

    /** Enabled sections in declaration order, one message each. */
    List<LlmClient.Message> renderMessages();
  }
}
