package com.memo.ontology.prompt;

/** Source of named prompt templates. */
public interface PromptRepository {

  /**
   * Loads the template with the given name, e.g. {@code "graph-rag"}.
   *
   * @throws com.memo.ontology.exception.PromptException when it is missing or malformed
   */
  PromptTemplate get(String name);
}
