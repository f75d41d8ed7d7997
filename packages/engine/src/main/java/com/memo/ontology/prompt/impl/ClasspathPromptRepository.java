package com.memo.ontology.prompt.impl;

import com.memo.ontology.exception.ExceptionUtil;
import com.memo.ontology.exception.NotFoundException;
import com.memo.ontology.exception.PromptException;
import com.memo.ontology.prompt.PromptRepository;
import com.memo.ontology.prompt.PromptTemplate;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt YAML templates from the classpath starting at a base directory. Example basePath:
 * "prompts" (will resolve resources like "prompts/graph-rag.yaml"). Parsed templates are cached.
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    String id = (name.charAt(0) == '/' ? name.substring(1) : name);
    return cache.computeIfAbsent(id, this::load);
  }

  private PromptTemplate load(String id) {
    try {
      String resource = resolveExisting(id);
      if (resource == null) {
        throw new NotFoundException("Prompt not found on classpath: " + id);
      }
      String yamlContent;
      try (InputStream is = classLoader.getResourceAsStream(resource)) {
        if (is == null) {
          throw new NotFoundException("Prompt resource not found: " + resource);
        }
        yamlContent = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      }
      return PromptYaml.parse(id, yamlContent);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + id, ex));
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
