package com.memo.ontology.prompt;

import com.memo.ontology.exception.ConfigException;
import com.memo.ontology.prompt.impl.ClasspathPromptRepository;
import com.memo.ontology.prompt.impl.FileSystemPromptRepository;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

public class PromptRepositoryFactory {
  public static final String DEFAULT_LOCATION = "classpath:prompts";

  private PromptRepositoryFactory() {}

  /**
   * Create a PromptRepository from the "prompt" namespace of the application configuration.
   * {@code prompt.location} is either "classpath:prompts" or a filesystem directory ("file:/abs"
   * or a plain path), letting deployments override the bundled prompts.
   */
  public static PromptRepository create(Configuration configuration) {
    String location = configuration.getString("prompt.location", DEFAULT_LOCATION).trim();

    if (location.startsWith("classpath:")) {
      String base = location.substring("classpath:".length());
      if (base.startsWith("/")) base = base.substring(1);
      if (base.isBlank()) {
        throw new ConfigException("Invalid prompt.location: classpath base path is empty");
      }
      return new ClasspathPromptRepository(base);
    }

    Path basePath;
    try {
      basePath = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException iae) {
      throw new ConfigException("Invalid prompt location URI/path: " + location, iae);
    }
    if (!Files.isDirectory(basePath)) {
      throw new ConfigException("Prompt storage path is not a directory: " + basePath);
    }
    return new FileSystemPromptRepository(basePath);
  }
}
