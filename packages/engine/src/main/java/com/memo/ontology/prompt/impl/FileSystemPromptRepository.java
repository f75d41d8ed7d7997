package com.memo.ontology.prompt.impl;

import com.memo.ontology.exception.ExceptionUtil;
import com.memo.ontology.exception.NotFoundException;
import com.memo.ontology.exception.PromptException;
import com.memo.ontology.prompt.PromptRepository;
import com.memo.ontology.prompt.PromptTemplate;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads prompt YAML files from a directory on every lookup, so edits apply without restart. */
public class FileSystemPromptRepository implements PromptRepository {
  private final Path path;

  public FileSystemPromptRepository(Path path) {
    this.path = path;
  }

  @Override
  public PromptTemplate get(String name) {
    String id = (name.charAt(0) == '/' ? name.substring(1) : name);
    try {
      Path yamlPath = resolveExisting(id);
      if (yamlPath == null) {
        throw new NotFoundException("Prompt not found: " + name + " in " + path);
      }
      return PromptYaml.parse(id, Files.readString(yamlPath));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + name, ex));
    }
  }

  private Path resolveExisting(String id) {
    Path yaml = path.resolve(id + ".yaml");
    if (Files.isRegularFile(yaml)) return yaml;
    Path yml = path.resolve(id + ".yml");
    if (Files.isRegularFile(yml)) return yml;
    return null;
  }
}
