package com.memo.ontology;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  @DisplayName("Bundled application.yaml carries the engine defaults")
  void classpathDefaults() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();

    assertEquals("orientdb", cfg.getString("memo.store.driver"));
    assertEquals("plocal", cfg.getString("memo.store.orientdb.mode"));
    assertEquals(1536, cfg.getInt("memo.embedding.dimensions"));
    assertEquals(0.4, cfg.getDouble("memo.rag.threshold"));
    assertEquals("classpath:prompts", cfg.getString("prompt.location"));
  }

  @Test
  @DisplayName("A missing classpath resource leaves only the bundled defaults")
  void missingClasspathResource() {
    Configuration cfg = new ConfigurationProvider("classpath:nope.yaml").config();
    assertEquals(3, cfg.getInt("memo.similar.topK"));
  }

  @Test
  @DisplayName("Deployment files from paths and file: URIs override the bundled defaults")
  void fileLocations(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("memo.yaml");
    Files.writeString(file, "memo:\n  similar:\n    topK: 7\n");

    Configuration fromPath = new ConfigurationProvider(file.toString()).config();
    assertEquals(7, fromPath.getInt("memo.similar.topK"));
    assertEquals(0.5, fromPath.getDouble("memo.similar.threshold"));
    assertEquals(
        7, new ConfigurationProvider(file.toUri().toString()).config().getInt("memo.similar.topK"));
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  @DisplayName(".env.local style files are parsed with quotes and comments")
  void dotEnv(@TempDir Path dir) throws Exception {
    Path env = dir.resolve(".env.local");
    Files.writeString(env, "# keys\nOPENAI_API_KEY=\"sk-test\"\nEMPTY=\nbroken line\nA = 'b'\n");

    assertEquals(
        Map.of("OPENAI_API_KEY", "sk-test", "EMPTY", "", "A", "b"),
        ConfigurationProvider.readDotEnv(env));
    assertTrue(ConfigurationProvider.readDotEnv(dir.resolve("missing")).isEmpty());
  }

  @Test
  @DisplayName("Invalid YAML is a configuration error")
  void invalidYaml() {
    assertThrows(ConfigException.class, () -> ConfigurationProvider.fromYaml("a: [unclosed"));
  }
}
