package com.memo.ontology;

import com.memo.ontology.exception.ConfigException;
import com.memo.ontology.exception.SerializationException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the engine's YAML configuration.
 *
 * <p>A location is either {@code classpath:some/path.yaml} or a filesystem path / {@code file:}
 * URI. Anything other than the bundled {@code application.yaml} is layered over it, so a
 * deployment file only has to name the keys it changes. Values may reference environment
 * variables as {@code ${env:NAME}}; unset variables are looked up in {@code .env.local} in the
 * working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH = "classpath:";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    Configuration requested = load(loc);
    if (DEFAULT_LOCATION.equals(loc)) {
      this.configuration = requested;
    } else {
      CompositeConfiguration layered = new CompositeConfiguration();
      layered.addConfiguration(requested);
      layered.addConfiguration(load(DEFAULT_LOCATION));
      this.configuration = withEnvLookup(layered);
    }
  }

  public Configuration config() {
    return configuration;
  }

  /** Parses YAML text directly, without the bundled defaults. */
  public static Configuration fromYaml(String yamlContent) {
    YAMLConfiguration config = new YAMLConfiguration();
    try {
      config.read(new StringReader(yamlContent));
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to parse YAML configuration", e);
    }
    return withEnvLookup(config);
  }

  private static Configuration load(String loc) {
    if (loc.startsWith(CLASSPATH)) {
      return fromClasspath(loc.substring(CLASSPATH.length()));
    }
    File file;
    try {
      URI uri = URI.create(loc);
      file = "file".equalsIgnoreCase(uri.getScheme()) ? new File(uri) : new File(loc);
    } catch (IllegalArgumentException notAUri) {
      log.debug("'{}' is not a URI, treating it as a file path", loc);
      file = new File(loc);
    }
    return fromFile(file);
  }

  private static Configuration fromClasspath(String resourceName) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    URL url = cl.getResource(resourceName);
    if (url == null) {
      log.warn("Configuration resource '{}' not found on classpath; using defaults", resourceName);
      return withEnvLookup(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = url.openStream()) {
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(new String(input.readAllBytes(), StandardCharsets.UTF_8)));
      return withEnvLookup(config);
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      return withEnvLookup(
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file))
              .getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static <C extends Configuration> C withEnvLookup(C config) {
    config.getInterpolator().registerLookup("env", new EnvLookup(Path.of(".env.local")));
    return config;
  }

  /** Process environment first, then a dotenv-style file read once on first miss. */
  private static final class EnvLookup implements Lookup {
    private final Path dotEnv;
    private volatile Map<String, String> fallback;

    private EnvLookup(Path dotEnv) {
      this.dotEnv = dotEnv;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) return value;
      Map<String, String> local = fallback;
      if (local == null) {
        synchronized (this) {
          if (fallback == null) fallback = readDotEnv(dotEnv);
          local = fallback;
        }
      }
      return local.get(key);
    }
  }

  static Map<String, String> readDotEnv(Path path) {
    if (!Files.isRegularFile(path)) {
      log.debug("No {} found in {}", path.getFileName(), path.toAbsolutePath().getParent());
      return Map.of();
    }
    try {
      List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
      return lines.stream()
          .map(String::trim)
          .filter(line -> !line.isEmpty() && !line.startsWith("#") && line.indexOf('=') > 0)
          .collect(
              Collectors.toMap(
                  line -> line.substring(0, line.indexOf('=')).trim(),
                  line -> unquote(line.substring(line.indexOf('=') + 1).trim()),
                  (first, second) -> second));
    } catch (IOException e) {
      log.warn("Could not read {}: {}", path, e.getMessage());
      return Map.of();
    }
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char q = value.charAt(0);
      if ((q == '"' || q == '\'') && value.charAt(value.length() - 1) == q) {
        return value.substring(1, value.length() - 1);
      }
    }
    return value;
  }
}
