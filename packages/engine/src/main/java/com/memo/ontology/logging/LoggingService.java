package com.memo.ontology.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup for the engine, plus level overrides read from the {@code logging.level} block of
 * the YAML configuration. Keys are {@code root} or any logger name.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Applies {@code logging.level.*} overrides to Logback.
   *
   * @return logger name to the level that was set; entries with unknown levels are skipped
   */
  public static Map<String, String> applyConfiguration(Configuration cfg) {
    Map<String, String> applied = new LinkedHashMap<>();
    if (cfg == null) return applied;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J backend is not Logback; logging.level overrides ignored");
      return applied;
    }

    Configuration levels = cfg.subset("logging.level");
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String key = keys.next();
      Level level = Level.toLevel(levels.getString(key, "").trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for '{}', ignoring", levels.getString(key), key);
        continue;
      }
      // dotted YAML keys come back with the delimiter escaped as ".."
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key.replace("..", ".");
      ctx.getLogger(name).setLevel(level);
      applied.put(name, level.toString());
    }
    log.debug("Applied log levels {}", applied);
    return applied;
  }
}
