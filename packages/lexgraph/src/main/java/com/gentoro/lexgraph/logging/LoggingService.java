package com.gentoro.lexgraph.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger access for the pipeline, plus level overrides taken from the {@code logging.level}
 * section of the application configuration:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.lexgraph.reference: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  private static final String LEVELS = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Sets the level of every logger named under {@code logging.level}. Blank values and unknown
   * level names are skipped.
   *
   * @return the overrides that were applied, keyed by logger name
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null) return applied;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to Logback; ignoring {} overrides", LEVELS);
      return applied;
    }
    Configuration levels = cfg.subset(LEVELS);
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String key = keys.next();
      String raw = levels.getString(key, null);
      if (raw == null || raw.isBlank()) continue;
      Level level = Level.toLevel(raw.trim(), null);
      // dotted YAML keys come back from the hierarchical configuration with escaped dots
      String name = loggerName(key.replace("..", "."));
      if (level == null) {
        log.warn("Unknown log level '{}' for logger {}; ignored", raw, name);
        continue;
      }
      ctx.getLogger(name).setLevel(level);
      applied.put(name, level);
    }
    if (!applied.isEmpty()) {
      log.debug("Applied log levels {}", applied);
    }
    return applied;
  }

  private static String loggerName(String key) {
    return "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
  }
}
