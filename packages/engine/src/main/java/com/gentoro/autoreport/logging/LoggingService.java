package com.gentoro.autoreport.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be overridden from the application configuration using keys of the form {@code
 * logging.level.root} and {@code logging.level.<logger-name>}.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply logging levels declared in the configuration. Unknown level names are ignored and the
   * logger keeps its current level.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      // Not running on logback, nothing to adjust.
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key);
      if (value == null || value.isBlank()) {
        continue;
      }
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class).warn("Ignoring unknown log level '{}' for {}", value, key);
        continue;
      }
      // hierarchical configurations escape dots inside keys by doubling them
      String name = key.replace("..", ".");
      String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
