package com.gentoro.medigraph.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels can be overridden from {@code application.yaml} using
 * keys of the form {@code logging.level.<logger-name>: DEBUG}; {@code logging.level.root} targets
 * the root logger.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply per-logger level overrides. Unknown level names fall back to the logger's current level
   * (Logback semantics of {@link Level#toLevel(String, Level)}).
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext)) {
      getLogger(LoggingService.class)
          .debug("Logging backend is not Logback; skipping level configuration");
      return;
    }
    LoggerContext context = (LoggerContext) factory;
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;
      // Hierarchical configurations escape dots inside a single key as ".."
      String unescaped = name.replace("..", ".");
      String loggerName =
          "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      ch.qos.logback.classic.Logger logger = context.getLogger(loggerName);
      logger.setLevel(Level.toLevel(value.trim(), logger.getLevel()));
    }
  }
}
