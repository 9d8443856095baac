package com.gentoro.verifier.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying logger levels declared in the application
 * configuration.
 *
 * <p>Levels are read from keys shaped as {@code logging.level.<logger-name>}, e.g. {@code
 * logging.level.com.gentoro.verifier.chain=DEBUG}. The special name {@code root} addresses the root
 * logger.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries to Logback. Unknown level names fall back to INFO. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .warn("Logback is not the active SLF4J binding, logging levels were not applied");
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;
      // hierarchical configurations escape dots inside a single key segment by doubling them
      String unescaped = name.replace("..", ".");
      String loggerName = "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }
  }
}
