package com.gentoro.batchinfer.logging;

import ch.qos.logback.classic.Level;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying logger levels from {@code
 * application.yaml}.
 *
 * <p>Supported keys:
 *
 * <ul>
 *   <li>{@code logging.root} - level of the root logger
 *   <li>{@code logging.levels} - list of {@code {logger, level}} entries
 * </ul>
 */
public final class LoggingService {
  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;

    String root = configuration.getString("logging.root", null);
    if (root != null && !root.isBlank()) {
      setLevel(Logger.ROOT_LOGGER_NAME, root);
    }

    List<Object> loggers = configuration.getList("logging.levels.logger");
    List<Object> levels = configuration.getList("logging.levels.level");
    if (loggers.size() != levels.size()) {
      getLogger(LoggingService.class)
          .warn(
              "Ignoring logging.levels: {} logger names but {} levels",
              loggers.size(),
              levels.size());
      return;
    }
    for (int i = 0; i < loggers.size(); i++) {
      setLevel(String.valueOf(loggers.get(i)), String.valueOf(levels.get(i)));
    }
  }

  /** Set the level of a named logger when Logback is the bound SLF4J backend; no-op otherwise. */
  public static void setLevel(String loggerName, String level) {
    Logger logger = LoggerFactory.getLogger(loggerName);
    if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
      logbackLogger.setLevel(Level.toLevel(level.trim(), Level.INFO));
    }
  }
}
