package io.xk6.prometheus.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Runtime log-level switches for the command-line entry point.
 * <p>Only the exporter's own loggers go to DEBUG under {@code --verbose}; the OpenTelemetry and gRPC stacks
 * keep the level from {@code logback.xml}.</p>
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String EXPORTER_LOGGER = "io.xk6.prometheus";

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the exporter's loggers to DEBUG. */
  public static void enableVerboseLogging() {
    setLevel(EXPORTER_LOGGER, "DEBUG");
  }

  /**
   * Sets the level of one logger.
   *
   * @param loggerName logger name, e.g. a package
   * @param level Logback level name; unknown names fall back to DEBUG
   * @return {@code true} when the backend supported the change
   */
  public static boolean setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot change level of {}: logging backend {} is not Logback",
          loggerName, factory.getClass().getName());
      return false;
    }
    Logger logger = context.getLogger(loggerName);
    Level target = Level.toLevel(level, Level.DEBUG);
    if (!target.equals(logger.getLevel())) {
      logger.setLevel(target);
      log.debug("Logger {} set to {}", loggerName, target);
    }
    return true;
  }
}
