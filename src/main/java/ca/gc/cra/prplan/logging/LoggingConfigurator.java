package ca.gc.cra.prplan.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for the {@code --verbose} flag.
 * <p><strong>Why:</strong> Per-target progress and discovery listings are DEBUG output and only shown on request.</p>
 * <p><strong>Thread-safety:</strong> Call once during CLI startup, before group threads exist.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configured level and log a warning.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Raises the root logger to DEBUG.
   *
   * @return {@code true} if the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setRootLevel(Level.DEBUG);
  }

  /**
   * Restores the root logger to INFO.
   *
   * @return {@code true} if the backend accepted the change
   */
  public static boolean resetLogging() {
    return setRootLevel(Level.INFO);
  }

  private static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change to {} requested but backend {} does not support it",
        level, factory.getClass().getName());
    return false;
  }
}
