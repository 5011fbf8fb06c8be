package ca.gc.cra.hap.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts logging verbosity from CLI flags.
 *
 * <p>Only Logback supports the runtime change; other SLF4J bindings keep their configured levels and a
 * warning is logged.</p>
 *
 * @since 0.3.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String PROTOCOL_LOGGER = "ca.gc.cra.hap";

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root and protocol loggers to DEBUG for {@code --verbose}. */
  public static void enableVerboseLogging() {
    setLevel(Level.DEBUG);
  }

  /** Lowers the protocol loggers to WARN so command output stays clean for {@code --quiet}. */
  public static void enableQuietLogging() {
    setLevel(Level.WARN);
  }

  private static void setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      root.setLevel(level);
      context.getLogger(PROTOCOL_LOGGER).setLevel(level);
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
