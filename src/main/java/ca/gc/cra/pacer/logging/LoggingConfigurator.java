package ca.gc.cra.pacer.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures PACER runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Allows operators to raise verbosity, or silence the periodic governor log lines, without
 * editing {@code logback.xml}.
 * <p><strong>Role:</strong> Adapter-side utility that bridges CLI flags to the logging backend.
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 * <p><strong>Observability:</strong> Emits SLF4J warnings when dynamic configuration is unsupported.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger name, or {@link org.slf4j.Logger#ROOT_LOGGER_NAME}
   * @param level level name such as {@code INFO} or {@code WARN}
   * @throws IllegalArgumentException when {@code level} is not a Logback level name
   */
  public static void setLevel(String loggerName, String level) {
    Level parsed = Level.toLevel(level == null ? "" : level.trim().toUpperCase(Locale.ROOT), null);
    if (parsed == null) {
      throw new IllegalArgumentException("unknown log level: " + level);
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      if (!parsed.equals(target.getLevel())) {
        target.setLevel(parsed);
      }
      return;
    }
    log.warn("Log level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
  }
}
