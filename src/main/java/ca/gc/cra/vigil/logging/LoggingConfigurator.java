package ca.gc.cra.vigil.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Switches the Logback root level for the {@code --verbose} CLI flag.
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI bootstrap.</p>
 * <p><strong>Observability:</strong> Warns when the SLF4J backend is not Logback.</p>
 *
 * @implNote Other SLF4J bindings keep their configured levels.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to DEBUG so per-line batch outcomes and option merging become visible.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
