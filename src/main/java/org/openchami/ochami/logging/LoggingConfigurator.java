package org.openchami.ochami.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.openchami.ochami.config.LogConfig;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies the resolved {@code log} settings to the running logging backend.
 * <p><strong>Why:</strong> The {@code log.level} key only takes effect once configuration has been resolved,
 * after Logback has already initialized from the embedding application's configuration.</p>
 * <p><strong>Role:</strong> Adapter between {@link LogConfig} and Logback.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 * <p><strong>Observability:</strong> Emits SLF4J warnings when dynamic configuration is unsupported.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the root logger level from {@code config.level()}. An unset level leaves the backend untouched.
   *
   * @param config resolved log settings
   * @return {@code true} when the root level was changed
   * @throws IllegalArgumentException when the level is not one of {@code debug}, {@code info},
   *     {@code warning}, {@code error}
   */
  public static boolean apply(LogConfig config) {
    if (config == null || config.level() == null) {
      return false;
    }
    return setRootLevel(toLevel(config.level()));
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Maps a configured level name onto a Logback level.
   *
   * @param level level name, case-insensitive
   * @return matching Logback level
   * @throws IllegalArgumentException for unknown names
   */
  public static Level toLevel(String level) {
    return switch (level.trim().toLowerCase(Locale.ROOT)) {
      case "debug" -> Level.DEBUG;
      case "info" -> Level.INFO;
      case "warning", "warn" -> Level.WARN;
      case "error" -> Level.ERROR;
      default -> throw new IllegalArgumentException(
          "unknown log level \"" + level + "\" (expected debug, info, warning, or error)");
    };
  }

  private static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (level.equals(root.getLevel())) {
        return false;
      }
      root.setLevel(level);
      return true;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
