package org.openchami.ochami.config;

import org.openchami.ochami.validation.Strings;

/**
 * Logging section of the configuration.
 *
 * @param format log message format ({@code json}, {@code rfc3339}, {@code basic}); {@code null} when unset
 * @param level log verbosity ({@code debug}, {@code info}, {@code warning}, {@code error}); {@code null} when unset
 * @since 0.1.0
 */
public record LogConfig(String format, String level) {
  /** Section with nothing set. */
  public static final LogConfig EMPTY = new LogConfig(null, null);

  /**
   * Blank strings are stored as {@code null}.
   */
  public LogConfig {
    format = Strings.blankToNull(format);
    level = Strings.blankToNull(level);
  }
}
