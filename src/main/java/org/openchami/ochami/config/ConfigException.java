package org.openchami.ochami.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Checked exception raised when configuration cannot be loaded, merged, modified, or resolved.
 *
 * <p>Carries the {@link ConfigErrorKind} plus whatever location was known at the failure site.</p>
 *
 * @since 0.1.0
 */
public final class ConfigException extends Exception {
  private final ConfigErrorKind kind;
  private final transient Path file;
  private final String key;
  private final int line;

  private ConfigException(
      ConfigErrorKind kind, String message, Path file, String key, int line, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.file = file;
    this.key = key;
    this.line = line;
  }

  /**
   * Creates an exception with no file or key context.
   *
   * @param kind failure category
   * @param message human-readable error
   */
  public ConfigException(ConfigErrorKind kind, String message) {
    this(kind, message, null, null, -1, null);
  }

  /**
   * Creates an exception with an underlying cause.
   *
   * @param kind failure category
   * @param message human-readable error
   * @param cause root cause
   */
  public ConfigException(ConfigErrorKind kind, String message, Throwable cause) {
    this(kind, message, null, null, -1, cause);
  }

  /**
   * Creates an exception that names the offending key.
   *
   * @param kind failure category
   * @param key dotted key path
   * @param message human-readable error
   * @return new exception
   */
  public static ConfigException forKey(ConfigErrorKind kind, String key, String message) {
    return new ConfigException(kind, message, null, key, -1, null);
  }

  /**
   * Creates an exception that names a key and the YAML line it was found on.
   *
   * @param kind failure category
   * @param key dotted key path
   * @param line 1-based line number
   * @param message human-readable error
   * @return new exception
   */
  public static ConfigException atLine(ConfigErrorKind kind, String key, int line, String message) {
    return new ConfigException(kind, "line " + line + ": " + message, null, key, line, null);
  }

  /**
   * Returns a copy of this exception attributed to {@code source}, keeping kind, key, and line.
   *
   * @param source file the failure came from
   * @return exception whose message is prefixed with the file
   */
  public ConfigException inFile(Path source) {
    return inFile(source, -1);
  }

  /**
   * Returns a copy of this exception attributed to {@code source} and, when this exception has no line yet,
   * to {@code sourceLine}.
   *
   * @param source file the failure came from
   * @param sourceLine 1-based line of the offending key, or {@code -1} when unknown
   * @return exception whose message is prefixed with the file and line
   */
  public ConfigException inFile(Path source, int sourceLine) {
    if (source == null || file != null) {
      return this;
    }
    if (line > 0 || sourceLine <= 0) {
      return new ConfigException(kind, source + ": " + getMessage(), source, key, line, this);
    }
    return new ConfigException(
        kind, source + ":" + sourceLine + ": " + getMessage(), source, key, sourceLine, this);
  }

  /**
   * @return failure category
   */
  public ConfigErrorKind kind() {
    return kind;
  }

  /**
   * @return file the failure is attributed to, when known
   */
  public Optional<Path> file() {
    return Optional.ofNullable(file);
  }

  /**
   * @return dotted key the failure concerns, when known
   */
  public Optional<String> key() {
    return Optional.ofNullable(key);
  }

  /**
   * @return 1-based YAML line, or {@code -1} when unknown
   */
  public int line() {
    return line;
  }
}
