package org.openchami.ochami.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Locations of the optional system-wide and per-user configuration files.
 *
 * @param systemFile system-wide file
 * @param userFile per-user file
 * @since 0.1.0
 */
public record ConfigSearchPaths(Path systemFile, Path userFile) {
  /** System-wide configuration file. */
  public static final Path SYSTEM_CONFIG_FILE = Path.of("/etc/ochami/config.yaml");

  /**
   * Validates both paths.
   */
  public ConfigSearchPaths {
    Objects.requireNonNull(systemFile, "systemFile");
    Objects.requireNonNull(userFile, "userFile");
  }

  /**
   * Standard locations for the running process.
   *
   * @return search paths derived from {@code XDG_CONFIG_HOME} and {@code user.home}
   */
  public static ConfigSearchPaths defaults() {
    return fromEnvironment(System.getenv(), System.getProperty("user.home"));
  }

  /**
   * Derives the user file from an environment: {@code $XDG_CONFIG_HOME/ochami/config.yaml} when set,
   * otherwise {@code <home>/.config/ochami/config.yaml}.
   *
   * @param env environment variables
   * @param userHome home directory of the current user
   * @return search paths with the standard system file
   */
  public static ConfigSearchPaths fromEnvironment(Map<String, String> env, String userHome) {
    String xdg = env == null ? null : env.get("XDG_CONFIG_HOME");
    Path configHome = xdg != null && !xdg.isBlank()
        ? Path.of(xdg)
        : Path.of(Objects.requireNonNull(userHome, "userHome"), ".config");
    return new ConfigSearchPaths(SYSTEM_CONFIG_FILE, configHome.resolve("ochami").resolve("config.yaml"));
  }
}
