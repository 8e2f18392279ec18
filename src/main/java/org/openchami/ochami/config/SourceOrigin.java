package org.openchami.ochami.config;

/**
 * Where a configuration layer came from, lowest cascade precedence first.
 *
 * @since 0.1.0
 */
public enum SourceOrigin {
  /** Values compiled into the client. */
  DEFAULT,
  /** System-wide file, {@code /etc/ochami/config.yaml}. */
  SYSTEM_FILE,
  /** Per-user file under the user's configuration directory. */
  USER_FILE,
  /** File named explicitly by the caller; bypasses the cascade. */
  EXPLICIT_FILE
}
