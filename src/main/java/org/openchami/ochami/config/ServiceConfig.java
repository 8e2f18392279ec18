package org.openchami.ochami.config;

import org.openchami.ochami.validation.Strings;

/**
 * Per-service endpoint override inside a cluster profile.
 *
 * @param uri absolute URI or relative path for the service; {@code null} when unset
 * @param apiVersion API version, only meaningful for {@link ServiceName#BOOT_SERVICE}; {@code null} when unset
 * @since 0.1.0
 */
public record ServiceConfig(String uri, String apiVersion) {
  /** Override with nothing set. */
  public static final ServiceConfig EMPTY = new ServiceConfig(null, null);

  /**
   * Blank strings are stored as {@code null}.
   */
  public ServiceConfig {
    uri = Strings.blankToNull(uri);
    apiVersion = Strings.blankToNull(apiVersion);
  }

  /**
   * @param uri absolute URI or relative path
   * @return override carrying only a URI
   */
  public static ServiceConfig ofUri(String uri) {
    return new ServiceConfig(uri, null);
  }

  /**
   * @return {@code true} when no field is set
   */
  public boolean isEmpty() {
    return uri == null && apiVersion == null;
  }
}
