package org.openchami.ochami.config;

import java.util.Locale;
import java.util.Optional;

/**
 * OpenCHAMI services a cluster profile can carry an endpoint override for.
 *
 * @since 0.1.0
 */
public enum ServiceName {
  /** Boot service. */
  BOOT_SERVICE("boot-service", "/boot"),
  /** Boot Script Service. */
  BSS("bss", "/boot/v1"),
  /** cloud-init metadata service. */
  CLOUD_INIT("cloud-init", "/cloud-init"),
  /** Power Control Service. */
  PCS("pcs", "/"),
  /** State Management Database. */
  SMD("smd", "/hsm/v2");

  private final String key;
  private final String defaultBasePath;

  ServiceName(String key, String defaultBasePath) {
    this.key = key;
    this.defaultBasePath = defaultBasePath;
  }

  /**
   * @return YAML key of the service block inside {@code cluster}
   */
  public String key() {
    return key;
  }

  /**
   * @return path appended to the cluster URI when the service has no URI of its own
   */
  public String defaultBasePath() {
    return defaultBasePath;
  }

  /**
   * @return {@code true} when the service block also accepts {@code api-version}
   */
  public boolean hasApiVersion() {
    return this == BOOT_SERVICE;
  }

  /**
   * Looks up a service by YAML key; underscores are accepted in place of hyphens.
   *
   * @param name service name such as {@code bss} or {@code cloud-init}
   * @return matching service, or empty when unknown
   */
  public static Optional<ServiceName> fromKey(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (ServiceName service : values()) {
      if (service.key.equals(normalized)) {
        return Optional.of(service);
      }
    }
    return Optional.empty();
  }
}
