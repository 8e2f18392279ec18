package org.openchami.ochami.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.openchami.ochami.validation.Strings;

/**
 * <strong>What:</strong> Connection settings for one cluster: base URI, authentication toggle, and
 * per-service endpoint overrides.
 * <p><strong>Role:</strong> Input to {@link org.openchami.ochami.endpoint.ServiceEndpointResolver}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param uri absolute cluster base URI ({@code scheme://host[:port][/path]}); {@code null} when unset
 * @param enableAuth whether requests carry an access token; {@code true} unless explicitly disabled
 * @param services per-service overrides; services without an override are absent
 * @since 0.1.0
 */
public record ClusterConfig(String uri, boolean enableAuth, Map<ServiceName, ServiceConfig> services) {
  /** Profile with no URIs and authentication enabled. */
  public static final ClusterConfig EMPTY = new ClusterConfig(null, true, Map.of());

  /**
   * Drops empty overrides and freezes the service map.
   */
  public ClusterConfig {
    uri = Strings.blankToNull(uri);
    EnumMap<ServiceName, ServiceConfig> copy = new EnumMap<>(ServiceName.class);
    if (services != null) {
      services.forEach((name, cfg) -> {
        if (name != null && cfg != null && !cfg.isEmpty()) {
          copy.put(name, cfg);
        }
      });
    }
    services = Collections.unmodifiableMap(copy);
  }

  /**
   * @param service service to look up
   * @return override for {@code service}, or {@link ServiceConfig#EMPTY}
   */
  public ServiceConfig service(ServiceName service) {
    return services.getOrDefault(service, ServiceConfig.EMPTY);
  }

  /**
   * Returns a copy with {@code service} replaced.
   *
   * @param service service to update
   * @param config new override; empty removes it
   * @return updated profile
   */
  public ClusterConfig withService(ServiceName service, ServiceConfig config) {
    EnumMap<ServiceName, ServiceConfig> copy = new EnumMap<>(ServiceName.class);
    copy.putAll(services);
    copy.put(service, config);
    return new ClusterConfig(uri, enableAuth, copy);
  }

  /**
   * Layers URI overrides (typically from command-line flags) over this profile.
   *
   * <p>Every URI set in {@code overrides} replaces the corresponding URI here; unset ones leave this profile's
   * value alone. {@code enableAuth} and API versions are kept from this profile.</p>
   *
   * @param overrides profile carrying the URIs to apply
   * @return merged profile
   */
  public ClusterConfig withUriOverrides(ClusterConfig overrides) {
    if (overrides == null) {
      return this;
    }
    EnumMap<ServiceName, ServiceConfig> merged = new EnumMap<>(ServiceName.class);
    for (ServiceName name : ServiceName.values()) {
      ServiceConfig current = service(name);
      String overrideUri = overrides.service(name).uri();
      merged.put(name, new ServiceConfig(
          overrideUri != null ? overrideUri : current.uri(), current.apiVersion()));
    }
    return new ClusterConfig(overrides.uri() != null ? overrides.uri() : uri, enableAuth, merged);
  }
}
