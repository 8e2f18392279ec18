package org.openchami.ochami.endpoint;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.openchami.ochami.config.ClusterConfig;
import org.openchami.ochami.config.ConfigErrorKind;
import org.openchami.ochami.config.ConfigException;
import org.openchami.ochami.config.ServiceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes the base URI of a cluster service from a cluster profile.
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>An absolute service {@code uri} is used as is.</li>
 *   <li>A relative service {@code uri} is joined onto the cluster {@code uri} path.</li>
 *   <li>With no service {@code uri}, the service's default base path is joined onto the cluster {@code uri}.</li>
 * </ul>
 * <p>Joining cleans the combined path ({@code //}, {@code .}, {@code ..}) and keeps a trailing slash when the
 * joined element ends with one, so {@code https://x/api} joined with {@code /} is {@code https://x/api/}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ServiceEndpointResolver {
  private static final Logger log = LoggerFactory.getLogger(ServiceEndpointResolver.class);

  private ServiceEndpointResolver() {
    // Utility
  }

  /**
   * Resolves the base URI of the service named {@code serviceKey}.
   *
   * @param cluster cluster profile
   * @param serviceKey service key such as {@code bss} or {@code cloud-init}
   * @return absolute base URI
   * @throws ConfigException with {@link ConfigErrorKind#UNKNOWN_SERVICE} for an unrecognized key, or any
   *     failure of {@link #resolve(ClusterConfig, ServiceName)}
   */
  public static String resolve(ClusterConfig cluster, String serviceKey) throws ConfigException {
    Objects.requireNonNull(cluster, "cluster");
    parseClusterUri(cluster.uri());
    ServiceName service = ServiceName.fromKey(serviceKey)
        .orElseThrow(() -> new ConfigException(ConfigErrorKind.UNKNOWN_SERVICE,
            "unknown service \"" + serviceKey + "\""));
    return resolve(cluster, service);
  }

  /**
   * Resolves the base URI of {@code service}.
   *
   * @param cluster cluster profile
   * @param service service to resolve
   * @return absolute base URI
   * @throws ConfigException with {@link ConfigErrorKind#INVALID_CLUSTER_URI},
   *     {@link ConfigErrorKind#MISSING_URI}, or {@link ConfigErrorKind#INVALID_SERVICE_URI}
   */
  public static String resolve(ClusterConfig cluster, ServiceName service) throws ConfigException {
    Objects.requireNonNull(cluster, "cluster");
    Objects.requireNonNull(service, "service");
    URI clusterUri = parseClusterUri(cluster.uri());
    String serviceUri = cluster.service(service).uri();
    if (clusterUri == null && serviceUri == null) {
      throw new ConfigException(ConfigErrorKind.MISSING_URI,
          "no URI configured for " + service.key() + ": set cluster.uri or cluster." + service.key() + ".uri");
    }

    String raw = serviceUri != null ? serviceUri : service.defaultBasePath();
    URI parsed;
    try {
      parsed = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new ConfigException(ConfigErrorKind.INVALID_SERVICE_URI,
          "invalid " + service.key() + " URI \"" + raw + "\": " + ex.getMessage(), ex);
    }

    String resolved;
    if (parsed.isAbsolute()) {
      if (parsed.isOpaque()) {
        throw invalidService(service, "unknown URI format (must be \"/path\" or \"proto://host[:port][/path]\")");
      }
      resolved = parsed.toString();
    } else if (parsed.getRawPath() != null && !parsed.getRawPath().isEmpty()) {
      if (clusterUri == null) {
        throw invalidService(service, service.key() + ".uri is a relative path but cluster.uri not set");
      }
      resolved = join(clusterUri, parsed.getRawPath());
    } else {
      throw invalidService(service, service.key() + ".uri is neither an absolute URI nor has a path component");
    }
    log.debug("Resolved {} base URI to {}", service.key(), resolved);
    return resolved;
  }

  private static URI parseClusterUri(String uri) throws ConfigException {
    if (uri == null) {
      return null;
    }
    URI parsed;
    try {
      parsed = new URI(uri);
    } catch (URISyntaxException ex) {
      throw new ConfigException(ConfigErrorKind.INVALID_CLUSTER_URI,
          "invalid cluster URI \"" + uri + "\": " + ex.getMessage(), ex);
    }
    if (parsed.isOpaque() || parsed.getScheme() == null || parsed.getRawAuthority() == null) {
      throw new ConfigException(ConfigErrorKind.INVALID_CLUSTER_URI,
          "invalid cluster URI \"" + uri + "\": unknown URI format (must be \"proto://host[:port][/path]\")");
    }
    return parsed;
  }

  private static ConfigException invalidService(ServiceName service, String reason) {
    return new ConfigException(ConfigErrorKind.INVALID_SERVICE_URI,
        "invalid " + service.key() + " URI: " + reason);
  }

  static String join(URI base, String element) {
    String basePath = base.getRawPath() == null ? "" : base.getRawPath();
    String path = cleanPath(basePath + "/" + element);
    if (element.endsWith("/") && !path.endsWith("/")) {
      path = path + "/";
    }
    StringBuilder out = new StringBuilder()
        .append(base.getScheme()).append("://").append(base.getRawAuthority()).append(path);
    if (base.getRawQuery() != null) {
      out.append('?').append(base.getRawQuery());
    }
    if (base.getRawFragment() != null) {
      out.append('#').append(base.getRawFragment());
    }
    return out.toString();
  }

  static String cleanPath(String path) {
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : path.split("/")) {
      if (segment.isEmpty() || ".".equals(segment)) {
        continue;
      }
      if ("..".equals(segment)) {
        segments.pollLast();
      } else {
        segments.addLast(segment);
      }
    }
    return "/" + String.join("/", segments);
  }
}
