package org.openchami.ochami.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.openchami.ochami.validation.Strings;

/**
 * <strong>What:</strong> Materialized client configuration.
 * <p><strong>Why:</strong> Gives the CLI layer and HTTP client a validated, typed view after the cascade or a
 * single-file load.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param log logging section
 * @param timeout HTTP request timeout; {@code null} when unset
 * @param defaultCluster cluster used when none is named on the command line; {@code null} when unset
 * @param clusters cluster profiles in file order, names unique
 * @since 0.1.0
 */
public record OchamiConfig(
    LogConfig log, Duration timeout, String defaultCluster, List<ClusterEntry> clusters) {

  /**
   * Substitutes empty values for {@code null} sections and freezes the cluster list.
   */
  public OchamiConfig {
    log = Objects.requireNonNullElse(log, LogConfig.EMPTY);
    defaultCluster = Strings.blankToNull(defaultCluster);
    clusters = clusters == null ? List.of() : List.copyOf(clusters);
  }

  /**
   * Built-in values used as the lowest cascade layer.
   *
   * @return default configuration
   */
  public static OchamiConfig defaults() {
    return new OchamiConfig(new LogConfig("rfc3339", "warning"), Duration.ofSeconds(30), null, List.of());
  }

  /**
   * @param name cluster name
   * @return matching cluster entry
   * @throws ConfigException with {@link ConfigErrorKind#CLUSTER_NOT_FOUND} when no cluster has {@code name}
   */
  public ClusterEntry cluster(String name) throws ConfigException {
    return findCluster(name).orElseThrow(() -> new ConfigException(
        ConfigErrorKind.CLUSTER_NOT_FOUND, "cluster " + name + " not found"));
  }

  /**
   * @param name cluster name
   * @return matching cluster entry, if any
   */
  public Optional<ClusterEntry> findCluster(String name) {
    for (ClusterEntry entry : clusters) {
      if (entry.name().equals(name)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the cluster named by {@code default-cluster}.
   *
   * @return default cluster, or empty when {@code default-cluster} is unset
   * @throws ConfigException with {@link ConfigErrorKind#CLUSTER_NOT_FOUND} when it names a missing cluster
   */
  public Optional<ClusterEntry> defaultClusterEntry() throws ConfigException {
    if (defaultCluster == null) {
      return Optional.empty();
    }
    return Optional.of(cluster(defaultCluster));
  }

  /**
   * @param defaultCluster new default cluster name, or {@code null} to clear it
   * @return copy with {@code default-cluster} replaced
   */
  public OchamiConfig withDefaultCluster(String defaultCluster) {
    return new OchamiConfig(log, timeout, defaultCluster, clusters);
  }

  /**
   * @param clusters new cluster list
   * @return copy with the cluster list replaced
   */
  public OchamiConfig withClusters(List<ClusterEntry> clusters) {
    return new OchamiConfig(log, timeout, defaultCluster, new ArrayList<>(clusters));
  }
}
