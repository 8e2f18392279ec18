package org.openchami.ochami.config;

import java.util.List;
import java.util.Objects;
import org.openchami.ochami.config.tree.TreeValue;

/**
 * Result of configuration resolution: the typed configuration plus the merged tree it was materialized from
 * and the layers that contributed to it.
 *
 * <p>This handle replaces process-wide configuration state; create it once at startup and pass it to whatever
 * needs configuration.</p>
 *
 * @param config materialized configuration
 * @param tree merged tree before normalization; the accessor returns a copy
 * @param layers contributing layers, lowest precedence first
 * @since 0.1.0
 */
public record ResolvedConfig(OchamiConfig config, TreeValue.MapNode tree, List<ConfigSource> layers) {
  /**
   * Copies the tree and layer list.
   */
  public ResolvedConfig {
    Objects.requireNonNull(config, "config");
    tree = Objects.requireNonNull(tree, "tree").deepCopy();
    layers = List.copyOf(layers);
  }

  @Override
  public TreeValue.MapNode tree() {
    return tree.deepCopy();
  }

  /**
   * Picks the cluster to talk to: {@code name} when given, otherwise {@code default-cluster}.
   *
   * @param name cluster named on the command line, or {@code null}
   * @return selected cluster
   * @throws ConfigException with {@link ConfigErrorKind#CLUSTER_NOT_FOUND} when the cluster does not exist or
   *     no cluster was named and no default is set
   */
  public ClusterEntry selectCluster(String name) throws ConfigException {
    if (name != null && !name.isBlank()) {
      return config.cluster(name);
    }
    return config.defaultClusterEntry().orElseThrow(() -> new ConfigException(
        ConfigErrorKind.CLUSTER_NOT_FOUND, "no cluster specified and no default-cluster set"));
  }
}
