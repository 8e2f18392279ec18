package org.openchami.ochami.config;

import java.util.Objects;
import org.openchami.ochami.validation.Strings;

/**
 * Named cluster profile as stored in the {@code clusters} list.
 *
 * @param name unique cluster name used by {@code default-cluster} and {@code --cluster}
 * @param cluster profile contents
 * @since 0.1.0
 */
public record ClusterEntry(String name, ClusterConfig cluster) {
  /**
   * Validates the name and substitutes an empty profile for {@code null}.
   */
  public ClusterEntry {
    name = Strings.requireNonBlank("cluster name", name);
    cluster = Objects.requireNonNullElse(cluster, ClusterConfig.EMPTY);
  }
}
