package org.openchami.ochami.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.openchami.ochami.config.tree.TreePath;
import org.openchami.ochami.config.tree.TreeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Dotted-key reads and edits against a single configuration file.
 * <p><strong>How:</strong> Every edit reads the file fresh, without cascading, and applies one change to its
 * tree. The result must pass strict validation before the whole file is rewritten; nothing is written on
 * failure.</p>
 * <p><strong>Scope:</strong> Global keys ({@code log.level}, {@code default-cluster}, ...) go through
 * {@link #get}, {@link #set}, and {@link #unset}. Cluster keys are relative to one cluster entry
 * ({@code name}, {@code cluster.uri}, {@code cluster.bss.uri}) and go through the cluster variants.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent edits of the same file are last-writer-wins.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMutator {
  private static final Logger log = LoggerFactory.getLogger(ConfigMutator.class);

  private ConfigMutator() {}

  /**
   * Reads a global key from a configuration.
   *
   * @param config configuration to read
   * @param key dotted key; blank returns the whole configuration tree
   * @return value at the key, or empty when unset
   * @throws ConfigException with {@link ConfigErrorKind#INVALID_KEY} when the key addresses an individual
   *     cluster
   */
  public static Optional<TreeValue> get(OchamiConfig config, String key) throws ConfigException {
    Objects.requireNonNull(config, "config");
    if (key != null && key.startsWith(ConfigSchema.CLUSTERS) && key.length() > ConfigSchema.CLUSTERS.length()) {
      throw ConfigException.forKey(ConfigErrorKind.INVALID_KEY, key,
          "cannot get individual cluster config with a global key; use the cluster variant");
    }
    return Optional.ofNullable(TreePath.get(ConfigSchema.toTree(config), key));
  }

  /**
   * Reads a global key from the file at {@code path}.
   *
   * @param path configuration file
   * @param key dotted key; blank returns the whole configuration tree
   * @return value at the key, or empty when unset
   * @throws IOException when the file cannot be read
   * @throws ConfigException when the file is missing or invalid, or the key is not a global key
   */
  public static Optional<TreeValue> get(Path path, String key) throws IOException, ConfigException {
    return get(YamlConfigLoader.read(path), key);
  }

  /**
   * Sets a global key in the file at {@code path}.
   *
   * @param path configuration file
   * @param key dotted global key
   * @param value new value
   * @return configuration as written
   * @throws IOException when the file cannot be read or written
   * @throws ConfigException when the key is a cluster key, the value does not fit the schema, or the file is
   *     missing or invalid
   */
  public static OchamiConfig set(Path path, String key, TreeValue value) throws IOException, ConfigException {
    requireGlobalKey(key);
    OchamiConfig config = YamlConfigLoader.read(path);
    TreeValue.MapNode tree = ConfigSchema.toTree(config);
    OchamiConfig modified;
    try {
      TreePath.set(tree, key, value);
      modified = ConfigSchema.materialize(tree);
    } catch (ConfigException ex) {
      throw ex.inFile(path);
    }
    YamlConfigWriter.write(path, modified);
    return modified;
  }

  /**
   * Removes a global key from the file at {@code path}. Removing an unset key rewrites the file unchanged.
   *
   * @param path configuration file
   * @param key dotted global key
   * @return configuration as written
   * @throws IOException when the file cannot be read or written
   * @throws ConfigException when the key is a cluster key or the file is missing or invalid
   */
  public static OchamiConfig unset(Path path, String key) throws IOException, ConfigException {
    requireGlobalKey(key);
    OchamiConfig config = YamlConfigLoader.read(path);
    TreeValue.MapNode tree = ConfigSchema.toTree(config);
    OchamiConfig modified;
    try {
      if (!TreePath.delete(tree, key)) {
        log.debug("Key {} not set in {}", key, path);
      }
      modified = ConfigSchema.materialize(tree);
    } catch (ConfigException ex) {
      throw ex.inFile(path);
    }
    YamlConfigWriter.write(path, modified);
    return modified;
  }

  /**
   * Reads a key of one cluster entry.
   *
   * @param config configuration to read
   * @param clusterName cluster name
   * @param key dotted key relative to the cluster entry; blank returns the whole entry
   * @return value at the key, or empty when unset
   * @throws ConfigException with {@link ConfigErrorKind#CLUSTER_NOT_FOUND} when the cluster does not exist
   */
  public static Optional<TreeValue> getCluster(OchamiConfig config, String clusterName, String key)
      throws ConfigException {
    ClusterEntry entry = config.cluster(clusterName);
    return Optional.ofNullable(TreePath.get(ConfigSchema.clusterToTree(entry), key));
  }

  /**
   * Reads a key of one cluster entry from the file at {@code path}.
   *
   * @param path configuration file
   * @param clusterName cluster name
   * @param key dotted key relative to the cluster entry; blank returns the whole entry
   * @return value at the key, or empty when unset
   * @throws IOException when the file cannot be read
   * @throws ConfigException when the file is missing or invalid, or the cluster does not exist
   */
  public static Optional<TreeValue> getCluster(Path path, String clusterName, String key)
      throws IOException, ConfigException {
    OchamiConfig config = YamlConfigLoader.read(path);
    try {
      return getCluster(config, clusterName, key);
    } catch (ConfigException ex) {
      throw ex.inFile(path);
    }
  }

  /**
   * Sets a key of one cluster, adding the cluster when it does not exist yet.
   *
   * @param path configuration file
   * @param clusterName cluster name
   * @param key dotted key relative to the cluster entry
   * @param value new value
   * @return configuration as written
   * @throws IOException when the file cannot be read or written
   * @throws ConfigException see {@link #upsertCluster}
   */
  public static OchamiConfig setCluster(Path path, String clusterName, String key, TreeValue value)
      throws IOException, ConfigException {
    return upsertCluster(path, clusterName, key, value, false);
  }

  /**
   * Sets a key of one cluster, adding the cluster when it does not exist yet.
   *
   * <p>With {@code key == "name"} the cluster is renamed. When the renamed cluster is the current
   * {@code default-cluster}, the default follows the new name even if {@code makeDefault} is {@code false}.</p>
   *
   * @param path configuration file
   * @param clusterName cluster to modify or add
   * @param key dotted key relative to the cluster entry
   * @param value new value
   * @param makeDefault also point {@code default-cluster} at the cluster (at its new name when renaming)
   * @return configuration as written
   * @throws IOException when the file cannot be read or written
   * @throws ConfigException with {@link ConfigErrorKind#CANNOT_RENAME_TO_EXISTING} when renaming onto an
   *     existing name, or when the value does not fit the schema
   */
  public static OchamiConfig upsertCluster(
      Path path, String clusterName, String key, TreeValue value, boolean makeDefault)
      throws IOException, ConfigException {
    Objects.requireNonNull(clusterName, "clusterName");
    Objects.requireNonNull(value, "value");
    OchamiConfig config = YamlConfigLoader.read(path);
    try {
      boolean rename = ConfigSchema.CLUSTER_NAME.equals(key);
      if (rename) {
        requireFreeName(config, value);
      }

      List<ClusterEntry> clusters = new ArrayList<>(config.clusters());
      int index = indexOf(clusters, clusterName);
      TreeValue.MapNode entryTree;
      if (index < 0) {
        log.debug("Adding new cluster {} to {}", clusterName, path);
        entryTree = new TreeValue.MapNode().put(ConfigSchema.CLUSTER_NAME, new TreeValue.Scalar(clusterName));
      } else {
        entryTree = ConfigSchema.clusterToTree(clusters.get(index));
      }
      TreePath.set(entryTree, key, value);
      ClusterEntry updated = ConfigSchema.materializeCluster(entryTree);
      if (index < 0) {
        clusters.add(updated);
      } else {
        clusters.set(index, updated);
      }

      String defaultCluster = config.defaultCluster();
      if (makeDefault || (rename && clusterName.equals(defaultCluster))) {
        defaultCluster = updated.name();
      }
      OchamiConfig modified = config.withClusters(clusters).withDefaultCluster(defaultCluster);
      YamlConfigWriter.write(path, modified);
      return modified;
    } catch (ConfigException ex) {
      throw ex.inFile(path);
    }
  }

  /**
   * Removes a key from one cluster. The {@code name} key cannot be removed.
   *
   * @param path configuration file
   * @param clusterName cluster to modify
   * @param key dotted key relative to the cluster entry
   * @return configuration as written
   * @throws IOException when the file cannot be read or written
   * @throws ConfigException with {@link ConfigErrorKind#CANNOT_UNSET_NAME} for {@code name}, or
   *     {@link ConfigErrorKind#CLUSTER_NOT_FOUND} when the cluster does not exist
   */
  public static OchamiConfig unsetCluster(Path path, String clusterName, String key)
      throws IOException, ConfigException {
    if (ConfigSchema.CLUSTER_NAME.equals(key)) {
      throw ConfigException.forKey(ConfigErrorKind.CANNOT_UNSET_NAME, key, "cannot unset name of cluster");
    }
    OchamiConfig config = YamlConfigLoader.read(path);
    try {
      List<ClusterEntry> clusters = new ArrayList<>(config.clusters());
      int index = requireIndex(clusters, clusterName);
      TreeValue.MapNode entryTree = ConfigSchema.clusterToTree(clusters.get(index));
      if (!TreePath.delete(entryTree, key)) {
        log.debug("Key {} not set for cluster {} in {}", key, clusterName, path);
      }
      clusters.set(index, ConfigSchema.materializeCluster(entryTree));
      OchamiConfig modified = config.withClusters(clusters);
      YamlConfigWriter.write(path, modified);
      return modified;
    } catch (ConfigException ex) {
      throw ex.inFile(path);
    }
  }

  /**
   * Removes a whole cluster entry. A {@code default-cluster} naming it is cleared.
   *
   * @param path configuration file
   * @param clusterName cluster to remove
   * @return configuration as written
   * @throws IOException when the file cannot be read or written
   * @throws ConfigException with {@link ConfigErrorKind#CLUSTER_NOT_FOUND} when the cluster does not exist
   */
  public static OchamiConfig deleteCluster(Path path, String clusterName) throws IOException, ConfigException {
    OchamiConfig config = YamlConfigLoader.read(path);
    try {
      List<ClusterEntry> clusters = new ArrayList<>(config.clusters());
      clusters.remove(requireIndex(clusters, clusterName));
      String defaultCluster = config.defaultCluster();
      if (clusterName.equals(defaultCluster)) {
        log.warn("Deleted cluster {} was the default cluster; default-cluster is now unset", clusterName);
        defaultCluster = null;
      }
      OchamiConfig modified = config.withClusters(clusters).withDefaultCluster(defaultCluster);
      YamlConfigWriter.write(path, modified);
      return modified;
    } catch (ConfigException ex) {
      throw ex.inFile(path);
    }
  }

  /**
   * Points {@code default-cluster} at an existing cluster.
   *
   * @param path configuration file
   * @param clusterName cluster to make the default
   * @return configuration as written
   * @throws IOException when the file cannot be read or written
   * @throws ConfigException with {@link ConfigErrorKind#CLUSTER_NOT_FOUND} when the cluster does not exist
   */
  public static OchamiConfig setDefaultCluster(Path path, String clusterName)
      throws IOException, ConfigException {
    OchamiConfig config = YamlConfigLoader.read(path);
    try {
      config.cluster(clusterName);
    } catch (ConfigException ex) {
      throw ex.inFile(path);
    }
    OchamiConfig modified = config.withDefaultCluster(clusterName);
    YamlConfigWriter.write(path, modified);
    return modified;
  }

  private static void requireFreeName(OchamiConfig config, TreeValue value) throws ConfigException {
    if (!(value instanceof TreeValue.Scalar scalar) || scalar.isNull() || scalar.asText().isBlank()) {
      throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, ConfigSchema.CLUSTER_NAME,
          "cluster name must be a non-empty string");
    }
    String newName = scalar.asText().trim();
    if (config.findCluster(newName).isPresent()) {
      throw ConfigException.forKey(ConfigErrorKind.CANNOT_RENAME_TO_EXISTING, ConfigSchema.CLUSTER_NAME,
          "cluster with name \"" + newName + "\" already exists");
    }
  }

  private static void requireGlobalKey(String key) throws ConfigException {
    if (key == null || key.isBlank()) {
      throw new ConfigException(ConfigErrorKind.INVALID_KEY, "key must not be blank");
    }
    String first = key.split("\\.", 2)[0];
    if (ConfigSchema.CLUSTERS.equals(first)) {
      throw ConfigException.forKey(ConfigErrorKind.INVALID_KEY, key,
          "cluster config cannot be modified with a global key; use the cluster variant");
    }
  }

  private static int indexOf(List<ClusterEntry> clusters, String name) {
    for (int i = 0; i < clusters.size(); i++) {
      if (clusters.get(i).name().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  private static int requireIndex(List<ClusterEntry> clusters, String name) throws ConfigException {
    int index = indexOf(clusters, name);
    if (index < 0) {
      throw new ConfigException(ConfigErrorKind.CLUSTER_NOT_FOUND, "cluster \"" + name + "\" not found");
    }
    return index;
  }
}
