package org.openchami.ochami.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.openchami.ochami.config.tree.TreeValue;
import org.openchami.ochami.validation.Durations;
import org.openchami.ochami.validation.Strings;

/**
 * <strong>What:</strong> Bidirectional conversion between configuration trees and {@link OchamiConfig}.
 * <p><strong>Why:</strong> Merging works on untyped trees; everything downstream needs typed values. Conversion
 * to the typed form is strict so that typos in configuration files surface as errors instead of being
 * silently dropped.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Emit trees keyed by the YAML key names, omitting unset values.</li>
 *   <li>Normalize presence-dependent defaults ({@code enable-auth}) before conversion.</li>
 *   <li>Reject unknown keys, mistyped values, and duplicate cluster names.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ConfigSchema {
  /** Identity key of cluster entries, used as the list merge key. */
  public static final String CLUSTER_NAME = "name";

  static final String LOG = "log";
  static final String LOG_FORMAT = "format";
  static final String LOG_LEVEL = "level";
  static final String TIMEOUT = "timeout";
  static final String DEFAULT_CLUSTER = "default-cluster";
  static final String CLUSTERS = "clusters";
  static final String CLUSTER = "cluster";
  static final String URI = "uri";
  static final String API_VERSION = "api-version";
  static final String ENABLE_AUTH = "enable-auth";

  private static final Set<String> ROOT_KEYS = Set.of(LOG, TIMEOUT, DEFAULT_CLUSTER, CLUSTERS);
  private static final Set<String> LOG_KEYS = Set.of(LOG_FORMAT, LOG_LEVEL);
  private static final Set<String> ENTRY_KEYS = Set.of(CLUSTER_NAME, CLUSTER);

  private ConfigSchema() {}

  /**
   * Converts a typed configuration into a tree.
   *
   * @param config configuration to convert
   * @return new tree; unset values are omitted
   */
  public static TreeValue.MapNode toTree(OchamiConfig config) {
    TreeValue.MapNode root = new TreeValue.MapNode();
    TreeValue.MapNode log = new TreeValue.MapNode();
    putText(log, LOG_FORMAT, config.log().format());
    putText(log, LOG_LEVEL, config.log().level());
    if (!log.isEmpty()) {
      root.put(LOG, log);
    }
    if (config.timeout() != null) {
      root.put(TIMEOUT, new TreeValue.Scalar(Durations.format(config.timeout())));
    }
    putText(root, DEFAULT_CLUSTER, config.defaultCluster());
    if (!config.clusters().isEmpty()) {
      TreeValue.ListNode clusters = new TreeValue.ListNode();
      for (ClusterEntry entry : config.clusters()) {
        clusters.add(clusterToTree(entry));
      }
      root.put(CLUSTERS, clusters);
    }
    return root;
  }

  /**
   * Converts one cluster entry into a tree of the form {@code {name, cluster: {...}}}.
   *
   * @param entry cluster entry
   * @return new tree
   */
  public static TreeValue.MapNode clusterToTree(ClusterEntry entry) {
    ClusterConfig cluster = entry.cluster();
    TreeValue.MapNode body = new TreeValue.MapNode();
    putText(body, URI, cluster.uri());
    for (ServiceName service : ServiceName.values()) {
      ServiceConfig svc = cluster.service(service);
      if (svc.isEmpty()) {
        continue;
      }
      TreeValue.MapNode svcNode = new TreeValue.MapNode();
      putText(svcNode, API_VERSION, svc.apiVersion());
      putText(svcNode, URI, svc.uri());
      body.put(service.key(), svcNode);
    }
    body.put(ENABLE_AUTH, new TreeValue.Scalar(cluster.enableAuth()));

    TreeValue.MapNode node = new TreeValue.MapNode();
    node.put(CLUSTER_NAME, new TreeValue.Scalar(entry.name()));
    node.put(CLUSTER, body);
    return node;
  }

  /**
   * Normalizes a copy of {@code tree} and converts it strictly into a typed configuration.
   *
   * @param tree merged or freshly parsed tree; left unmodified
   * @return typed configuration
   * @throws ConfigException on unknown keys, mistyped values, or duplicate cluster names
   */
  public static OchamiConfig materialize(TreeValue.MapNode tree) throws ConfigException {
    TreeValue.MapNode copy = tree.deepCopy();
    normalize(copy);
    return fromTree(copy);
  }

  /**
   * Converts a single cluster entry tree strictly into a {@link ClusterEntry}.
   *
   * @param tree entry tree of the form {@code {name, cluster: {...}}}; left unmodified
   * @return typed cluster entry
   * @throws ConfigException on unknown keys or mistyped values
   */
  public static ClusterEntry materializeCluster(TreeValue.MapNode tree) throws ConfigException {
    TreeValue.MapNode copy = tree.deepCopy();
    normalizeEntry(copy, CLUSTER);
    return entryFromTree(copy, "");
  }

  /**
   * Applies presence-dependent defaults in place: every {@code cluster} block without an {@code enable-auth}
   * key receives {@code enable-auth: true}. An explicitly empty {@code enable-auth} is rejected rather than
   * treated as {@code false}.
   *
   * @param root tree to normalize
   * @throws ConfigException with {@link ConfigErrorKind#INVALID_VALUE} when {@code enable-auth} is present but
   *     empty
   */
  public static void normalize(TreeValue.MapNode root) throws ConfigException {
    if (!(root.get(CLUSTERS) instanceof TreeValue.ListNode clusters)) {
      return;
    }
    List<TreeValue> items = clusters.items();
    for (int i = 0; i < items.size(); i++) {
      if (items.get(i) instanceof TreeValue.MapNode entry) {
        normalizeEntry(entry, CLUSTERS + '[' + i + "]." + CLUSTER);
      }
    }
  }

  private static void normalizeEntry(TreeValue.MapNode entry, String path) throws ConfigException {
    if (!(entry.get(CLUSTER) instanceof TreeValue.MapNode body)) {
      return;
    }
    TreeValue enableAuth = body.get(ENABLE_AUTH);
    if (enableAuth == null) {
      body.put(ENABLE_AUTH, new TreeValue.Scalar(Boolean.TRUE));
      return;
    }
    if (enableAuth instanceof TreeValue.Scalar scalar
        && (scalar.isNull() || scalar.asText().isBlank())) {
      String key = path + '.' + ENABLE_AUTH;
      throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, key,
          "invalid value for key \"" + key + "\": got empty value but expected true or false");
    }
  }

  private static OchamiConfig fromTree(TreeValue.MapNode root) throws ConfigException {
    rejectUnknown(root, ROOT_KEYS, "");
    LogConfig log = LogConfig.EMPTY;
    TreeValue.MapNode logNode = optionalMap(root, LOG, LOG);
    if (logNode != null) {
      rejectUnknown(logNode, LOG_KEYS, LOG);
      log = new LogConfig(
          optionalText(logNode, LOG_FORMAT, LOG + '.' + LOG_FORMAT),
          optionalText(logNode, LOG_LEVEL, LOG + '.' + LOG_LEVEL));
    }
    Duration timeout = optionalDuration(root, TIMEOUT);
    String defaultCluster = optionalText(root, DEFAULT_CLUSTER, DEFAULT_CLUSTER);

    List<ClusterEntry> clusters = new ArrayList<>();
    TreeValue clustersNode = root.get(CLUSTERS);
    if (clustersNode != null && !isNull(clustersNode)) {
      if (!(clustersNode instanceof TreeValue.ListNode list)) {
        throw mistyped(CLUSTERS, clustersNode, "list");
      }
      Set<String> seen = new HashSet<>();
      List<TreeValue> items = list.items();
      for (int i = 0; i < items.size(); i++) {
        String path = CLUSTERS + '[' + i + ']';
        if (!(items.get(i) instanceof TreeValue.MapNode entryNode)) {
          throw mistyped(path, items.get(i), "map");
        }
        ClusterEntry entry = entryFromTree(entryNode, path);
        if (!seen.add(entry.name())) {
          throw ConfigException.forKey(ConfigErrorKind.DUPLICATE_CLUSTER_NAME, path + '.' + CLUSTER_NAME,
              "cluster with name \"" + entry.name() + "\" appears more than once");
        }
        clusters.add(entry);
      }
    }
    return new OchamiConfig(log, timeout, defaultCluster, clusters);
  }

  private static ClusterEntry entryFromTree(TreeValue.MapNode entryNode, String path)
      throws ConfigException {
    rejectUnknown(entryNode, ENTRY_KEYS, path);
    String namePath = join(path, CLUSTER_NAME);
    String name = optionalText(entryNode, CLUSTER_NAME, namePath);
    if (name == null) {
      throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, namePath,
          "cluster entry " + (path.isEmpty() ? "" : path + " ") + "has no name");
    }
    try {
      name = Strings.requireNonBlank(namePath, name);
    } catch (IllegalArgumentException ex) {
      throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, namePath, ex.getMessage());
    }
    String bodyPath = join(path, CLUSTER);
    TreeValue.MapNode body = optionalMap(entryNode, CLUSTER, bodyPath);
    if (body == null) {
      return new ClusterEntry(name, ClusterConfig.EMPTY);
    }
    Set<String> allowed = new HashSet<>();
    allowed.add(URI);
    allowed.add(ENABLE_AUTH);
    for (ServiceName service : ServiceName.values()) {
      allowed.add(service.key());
    }
    rejectUnknown(body, allowed, bodyPath);

    Map<ServiceName, ServiceConfig> services = new EnumMap<>(ServiceName.class);
    for (ServiceName service : ServiceName.values()) {
      String svcPath = bodyPath + '.' + service.key();
      TreeValue.MapNode svcNode = optionalMap(body, service.key(), svcPath);
      if (svcNode == null) {
        continue;
      }
      rejectUnknown(svcNode, service.hasApiVersion() ? Set.of(URI, API_VERSION) : Set.of(URI), svcPath);
      services.put(service, new ServiceConfig(
          optionalText(svcNode, URI, svcPath + '.' + URI),
          optionalText(svcNode, API_VERSION, svcPath + '.' + API_VERSION)));
    }
    boolean enableAuth = optionalBoolean(body, ENABLE_AUTH, bodyPath + '.' + ENABLE_AUTH, true);
    return new ClusterEntry(name,
        new ClusterConfig(optionalText(body, URI, bodyPath + '.' + URI), enableAuth, services));
  }

  private static void rejectUnknown(TreeValue.MapNode node, Set<String> allowed, String path)
      throws ConfigException {
    for (String key : node.keys()) {
      if (!allowed.contains(key)) {
        String keyPath = join(path, key);
        throw ConfigException.forKey(ConfigErrorKind.UNKNOWN_KEY, keyPath,
            "unknown key \"" + key + "\"" + (path.isEmpty() ? "" : " in " + path));
      }
    }
  }

  private static TreeValue.MapNode optionalMap(TreeValue.MapNode parent, String key, String path)
      throws ConfigException {
    TreeValue value = parent.get(key);
    if (value == null || isNull(value)) {
      return null;
    }
    if (value instanceof TreeValue.MapNode map) {
      return map;
    }
    throw mistyped(path, value, "map");
  }

  private static String optionalText(TreeValue.MapNode parent, String key, String path)
      throws ConfigException {
    TreeValue value = parent.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof TreeValue.Scalar scalar) {
      return scalar.asText();
    }
    throw mistyped(path, value, "string");
  }

  private static boolean optionalBoolean(
      TreeValue.MapNode parent, String key, String path, boolean fallback) throws ConfigException {
    TreeValue value = parent.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof TreeValue.Scalar scalar) {
      if (scalar.value() instanceof Boolean bool) {
        return bool;
      }
      String text = scalar.asText();
      if (text != null) {
        switch (text) {
          case "1", "t", "T", "true", "True", "TRUE":
            return true;
          case "0", "f", "F", "false", "False", "FALSE":
            return false;
          default:
            break;
        }
      }
    }
    throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, path,
        "invalid value for key \"" + path + "\": got " + describe(value) + " but expected true or false");
  }

  private static Duration optionalDuration(TreeValue.MapNode parent, String key) throws ConfigException {
    TreeValue value = parent.get(key);
    if (value == null || isNull(value)) {
      return null;
    }
    if (value instanceof TreeValue.Scalar scalar) {
      if (scalar.value() instanceof Long || scalar.value() instanceof String) {
        String text = scalar.asText();
        try {
          return Durations.parse(text);
        } catch (IllegalArgumentException ex) {
          throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, key,
              "invalid value for key \"" + key + "\": " + ex.getMessage());
        }
      }
    }
    throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, key,
        "invalid value for key \"" + key + "\": got " + describe(value) + " but expected a duration such as 30s");
  }

  private static ConfigException mistyped(String path, TreeValue value, String expected) {
    return ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, path,
        "invalid value for key \"" + path + "\": got " + value.typeName() + " but expected " + expected);
  }

  private static String describe(TreeValue value) {
    return value instanceof TreeValue.Scalar scalar ? "\"" + scalar.asText() + "\"" : value.typeName();
  }

  private static boolean isNull(TreeValue value) {
    return value instanceof TreeValue.Scalar scalar && scalar.isNull();
  }

  private static void putText(TreeValue.MapNode node, String key, String value) {
    if (value != null) {
      node.put(key, new TreeValue.Scalar(value));
    }
  }

  private static String join(String path, String key) {
    return path.isEmpty() ? key : path + '.' + key;
  }
}
