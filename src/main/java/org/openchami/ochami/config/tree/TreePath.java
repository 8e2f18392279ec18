package org.openchami.ochami.config.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.openchami.ochami.config.ConfigErrorKind;
import org.openchami.ochami.config.ConfigException;

/**
 * Dotted key paths ({@code log.level}, {@code cluster.bss.uri}) over a map-rooted tree.
 *
 * <p>Only map segments are addressable; list elements are reached through the cluster-scoped
 * operations instead. Deleting a key prunes parent maps left empty.</p>
 *
 * @since 0.1.0
 */
public final class TreePath {
  private static final char DELIMITER = '.';

  private TreePath() {}

  /**
   * Reads the value at {@code key}.
   *
   * @param root tree root
   * @param key dotted key; blank returns {@code root}
   * @return value at the key, or {@code null} when any segment is missing or not a map
   * @throws ConfigException when the key has empty segments
   */
  public static TreeValue get(TreeValue.MapNode root, String key) throws ConfigException {
    Objects.requireNonNull(root, "root");
    if (key == null || key.isBlank()) {
      return root;
    }
    TreeValue current = root;
    for (String segment : split(key)) {
      if (!(current instanceof TreeValue.MapNode map)) {
        return null;
      }
      current = map.get(segment);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  /**
   * Stores {@code value} at {@code key}, creating intermediate maps as needed.
   *
   * @param root tree root, mutated in place
   * @param key dotted key
   * @param value value to store
   * @throws ConfigException when the key is blank, an intermediate segment is not a map, or the new value
   *     would replace a map or list with a structurally different value
   */
  public static void set(TreeValue.MapNode root, String key, TreeValue value) throws ConfigException {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(value, "value");
    if (key == null || key.isBlank()) {
      throw new ConfigException(ConfigErrorKind.INVALID_KEY, "key must not be blank");
    }
    List<String> segments = split(key);
    TreeValue.MapNode parent = root;
    StringBuilder walked = new StringBuilder();
    for (int i = 0; i < segments.size() - 1; i++) {
      String segment = segments.get(i);
      appendSegment(walked, segment);
      TreeValue next = parent.get(segment);
      if (next == null) {
        TreeValue.MapNode created = new TreeValue.MapNode();
        parent.put(segment, created);
        parent = created;
      } else if (next instanceof TreeValue.MapNode map) {
        parent = map;
      } else {
        throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, key,
            "cannot set " + key + ": " + walked + " is a " + next.typeName() + ", not a map");
      }
    }
    String leaf = segments.get(segments.size() - 1);
    TreeValue existing = parent.get(leaf);
    if (existing != null && !sameShape(existing, value)) {
      throw ConfigException.forKey(ConfigErrorKind.INVALID_VALUE, key,
          "cannot replace " + existing.typeName() + " at " + key + " with " + value.typeName());
    }
    parent.put(leaf, value);
  }

  /**
   * Removes the value at {@code key}.
   *
   * @param root tree root, mutated in place
   * @param key dotted key
   * @return {@code true} when a value was removed
   * @throws ConfigException when the key is blank or has empty segments
   */
  public static boolean delete(TreeValue.MapNode root, String key) throws ConfigException {
    Objects.requireNonNull(root, "root");
    if (key == null || key.isBlank()) {
      throw new ConfigException(ConfigErrorKind.INVALID_KEY, "key must not be blank");
    }
    return delete(root, split(key), 0);
  }

  private static boolean delete(TreeValue.MapNode parent, List<String> segments, int index) {
    String segment = segments.get(index);
    if (index == segments.size() - 1) {
      return parent.remove(segment) != null;
    }
    if (!(parent.get(segment) instanceof TreeValue.MapNode child)) {
      return false;
    }
    boolean removed = delete(child, segments, index + 1);
    if (removed && child.isEmpty()) {
      parent.remove(segment);
    }
    return removed;
  }

  private static boolean sameShape(TreeValue existing, TreeValue replacement) {
    if (existing instanceof TreeValue.Scalar scalar) {
      return scalar.isNull() || replacement instanceof TreeValue.Scalar;
    }
    return existing.getClass() == replacement.getClass();
  }

  private static List<String> split(String key) throws ConfigException {
    List<String> segments = new ArrayList<>();
    int start = 0;
    String trimmed = key.trim();
    while (true) {
      int dot = trimmed.indexOf(DELIMITER, start);
      int end = dot == -1 ? trimmed.length() : dot;
      if (end == start) {
        throw ConfigException.forKey(ConfigErrorKind.INVALID_KEY, key, "empty segment in key: " + key);
      }
      segments.add(trimmed.substring(start, end));
      if (dot == -1) {
        return segments;
      }
      start = dot + 1;
    }
  }

  private static void appendSegment(StringBuilder walked, String segment) {
    if (walked.length() > 0) {
      walked.append(DELIMITER);
    }
    walked.append(segment);
  }
}
