package org.openchami.ochami.config.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.openchami.ochami.config.ConfigErrorKind;
import org.openchami.ochami.config.ConfigException;

/**
 * <strong>What:</strong> Deep merge of two configuration trees where the destination wins every tie.
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>Keys missing from the destination are copied from the source.</li>
 *   <li>Two maps are merged recursively; two lists are merged by {@link #mergeLists}.</li>
 *   <li>Two scalars keep the destination scalar, whatever their types.</li>
 *   <li>Structurally different values (map, list, scalar) under one key fail the whole merge.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; the destination tree is mutated in place and must not be
 * shared during the call.</p>
 *
 * @since 0.1.0
 */
public final class TreeMerger {
  private TreeMerger() {}

  /**
   * Merges {@code src} into {@code dst} in place.
   *
   * <p>On failure the destination may be partially merged and must be discarded.</p>
   *
   * @param src tree supplying values for gaps in {@code dst}
   * @param dst tree whose existing values are kept
   * @param mergeKey map key identifying corresponding map elements inside lists (e.g. {@code name})
   * @return {@code dst}
   * @throws ConfigException with {@link ConfigErrorKind#MERGE_TYPE_MISMATCH} when a key holds structurally
   *     different values
   */
  public static TreeValue.MapNode merge(TreeValue.MapNode src, TreeValue.MapNode dst, String mergeKey)
      throws ConfigException {
    Objects.requireNonNull(src, "src");
    Objects.requireNonNull(dst, "dst");
    mergeMaps(src, dst, mergeKey, "");
    return dst;
  }

  /**
   * Merges the elements of {@code src} into {@code dst} with union semantics.
   *
   * <p>A map element sharing its {@code mergeKey} value with a map already in {@code dst} is deep-merged into
   * that element. Any other element is appended unless an equal element is already present.</p>
   *
   * @param src list supplying elements
   * @param dst list receiving elements, mutated in place
   * @param mergeKey identity key for map elements
   * @throws ConfigException when merging two identified map elements hits a type mismatch
   */
  public static void mergeLists(TreeValue.ListNode src, TreeValue.ListNode dst, String mergeKey)
      throws ConfigException {
    mergeLists(src, dst, mergeKey, "");
  }

  private static void mergeMaps(
      TreeValue.MapNode src, TreeValue.MapNode dst, String mergeKey, String path)
      throws ConfigException {
    for (Map.Entry<String, TreeValue> entry : src.entries().entrySet()) {
      String key = entry.getKey();
      String keyPath = path.isEmpty() ? key : path + '.' + key;
      TreeValue sv = entry.getValue();
      TreeValue dv = dst.get(key);
      if (dv == null) {
        dst.put(key, sv.deepCopy());
        continue;
      }
      if (sv instanceof TreeValue.MapNode srcMap && dv instanceof TreeValue.MapNode dstMap) {
        mergeMaps(srcMap, dstMap, mergeKey, keyPath);
      } else if (sv instanceof TreeValue.ListNode srcList && dv instanceof TreeValue.ListNode dstList) {
        mergeLists(srcList, dstList, mergeKey, keyPath);
      } else if (!(sv instanceof TreeValue.Scalar && dv instanceof TreeValue.Scalar)) {
        throw ConfigException.forKey(ConfigErrorKind.MERGE_TYPE_MISMATCH, keyPath,
            "type mismatch for key \"" + keyPath + "\": " + sv.typeName() + " (src) vs "
                + dv.typeName() + " (dst)");
      }
    }
  }

  private static void mergeLists(
      TreeValue.ListNode src, TreeValue.ListNode dst, String mergeKey, String path)
      throws ConfigException {
    // src may be the same list as dst.
    List<TreeValue> incoming = List.copyOf(src.items());
    for (TreeValue element : incoming) {
      if (element instanceof TreeValue.MapNode srcMap) {
        TreeValue.MapNode match = findByMergeKey(dst, srcMap, mergeKey);
        if (match != null) {
          mergeMaps(srcMap, match, mergeKey, path + "[" + mergeKey + "=" + keyText(srcMap, mergeKey) + "]");
          continue;
        }
      }
      if (!dst.items().contains(element)) {
        dst.add(element.deepCopy());
      }
    }
  }

  private static TreeValue.MapNode findByMergeKey(
      TreeValue.ListNode dst, TreeValue.MapNode srcMap, String mergeKey) {
    if (mergeKey == null) {
      return null;
    }
    TreeValue id = srcMap.get(mergeKey);
    if (id == null) {
      return null;
    }
    for (TreeValue candidate : dst.items()) {
      if (candidate instanceof TreeValue.MapNode dstMap && id.equals(dstMap.get(mergeKey))) {
        return dstMap;
      }
    }
    return null;
  }

  private static String keyText(TreeValue.MapNode map, String mergeKey) {
    TreeValue id = map.get(mergeKey);
    return id instanceof TreeValue.Scalar scalar ? scalar.asText() : String.valueOf(id);
  }
}
