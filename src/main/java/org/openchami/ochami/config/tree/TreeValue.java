package org.openchami.ochami.config.tree;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.openchami.ochami.config.ConfigErrorKind;
import org.openchami.ochami.config.ConfigException;

/**
 * <strong>What:</strong> Untyped configuration value: a scalar, an ordered list, or a string-keyed map.
 * <p><strong>Why:</strong> Every configuration source is represented this way while it is loaded and merged so
 * the merge engine can work without knowing the schema.</p>
 * <p><strong>Role:</strong> Common currency between the YAML loader, {@link TreeMerger}, {@link TreePath}, and
 * the typed schema conversion.</p>
 * <p><strong>Thread-safety:</strong> {@link ListNode} and {@link MapNode} are mutable and not thread-safe; use
 * {@link #deepCopy()} before sharing.</p>
 *
 * @since 0.1.0
 */
public sealed interface TreeValue permits TreeValue.Scalar, TreeValue.ListNode, TreeValue.MapNode {

  /**
   * Returns a short type label used in diagnostics ({@code map}, {@code list}, {@code string}, ...).
   *
   * @return type label
   */
  String typeName();

  /**
   * Returns an independent copy; mutating the copy never affects this value.
   *
   * @return deep copy
   */
  TreeValue deepCopy();

  /**
   * Converts the value into plain Java collections suitable for YAML or JSON emission.
   *
   * @return {@link LinkedHashMap}, {@link ArrayList}, or the scalar payload
   */
  Object toPlain();

  /**
   * Builds a tree from a parsed document made of maps, lists, and scalars.
   *
   * @param raw parsed value; {@code null} becomes a null scalar
   * @return tree representation
   * @throws ConfigException when a map contains a non-string key
   */
  static TreeValue fromPlain(Object raw) throws ConfigException {
    return fromPlain(raw, "");
  }

  private static TreeValue fromPlain(Object raw, String path) throws ConfigException {
    if (raw instanceof Map<?, ?> map) {
      MapNode node = new MapNode();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw ConfigException.forKey(ConfigErrorKind.PARSE_ERROR, path,
              "non-string key " + entry.getKey() + " under " + (path.isEmpty() ? "<root>" : path));
        }
        node.put(key, fromPlain(entry.getValue(), path.isEmpty() ? key : path + '.' + key));
      }
      return node;
    }
    if (raw instanceof List<?> list) {
      ListNode node = new ListNode();
      int index = 0;
      for (Object item : list) {
        node.add(fromPlain(item, path + '[' + index++ + ']'));
      }
      return node;
    }
    return new Scalar(raw);
  }

  /**
   * Leaf value. The payload is normalized to {@code null}, {@link String}, {@link Boolean}, {@link Long},
   * {@link BigInteger}, or {@link Double}; any other object is stored as its string form.
   *
   * @param value normalized payload
   */
  record Scalar(Object value) implements TreeValue {
    /**
     * Normalizes numeric widths so equal numbers compare equal regardless of parser choice.
     */
    public Scalar {
      value = normalize(value);
    }

    private static Object normalize(Object value) {
      if (value == null || value instanceof String || value instanceof Boolean
          || value instanceof Long || value instanceof BigInteger || value instanceof Double) {
        return value;
      }
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        return ((Number) value).longValue();
      }
      if (value instanceof Float || value instanceof BigDecimal) {
        return ((Number) value).doubleValue();
      }
      return String.valueOf(value);
    }

    /**
     * @return {@code true} when the payload is {@code null}
     */
    public boolean isNull() {
      return value == null;
    }

    /**
     * @return payload rendered as text; {@code null} payloads become {@code null}
     */
    public String asText() {
      return value == null ? null : String.valueOf(value);
    }

    @Override
    public String typeName() {
      if (value == null) {
        return "null";
      }
      if (value instanceof String) {
        return "string";
      }
      if (value instanceof Boolean) {
        return "bool";
      }
      if (value instanceof Double) {
        return "float";
      }
      return "int";
    }

    @Override
    public Scalar deepCopy() {
      return this;
    }

    @Override
    public Object toPlain() {
      return value;
    }
  }

  /**
   * Ordered list of tree values.
   */
  final class ListNode implements TreeValue {
    private final List<TreeValue> items;

    /** Creates an empty list. */
    public ListNode() {
      this.items = new ArrayList<>();
    }

    /**
     * Creates a list holding {@code items} in order.
     *
     * @param items initial elements
     */
    public ListNode(List<? extends TreeValue> items) {
      this.items = new ArrayList<>(Objects.requireNonNull(items, "items"));
    }

    /**
     * Returns the live element list; the merge engine appends to it in place.
     *
     * @return mutable backing list
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Merge and path operations mutate lists in place.")
    public List<TreeValue> items() {
      return items;
    }

    /**
     * Appends {@code value}.
     *
     * @param value element to append
     */
    public void add(TreeValue value) {
      items.add(Objects.requireNonNull(value, "value"));
    }

    /**
     * @return element count
     */
    public int size() {
      return items.size();
    }

    @Override
    public String typeName() {
      return "list";
    }

    @Override
    public ListNode deepCopy() {
      ListNode copy = new ListNode();
      for (TreeValue item : items) {
        copy.add(item.deepCopy());
      }
      return copy;
    }

    @Override
    public Object toPlain() {
      List<Object> out = new ArrayList<>(items.size());
      for (TreeValue item : items) {
        out.add(item.toPlain());
      }
      return out;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof ListNode that && items.equals(that.items);
    }

    @Override
    public int hashCode() {
      return items.hashCode();
    }

    @Override
    public String toString() {
      return items.toString();
    }
  }

  /**
   * String-keyed map preserving insertion order.
   */
  final class MapNode implements TreeValue {
    private final LinkedHashMap<String, TreeValue> entries = new LinkedHashMap<>();

    /** Creates an empty map. */
    public MapNode() {}

    /**
     * @param key entry key
     * @return value stored under {@code key}, or {@code null}
     */
    public TreeValue get(String key) {
      return entries.get(key);
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     *
     * @param key entry key
     * @param value entry value
     * @return this map for chaining
     */
    public MapNode put(String key, TreeValue value) {
      entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /**
     * @param key entry key
     * @return removed value, or {@code null}
     */
    public TreeValue remove(String key) {
      return entries.remove(key);
    }

    /**
     * @param key entry key
     * @return {@code true} when {@code key} is present
     */
    public boolean containsKey(String key) {
      return entries.containsKey(key);
    }

    /**
     * @return {@code true} when the map has no entries
     */
    public boolean isEmpty() {
      return entries.isEmpty();
    }

    /**
     * @return unmodifiable view of the keys in insertion order
     */
    public Set<String> keys() {
      return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * @return unmodifiable view of the entries in insertion order
     */
    public Map<String, TreeValue> entries() {
      return Collections.unmodifiableMap(entries);
    }

    @Override
    public String typeName() {
      return "map";
    }

    @Override
    public MapNode deepCopy() {
      MapNode copy = new MapNode();
      entries.forEach((key, value) -> copy.put(key, value.deepCopy()));
      return copy;
    }

    @Override
    public Object toPlain() {
      Map<String, Object> out = new LinkedHashMap<>();
      entries.forEach((key, value) -> out.put(key, value.toPlain()));
      return out;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof MapNode that && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
      return entries.hashCode();
    }

    @Override
    public String toString() {
      return entries.toString();
    }
  }
}
