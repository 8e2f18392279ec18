package org.openchami.ochami.config;

import java.util.HashMap;
import java.util.Map;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Maps dotted key paths ({@code clusters[0].cluster.uri}) of a composed YAML document to 1-based line numbers.
 */
final class YamlLineIndex {
  private final Map<String, Integer> lines = new HashMap<>();

  private YamlLineIndex() {}

  static YamlLineIndex of(Node root) {
    YamlLineIndex index = new YamlLineIndex();
    if (root != null) {
      index.walk(root, "");
    }
    return index;
  }

  /**
   * Returns the line of {@code key}, falling back to the closest ancestor that has one.
   *
   * @param key dotted key path
   * @return 1-based line, or {@code -1}
   */
  int lineOf(String key) {
    String current = key;
    while (current != null && !current.isEmpty()) {
      Integer line = lines.get(current);
      if (line != null) {
        return line;
      }
      current = parent(current);
    }
    return -1;
  }

  private void walk(Node node, String path) {
    if (node instanceof MappingNode mapping) {
      for (NodeTuple tuple : mapping.getValue()) {
        if (!(tuple.getKeyNode() instanceof ScalarNode keyNode)) {
          continue;
        }
        String child = path.isEmpty() ? keyNode.getValue() : path + '.' + keyNode.getValue();
        lines.put(child, keyNode.getStartMark().getLine() + 1);
        walk(tuple.getValueNode(), child);
      }
    } else if (node instanceof SequenceNode sequence) {
      int i = 0;
      for (Node item : sequence.getValue()) {
        String child = path + '[' + i++ + ']';
        lines.put(child, item.getStartMark().getLine() + 1);
        walk(item, child);
      }
    }
  }

  private static String parent(String key) {
    int cut = Math.max(key.lastIndexOf('.'), key.lastIndexOf('['));
    return cut <= 0 ? null : key.substring(0, cut);
  }
}
