package org.openchami.ochami.config.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.openchami.ochami.config.ConfigErrorKind;
import org.openchami.ochami.config.ConfigException;

class TreePathTest {

  @Test
  void getWalksNestedMaps() throws ConfigException {
    TreeValue.MapNode root = (TreeValue.MapNode) TreeValue.fromPlain(Map.of("log", Map.of("level", "info")));

    assertEquals(new TreeValue.Scalar("info"), TreePath.get(root, "log.level"));
    assertNull(TreePath.get(root, "log.format"));
    assertNull(TreePath.get(root, "log.level.deeper"));
    assertSame(root, TreePath.get(root, ""));
  }

  @Test
  void setCreatesIntermediateMaps() throws ConfigException {
    TreeValue.MapNode root = new TreeValue.MapNode();

    TreePath.set(root, "cluster.bss.uri", new TreeValue.Scalar("/boot/v1"));

    assertEquals(new TreeValue.Scalar("/boot/v1"), TreePath.get(root, "cluster.bss.uri"));
  }

  @Test
  void setThroughScalarFails() throws ConfigException {
    TreeValue.MapNode root = (TreeValue.MapNode) TreeValue.fromPlain(Map.of("timeout", "30s"));

    ConfigException ex = assertThrows(ConfigException.class,
        () -> TreePath.set(root, "timeout.seconds", new TreeValue.Scalar(5)));

    assertEquals(ConfigErrorKind.INVALID_VALUE, ex.kind());
  }

  @Test
  void setRejectsReplacingMapWithScalar() throws ConfigException {
    TreeValue.MapNode root = (TreeValue.MapNode) TreeValue.fromPlain(Map.of("log", Map.of("level", "info")));

    ConfigException ex = assertThrows(ConfigException.class,
        () -> TreePath.set(root, "log", new TreeValue.Scalar("debug")));

    assertEquals(ConfigErrorKind.INVALID_VALUE, ex.kind());
  }

  @Test
  void emptySegmentsAreInvalidKeys() {
    TreeValue.MapNode root = new TreeValue.MapNode();

    ConfigException ex = assertThrows(ConfigException.class,
        () -> TreePath.set(root, "log..level", new TreeValue.Scalar("debug")));

    assertEquals(ConfigErrorKind.INVALID_KEY, ex.kind());
    assertThrows(ConfigException.class, () -> TreePath.delete(root, " "));
  }

  @Test
  void deletePrunesEmptyParents() throws ConfigException {
    TreeValue.MapNode root = (TreeValue.MapNode) TreeValue.fromPlain(
        Map.of("cluster", Map.of("uri", "https://x", "bss", Map.of("uri", "/boot/v1"))));

    assertTrue(TreePath.delete(root, "cluster.bss.uri"));

    assertFalse(((TreeValue.MapNode) root.get("cluster")).containsKey("bss"));
    assertFalse(TreePath.delete(root, "cluster.bss.uri"));
  }
}
