package org.openchami.ochami.config.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.openchami.ochami.config.ConfigErrorKind;
import org.openchami.ochami.config.ConfigException;

class TreeMergerTest {

  @Test
  void destinationScalarWinsAndGapsAreFilled() throws ConfigException {
    TreeValue.MapNode src = tree(Map.of("log", Map.of("level", "warning", "format", "rfc3339")));
    TreeValue.MapNode dst = tree(Map.of("log", Map.of("level", "debug")));

    TreeValue.MapNode merged = TreeMerger.merge(src, dst, "name");

    assertSame(dst, merged);
    assertEquals(tree(Map.of("log", Map.of("level", "debug", "format", "rfc3339"))), merged);
  }

  @Test
  void scalarsOfDifferentTypesKeepDestination() throws ConfigException {
    TreeValue.MapNode src = tree(Map.of("timeout", "30s"));
    TreeValue.MapNode dst = tree(Map.of("timeout", 45));

    TreeMerger.merge(src, dst, "name");

    assertEquals(new TreeValue.Scalar(45L), dst.get("timeout"));
  }

  @Test
  void structuralMismatchFailsWithKeyPath() {
    TreeValue.MapNode src = tree(Map.of("log", Map.of("level", "info")));
    TreeValue.MapNode dst = tree(Map.of("log", "loud"));

    ConfigException ex = assertThrows(ConfigException.class, () -> TreeMerger.merge(src, dst, "name"));

    assertEquals(ConfigErrorKind.MERGE_TYPE_MISMATCH, ex.kind());
    assertEquals("log", ex.key().orElseThrow());
    assertTrue(ex.getMessage().contains("map (src) vs string (dst)"), ex.getMessage());
  }

  @Test
  void clustersAreMergedByNameWithoutDuplicates() throws ConfigException {
    TreeValue.MapNode src = tree(Map.of("clusters", List.of(
        cluster("foo", ordered("uri", "https://foo.example.com", "enable-auth", false)),
        cluster("bar", ordered("uri", "https://bar.example.com")))));
    TreeValue.MapNode dst = tree(Map.of("clusters", List.of(
        cluster("foo", ordered("uri", "https://foo.local")))));

    TreeMerger.merge(src, dst, "name");

    TreeValue.ListNode clusters = (TreeValue.ListNode) dst.get("clusters");
    assertEquals(2, clusters.size());
    TreeValue.MapNode foo = (TreeValue.MapNode) ((TreeValue.MapNode) clusters.items().get(0)).get("cluster");
    assertEquals(new TreeValue.Scalar("https://foo.local"), foo.get("uri"));
    assertEquals(new TreeValue.Scalar(false), foo.get("enable-auth"));
    TreeValue.MapNode bar = (TreeValue.MapNode) clusters.items().get(1);
    assertEquals(new TreeValue.Scalar("bar"), bar.get("name"));
  }

  @Test
  void mismatchInsideIdentifiedListElementIsReported() {
    TreeValue.MapNode src = tree(Map.of("clusters", List.of(cluster("foo", ordered("smd", "oops")))));
    TreeValue.MapNode dst = tree(Map.of("clusters", List.of(
        cluster("foo", ordered("smd", Map.of("uri", "/hsm/v2"))))));

    ConfigException ex = assertThrows(ConfigException.class, () -> TreeMerger.merge(src, dst, "name"));

    assertEquals(ConfigErrorKind.MERGE_TYPE_MISMATCH, ex.kind());
    assertEquals("clusters[name=foo].cluster.smd", ex.key().orElseThrow());
  }

  @Test
  void scalarListsUseUnionSemantics() throws ConfigException {
    TreeValue.ListNode src = (TreeValue.ListNode) TreeValue.fromPlain(List.of("a", "b"));
    TreeValue.ListNode dst = (TreeValue.ListNode) TreeValue.fromPlain(List.of("b", "c"));

    TreeMerger.mergeLists(src, dst, "name");

    assertEquals(TreeValue.fromPlain(List.of("b", "c", "a")), dst);
  }

  @Test
  void mergingTreeWithItselfIsIdempotent() throws ConfigException {
    TreeValue.MapNode original = tree(Map.of(
        "default-cluster", "foo",
        "clusters", List.of(cluster("foo", ordered("uri", "https://foo.local")), cluster("bar", ordered()))));
    TreeValue.MapNode dst = original.deepCopy();

    TreeMerger.merge(original.deepCopy(), dst, "name");
    TreeMerger.mergeLists((TreeValue.ListNode) dst.get("clusters"), (TreeValue.ListNode) dst.get("clusters"),
        "name");

    assertEquals(original, dst);
  }

  @Test
  void sourceIsNotModified() throws ConfigException {
    TreeValue.MapNode src = tree(Map.of("log", Map.of("level", "info")));
    TreeValue.MapNode snapshot = src.deepCopy();
    TreeValue.MapNode dst = new TreeValue.MapNode();

    TreeMerger.merge(src, dst, "name");
    ((TreeValue.MapNode) dst.get("log")).put("level", new TreeValue.Scalar("error"));

    assertEquals(snapshot, src);
  }

  private static TreeValue.MapNode tree(Map<String, ?> plain) {
    try {
      return (TreeValue.MapNode) TreeValue.fromPlain(plain);
    } catch (ConfigException ex) {
      throw new AssertionError(ex);
    }
  }

  private static Map<String, Object> cluster(String name, Map<String, Object> body) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("name", name);
    entry.put("cluster", body);
    return entry;
  }

  private static Map<String, Object> ordered(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }
}
