package org.openchami.ochami.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.openchami.ochami.config.tree.TreeValue;

class ConfigSchemaTest {

  @Test
  void treeRoundTripPreservesConfig() throws ConfigException {
    ClusterConfig cluster = new ClusterConfig("https://foo.example.com", false, Map.of(
        ServiceName.SMD, ServiceConfig.ofUri("/hsm/v2"),
        ServiceName.BOOT_SERVICE, new ServiceConfig("https://boot.example.com", "v1")));
    OchamiConfig config = new OchamiConfig(new LogConfig("json", "debug"), Duration.ofSeconds(90), "foo",
        List.of(new ClusterEntry("foo", cluster), new ClusterEntry("bar", ClusterConfig.EMPTY)));

    TreeValue.MapNode tree = ConfigSchema.toTree(config);

    assertEquals(new TreeValue.Scalar("1m30s"), tree.get("timeout"));
    assertEquals(config, ConfigSchema.materialize(tree));
  }

  @Test
  void clusterTreeAlwaysCarriesEnableAuth() {
    TreeValue.MapNode entry = ConfigSchema.clusterToTree(new ClusterEntry("foo", ClusterConfig.EMPTY));

    TreeValue.MapNode body = (TreeValue.MapNode) entry.get("cluster");
    assertEquals(new TreeValue.Scalar(true), body.get("enable-auth"));
    assertEquals(new TreeValue.Scalar("foo"), entry.get("name"));
  }

  @Test
  void materializeDefaultsMissingEnableAuthToTrue() throws ConfigException {
    OchamiConfig config = ConfigSchema.materialize(tree(Map.of("clusters",
        List.of(Map.of("name", "foo", "cluster", Map.of("uri", "https://foo.local"))))));

    assertTrue(config.cluster("foo").cluster().enableAuth());
  }

  @Test
  void materializeLeavesInputUntouched() throws ConfigException {
    TreeValue.MapNode input = tree(Map.of("clusters",
        List.of(Map.of("name", "foo", "cluster", Map.of("uri", "https://foo.local")))));
    TreeValue.MapNode snapshot = input.deepCopy();

    ConfigSchema.materialize(input);

    assertEquals(snapshot, input);
  }

  @Test
  void unknownRootKeyIsRejected() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigSchema.materialize(tree(Map.of("bogus", 1))));

    assertEquals(ConfigErrorKind.UNKNOWN_KEY, ex.kind());
    assertEquals("bogus", ex.key().orElseThrow());
  }

  @Test
  void apiVersionIsOnlyKnownForBootService() {
    ConfigException ex = assertThrows(ConfigException.class, () -> ConfigSchema.materialize(tree(Map.of(
        "clusters", List.of(Map.of("name", "foo", "cluster", Map.of("bss", Map.of("api-version", "v2"))))))));

    assertEquals(ConfigErrorKind.UNKNOWN_KEY, ex.kind());
    assertEquals("clusters[0].cluster.bss.api-version", ex.key().orElseThrow());
  }

  @Test
  void nonBooleanEnableAuthIsInvalid() {
    ConfigException ex = assertThrows(ConfigException.class, () -> ConfigSchema.materialize(tree(Map.of(
        "clusters", List.of(Map.of("name", "foo", "cluster", Map.of("enable-auth", "yes")))))));

    assertEquals(ConfigErrorKind.INVALID_VALUE, ex.kind());
  }

  @Test
  void timeoutAcceptsSecondsAndDurations() throws ConfigException {
    assertEquals(Duration.ofSeconds(45), ConfigSchema.materialize(tree(Map.of("timeout", 45))).timeout());
    assertEquals(Duration.ofMillis(500), ConfigSchema.materialize(tree(Map.of("timeout", "500ms"))).timeout());

    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigSchema.materialize(tree(Map.of("timeout", "soon"))));
    assertEquals(ConfigErrorKind.INVALID_VALUE, ex.kind());
  }

  @Test
  void logMustBeAMap() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigSchema.materialize(tree(Map.of("log", "debug"))));

    assertEquals(ConfigErrorKind.INVALID_VALUE, ex.kind());
    assertEquals("log", ex.key().orElseThrow());
  }

  @Test
  void clusterWithoutNameIsInvalid() {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("cluster", Map.of("uri", "https://foo.local"));

    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigSchema.materialize(tree(Map.of("clusters", List.of(entry)))));

    assertEquals(ConfigErrorKind.INVALID_VALUE, ex.kind());
    assertEquals("clusters[0].name", ex.key().orElseThrow());
  }

  private static TreeValue.MapNode tree(Map<String, ?> plain) throws ConfigException {
    return (TreeValue.MapNode) TreeValue.fromPlain(plain);
  }
}
