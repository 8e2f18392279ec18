package org.openchami.ochami.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openchami.ochami.config.tree.Scalars;
import org.openchami.ochami.config.tree.TreeValue;
import org.slf4j.LoggerFactory;

class ConfigMutatorTest {

  @TempDir Path tempDir;

  private Path file;

  @BeforeEach
  void setUp() throws Exception {
    file = tempDir.resolve("config.yaml");
    Files.writeString(file, """
        log:
          format: json
          level: info
        default-cluster: foo
        clusters:
          - name: foo
            cluster:
              uri: https://foo.example.com/api
          - name: bar
            cluster:
              uri: https://bar.example.com
              enable-auth: false
        """);
  }

  @Test
  void setThenReadRoundTrip() throws Exception {
    OchamiConfig before = YamlConfigLoader.read(file);

    ConfigMutator.set(file, "log.level", Scalars.fromText("debug"));

    OchamiConfig after = YamlConfigLoader.read(file);
    assertEquals("debug", after.log().level());
    assertEquals("json", after.log().format());
    assertEquals(before.clusters(), after.clusters());
    assertEquals(before.defaultCluster(), after.defaultCluster());
  }

  @Test
  void setTimeoutFromText() throws Exception {
    ConfigMutator.set(file, "timeout", Scalars.fromText("2m"));

    assertEquals(Duration.ofMinutes(2), YamlConfigLoader.read(file).timeout());
  }

  @Test
  void setKeepsUnrelatedValuesExactlyAsWritten() throws Exception {
    Files.writeString(file, """
        timeout: 1s500us
        default-cluster: "no"
        clusters:
          - name: no
            cluster:
              uri: https://no.example.com
              boot-service:
                api-version: 1.10
        """);

    ConfigMutator.set(file, "log.level", Scalars.fromText("debug"));

    OchamiConfig after = YamlConfigLoader.read(file);
    assertEquals(Duration.ofSeconds(1).plusNanos(500_000), after.timeout());
    assertEquals("no", after.defaultCluster());
    assertEquals("1.10", after.cluster("no").cluster().service(ServiceName.BOOT_SERVICE).apiVersion());
  }

  @Test
  void enableAuthAcceptsNumericBooleans() throws Exception {
    ConfigMutator.setCluster(file, "foo", "cluster.enable-auth", Scalars.fromText("0"));
    assertFalse(YamlConfigLoader.read(file).cluster("foo").cluster().enableAuth());

    ConfigMutator.setCluster(file, "bar", "cluster.enable-auth", Scalars.fromText("1"));
    assertTrue(YamlConfigLoader.read(file).cluster("bar").cluster().enableAuth());
  }

  @Test
  void setUnknownKeyLeavesFileUntouched() throws Exception {
    String original = Files.readString(file);

    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigMutator.set(file, "log.colour", Scalars.fromText("blue")));

    assertEquals(ConfigErrorKind.UNKNOWN_KEY, ex.kind());
    assertEquals(original, Files.readString(file));
  }

  @Test
  void globalVariantsRejectClusterKeys() {
    ConfigException set = assertThrows(ConfigException.class,
        () -> ConfigMutator.set(file, "clusters.foo.uri", Scalars.fromText("https://x")));
    ConfigException get = assertThrows(ConfigException.class, () -> ConfigMutator.get(file, "clusters.foo"));

    assertEquals(ConfigErrorKind.INVALID_KEY, set.kind());
    assertEquals(ConfigErrorKind.INVALID_KEY, get.kind());
  }

  @Test
  void getReturnsValuesSubtreesAndWholeConfig() throws Exception {
    assertEquals(Optional.of(new TreeValue.Scalar("info")), ConfigMutator.get(file, "log.level"));
    assertTrue(ConfigMutator.get(file, "clusters").orElseThrow() instanceof TreeValue.ListNode);
    assertTrue(ConfigMutator.get(file, "").orElseThrow() instanceof TreeValue.MapNode);
    assertFalse(ConfigMutator.get(file, "timeout").isPresent());
  }

  @Test
  void unsetRemovesKey() throws Exception {
    ConfigMutator.unset(file, "log.level");

    OchamiConfig config = YamlConfigLoader.read(file);
    assertNull(config.log().level());
    assertEquals("json", config.log().format());
  }

  @Test
  void getClusterReadsRelativeKeys() throws Exception {
    assertEquals(Optional.of(new TreeValue.Scalar("https://foo.example.com/api")),
        ConfigMutator.getCluster(file, "foo", "cluster.uri"));
    assertEquals(Optional.of(new TreeValue.Scalar(true)),
        ConfigMutator.getCluster(file, "foo", "cluster.enable-auth"));
    assertEquals(ConfigErrorKind.CLUSTER_NOT_FOUND,
        assertThrows(ConfigException.class, () -> ConfigMutator.getCluster(file, "baz", "")).kind());
  }

  @Test
  void setClusterUpdatesExistingCluster() throws Exception {
    ConfigMutator.setCluster(file, "foo", "cluster.bss.uri", Scalars.fromText("/bss"));

    ClusterConfig foo = YamlConfigLoader.read(file).cluster("foo").cluster();
    assertEquals("/bss", foo.service(ServiceName.BSS).uri());
    assertEquals("https://foo.example.com/api", foo.uri());
  }

  @Test
  void setClusterAddsNewClusterWithAuthEnabled() throws Exception {
    ConfigMutator.setCluster(file, "baz", "cluster.uri", Scalars.fromText("https://baz.local"));

    OchamiConfig config = YamlConfigLoader.read(file);
    assertEquals(List.of("foo", "bar", "baz"), config.clusters().stream().map(ClusterEntry::name).toList());
    assertTrue(config.cluster("baz").cluster().enableAuth());
    assertEquals("foo", config.defaultCluster());
  }

  @Test
  void upsertClusterCanMakeDefault() throws Exception {
    ConfigMutator.upsertCluster(file, "bar", "cluster.smd.uri", Scalars.fromText("/hsm/v2"), true);

    assertEquals("bar", YamlConfigLoader.read(file).defaultCluster());
  }

  @Test
  void renamingDefaultClusterMovesDefault() throws Exception {
    ConfigMutator.setCluster(file, "foo", "name", Scalars.fromText("foo2"));

    OchamiConfig config = YamlConfigLoader.read(file);
    assertEquals("foo2", config.defaultCluster());
    assertEquals("https://foo.example.com/api", config.cluster("foo2").cluster().uri());
    assertFalse(config.findCluster("foo").isPresent());
  }

  @Test
  void renamingOtherClusterKeepsDefault() throws Exception {
    ConfigMutator.setCluster(file, "bar", "name", Scalars.fromText("bar2"));

    assertEquals("foo", YamlConfigLoader.read(file).defaultCluster());
  }

  @Test
  void renamingWithMakeDefaultUsesNewName() throws Exception {
    ConfigMutator.upsertCluster(file, "bar", "name", Scalars.fromText("bar2"), true);

    assertEquals("bar2", YamlConfigLoader.read(file).defaultCluster());
  }

  @Test
  void renamingOntoExistingNameFails() throws Exception {
    String original = Files.readString(file);

    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigMutator.setCluster(file, "foo", "name", Scalars.fromText("bar")));

    assertEquals(ConfigErrorKind.CANNOT_RENAME_TO_EXISTING, ex.kind());
    assertEquals(original, Files.readString(file));
  }

  @Test
  void unsetClusterKeyRestoresDefaults() throws Exception {
    ConfigMutator.unsetCluster(file, "bar", "cluster.enable-auth");

    assertTrue(YamlConfigLoader.read(file).cluster("bar").cluster().enableAuth());
  }

  @Test
  void clusterNameCannotBeUnset() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigMutator.unsetCluster(file, "foo", "name"));

    assertEquals(ConfigErrorKind.CANNOT_UNSET_NAME, ex.kind());
  }

  @Test
  void unsetOnMissingClusterFails() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigMutator.unsetCluster(file, "baz", "cluster.uri"));

    assertEquals(ConfigErrorKind.CLUSTER_NOT_FOUND, ex.kind());
  }

  @Test
  void deletingDefaultClusterClearsDefault() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(ConfigMutator.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      ConfigMutator.deleteCluster(file, "foo");
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    OchamiConfig config = YamlConfigLoader.read(file);
    assertNull(config.defaultCluster());
    assertEquals(List.of("bar"), config.clusters().stream().map(ClusterEntry::name).toList());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("foo was the default cluster")));
  }

  @Test
  void deletingOtherClusterKeepsDefault() throws Exception {
    ConfigMutator.deleteCluster(file, "bar");

    assertEquals("foo", YamlConfigLoader.read(file).defaultCluster());
    assertEquals(ConfigErrorKind.CLUSTER_NOT_FOUND,
        assertThrows(ConfigException.class, () -> ConfigMutator.deleteCluster(file, "bar")).kind());
  }

  @Test
  void setDefaultClusterRequiresExistingCluster() throws Exception {
    ConfigMutator.setDefaultCluster(file, "bar");
    assertEquals("bar", YamlConfigLoader.read(file).defaultCluster());

    ConfigException ex = assertThrows(ConfigException.class, () -> ConfigMutator.setDefaultCluster(file, "baz"));
    assertEquals(ConfigErrorKind.CLUSTER_NOT_FOUND, ex.kind());
  }

  @Test
  void editsOnMissingFileFail() {
    Path missing = tempDir.resolve("missing.yaml");

    ConfigException ex = assertThrows(ConfigException.class,
        () -> ConfigMutator.set(missing, "log.level", Scalars.fromText("debug")));

    assertEquals(ConfigErrorKind.SOURCE_NOT_FOUND, ex.kind());
    assertFalse(Files.exists(missing));
  }

  @Test
  void writesPreserveFilePermissions() throws Exception {
    assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));

    ConfigMutator.set(file, "log.level", Scalars.fromText("warning"));

    assertEquals(PosixFilePermissions.fromString("rw-------"), Files.getPosixFilePermissions(file));
  }
}
