package org.openchami.ochami.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Serializes an {@link OchamiConfig} back to YAML and rewrites the target file.
 *
 * <p>The whole file is replaced; an existing file keeps its POSIX permission bits, a new file is created
 * {@code rw-r--r--}. Concurrent writers are not coordinated: the last write wins.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigWriter {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigWriter.class);
  private static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS =
      PosixFilePermissions.fromString("rw-r--r--");

  private YamlConfigWriter() {}

  /**
   * Writes {@code config} to {@code path}.
   *
   * @param path destination file; parent directories are created when missing
   * @param config configuration to persist
   * @throws IOException when the file cannot be written
   */
  public static void write(Path path, OchamiConfig config) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(config, "config");
    log.debug("Writing config file {}", path);

    String yaml = toYaml(config);
    Set<PosixFilePermission> permissions = currentPermissions(path);
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, yaml, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
    if (view != null) {
      view.setPermissions(permissions != null ? permissions : NEW_FILE_PERMISSIONS);
    }
    log.info("Wrote config to {}", path);
  }

  /**
   * Renders {@code config} as a block-style YAML document in schema key order.
   *
   * @param config configuration to render
   * @return YAML text; {@code {}} for an empty configuration
   */
  public static String toYaml(OchamiConfig config) {
    return newYaml().dump(ConfigSchema.toTree(config).toPlain());
  }

  static Yaml newYaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setIndicatorIndent(2);
    options.setIndentWithIndicator(true);
    return new Yaml(options);
  }

  private static Set<PosixFilePermission> currentPermissions(Path path) throws IOException {
    if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
      return null;
    }
    PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
    return view == null ? null : view.readAttributes().permissions();
  }
}
