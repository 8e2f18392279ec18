package org.openchami.ochami.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.openchami.ochami.config.tree.TreeMerger;
import org.openchami.ochami.config.tree.TreeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the effective configuration from the built-in default, the system file,
 * and the user file, or from one explicitly named file.
 * <p><strong>Precedence:</strong> default &lt; system file &lt; user file. Each higher layer is merged as the
 * destination of {@link TreeMerger#merge}, so its values are kept and the layers below only fill its gaps.
 * Absent files are skipped; a file that fails to parse or validate fails the whole resolution.</p>
 * <p><strong>Explicit file:</strong> {@link #resolve(Path)} loads that file alone. It replaces the cascade
 * rather than adding a layer to it.</p>
 * <p><strong>Thread-safety:</strong> Immutable; results are independent {@link ResolvedConfig} handles.</p>
 * <p><strong>Observability:</strong> Logs each layer decision at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class CascadeResolver {
  private static final Logger log = LoggerFactory.getLogger(CascadeResolver.class);

  private final ConfigSearchPaths paths;

  /**
   * Creates a resolver for the given search paths.
   *
   * @param paths system and user file locations
   */
  public CascadeResolver(ConfigSearchPaths paths) {
    this.paths = Objects.requireNonNull(paths, "paths");
  }

  /**
   * @return resolver for the standard locations of the running process
   */
  public static CascadeResolver withDefaultPaths() {
    return new CascadeResolver(ConfigSearchPaths.defaults());
  }

  /**
   * Resolves default, system, and user layers.
   *
   * @return resolved configuration
   * @throws IOException when an existing file cannot be read
   * @throws ConfigException when a file is malformed or invalid, layers conflict structurally, or the merged
   *     result fails validation
   */
  public ResolvedConfig resolve() throws IOException, ConfigException {
    List<ConfigSource> layers = new ArrayList<>();
    log.debug("Starting with default config");
    layers.add(ConfigSource.defaults());
    addIfPresent(layers, paths.systemFile(), SourceOrigin.SYSTEM_FILE);
    addIfPresent(layers, paths.userFile(), SourceOrigin.USER_FILE);
    ResolvedConfig resolved = cascade(layers);
    log.debug("Config files, if any, have been merged");
    return resolved;
  }

  /**
   * Resolves from {@code explicitFile} alone, or runs the cascade when it is {@code null}.
   *
   * @param explicitFile file named by the caller, or {@code null}
   * @return resolved configuration
   * @throws IOException when the file cannot be read
   * @throws ConfigException with {@link ConfigErrorKind#SOURCE_NOT_FOUND} when the explicit file is missing,
   *     or any parse or validation failure
   */
  public ResolvedConfig resolve(Path explicitFile) throws IOException, ConfigException {
    if (explicitFile == null) {
      return resolve();
    }
    log.debug("Reading config from explicitly given file {}", explicitFile);
    ConfigSource source = YamlConfigLoader.loadRequired(explicitFile, SourceOrigin.EXPLICIT_FILE);
    return new ResolvedConfig(source.typed(), source.tree(), List.of(source));
  }

  /**
   * Merges already-loaded layers and materializes the result.
   *
   * @param layers layers ordered lowest precedence first; must not be empty
   * @return resolved configuration
   * @throws ConfigException when layers conflict structurally or the merged tree fails validation
   */
  public static ResolvedConfig cascade(List<ConfigSource> layers) throws ConfigException {
    if (layers == null || layers.isEmpty()) {
      throw new IllegalArgumentException("at least one configuration layer is required");
    }
    TreeValue.MapNode merged = layers.get(0).tree().deepCopy();
    for (ConfigSource layer : layers.subList(1, layers.size())) {
      log.debug("Merging in config from {}", layer.label());
      TreeValue.MapNode higher = layer.tree().deepCopy();
      try {
        merged = TreeMerger.merge(merged, higher, ConfigSchema.CLUSTER_NAME);
      } catch (ConfigException ex) {
        throw ex.inFile(layer.path());
      }
    }
    OchamiConfig config = ConfigSchema.materialize(merged);
    return new ResolvedConfig(config, merged, layers);
  }

  private static void addIfPresent(List<ConfigSource> layers, Path file, SourceOrigin origin)
      throws IOException, ConfigException {
    Optional<ConfigSource> source = YamlConfigLoader.load(file, origin);
    if (source.isEmpty()) {
      log.debug("Config file {} not found, skipping", file);
      return;
    }
    layers.add(source.get());
  }
}
