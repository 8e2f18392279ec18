package org.openchami.ochami.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.openchami.ochami.config.tree.TreeValue;

/**
 * One loaded configuration layer, kept in both representations.
 *
 * <p>The raw {@code tree} is what the merge engine consumes; it carries no defaults so that absent keys can
 * still be filled by lower layers. The {@code typed} form is the strictly validated view of the same file.</p>
 *
 * @param origin layer kind
 * @param path file the layer was read from; {@code null} for {@link SourceOrigin#DEFAULT}
 * @param tree raw tree as parsed, before normalization
 * @param typed validated configuration for this layer alone
 * @since 0.1.0
 */
@SuppressFBWarnings(value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "Tree is handed to the merge engine as-is; callers copy before mutating.")
public record ConfigSource(SourceOrigin origin, Path path, TreeValue.MapNode tree, OchamiConfig typed) {
  /**
   * Validates required components.
   */
  public ConfigSource {
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(typed, "typed");
  }

  /**
   * Builds the built-in default layer.
   *
   * @return default layer
   */
  public static ConfigSource defaults() {
    OchamiConfig config = OchamiConfig.defaults();
    return new ConfigSource(SourceOrigin.DEFAULT, null, ConfigSchema.toTree(config), config);
  }

  /**
   * @return file path, or empty for the default layer
   */
  public Optional<Path> file() {
    return Optional.ofNullable(path);
  }

  /**
   * @return human-readable label for logs ({@code default} or the file path)
   */
  public String label() {
    return path == null ? "default" : path.toString();
  }
}
