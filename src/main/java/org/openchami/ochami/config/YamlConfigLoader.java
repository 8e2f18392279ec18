package org.openchami.ochami.config;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.openchami.ochami.config.tree.TreeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.representer.Representer;

/**
 * <strong>What:</strong> Reads one configuration file into a {@link ConfigSource}.
 * <p><strong>Why:</strong> Each file is kept twice: as a raw tree for merging and as a validated typed
 * configuration, so a broken file is reported against its own path before any merge happens.</p>
 * <p><strong>Role:</strong> Source loader used by {@link CascadeResolver} and {@link ConfigMutator}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a new SnakeYAML instance is created per call.</p>
 * <p><strong>Observability:</strong> Logs file reads at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} if it exists.
   *
   * @param path configuration file
   * @param origin layer kind recorded on the result
   * @return loaded source, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws ConfigException when the content is malformed or fails strict validation
   */
  public static Optional<ConfigSource> load(Path path, SourceOrigin origin)
      throws IOException, ConfigException {
    Objects.requireNonNull(path, "path");
    String text;
    try {
      text = Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
    log.debug("Read config file {}", path);
    return Optional.of(parse(text, path, origin));
  }

  /**
   * Loads {@code path}, failing when it does not exist.
   *
   * @param path configuration file
   * @param origin layer kind recorded on the result
   * @return loaded source
   * @throws IOException when the file cannot be read
   * @throws ConfigException with {@link ConfigErrorKind#SOURCE_NOT_FOUND} when the file is missing, or any
   *     parse or validation failure
   */
  public static ConfigSource loadRequired(Path path, SourceOrigin origin) throws IOException, ConfigException {
    Optional<ConfigSource> source = load(path, origin);
    if (source.isEmpty()) {
      throw new ConfigException(ConfigErrorKind.SOURCE_NOT_FOUND, "config file not found").inFile(path);
    }
    return source.get();
  }

  /**
   * Reads the typed configuration of a single file with no cascading.
   *
   * @param path configuration file
   * @return validated configuration
   * @throws IOException when the file cannot be read
   * @throws ConfigException when the file is missing, malformed, or invalid
   */
  public static OchamiConfig read(Path path) throws IOException, ConfigException {
    return loadRequired(path, SourceOrigin.EXPLICIT_FILE).typed();
  }

  /**
   * Parses YAML text into a source.
   *
   * @param text YAML document; an empty document yields an empty configuration
   * @param path file the text came from, used in diagnostics; may be {@code null}
   * @param origin layer kind recorded on the result
   * @return parsed source
   * @throws ConfigException when the text is malformed or fails strict validation
   */
  public static ConfigSource parse(String text, Path path, SourceOrigin origin) throws ConfigException {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(origin, "origin");

    // Typed path: composed node graph keeps marks for presence checks and line numbers.
    Node document;
    Object raw;
    try {
      Yaml yaml = newYaml();
      document = yaml.compose(new StringReader(text));
      raw = yaml.load(text);
    } catch (MarkedYAMLException ex) {
      Mark mark = ex.getProblemMark() != null ? ex.getProblemMark() : ex.getContextMark();
      int line = mark == null ? -1 : mark.getLine() + 1;
      throw parseError("malformed YAML: " + ex.getProblem(), ex, path, line);
    } catch (YAMLException ex) {
      throw parseError("malformed YAML: " + ex.getMessage(), ex, path, -1);
    }

    YamlLineIndex lines = YamlLineIndex.of(document);
    TreeValue.MapNode tree;
    OchamiConfig typed;
    try {
      if (document != null && !(document instanceof MappingNode)) {
        throw new ConfigException(ConfigErrorKind.PARSE_ERROR,
            "configuration root must be a mapping, got " + document.getNodeId());
      }
      checkEnableAuthValues(document);
      TreeValue root = raw == null ? new TreeValue.MapNode() : TreeValue.fromPlain(raw);
      if (!(root instanceof TreeValue.MapNode map)) {
        throw new ConfigException(ConfigErrorKind.PARSE_ERROR,
            "configuration root must be a mapping, got " + root.typeName());
      }
      tree = map;
      typed = ConfigSchema.materialize(tree);
    } catch (ConfigException ex) {
      int line = ex.key().map(lines::lineOf).orElse(-1);
      throw ex.inFile(path, line);
    }
    return new ConfigSource(origin, path, tree, typed);
  }

  private static void checkEnableAuthValues(Node document) throws ConfigException {
    Node clusters = child(document, ConfigSchema.CLUSTERS);
    if (!(clusters instanceof SequenceNode sequence)) {
      return;
    }
    int index = 0;
    for (Node item : sequence.getValue()) {
      Node body = child(item, ConfigSchema.CLUSTER);
      if (body instanceof MappingNode mapping) {
        for (NodeTuple tuple : mapping.getValue()) {
          if (tuple.getKeyNode() instanceof ScalarNode key
              && ConfigSchema.ENABLE_AUTH.equals(key.getValue())
              && tuple.getValueNode() instanceof ScalarNode value
              && value.getValue().isEmpty()) {
            String keyPath = ConfigSchema.CLUSTERS + '[' + index + "]." + ConfigSchema.CLUSTER + '.'
                + ConfigSchema.ENABLE_AUTH;
            throw ConfigException.atLine(ConfigErrorKind.INVALID_VALUE, keyPath,
                key.getStartMark().getLine() + 1,
                "invalid value for key \"" + ConfigSchema.ENABLE_AUTH
                    + "\": got empty value but expected true or false");
          }
        }
      }
      index++;
    }
  }

  private static Node child(Node node, String key) {
    if (!(node instanceof MappingNode mapping)) {
      return null;
    }
    for (NodeTuple tuple : mapping.getValue()) {
      if (tuple.getKeyNode() instanceof ScalarNode keyNode && key.equals(keyNode.getValue())) {
        return tuple.getValueNode();
      }
    }
    return null;
  }

  private static ConfigException parseError(String message, Throwable cause, Path path, int line) {
    return new ConfigException(ConfigErrorKind.PARSE_ERROR, message, cause).inFile(path, line);
  }

  private static Yaml newYaml() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    DumperOptions dumperOptions = new DumperOptions();
    return new Yaml(new SafeConstructor(options), new Representer(dumperOptions), dumperOptions, options,
        new CanonicalScalarResolver());
  }
}
