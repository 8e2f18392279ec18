package org.openchami.ochami.config;

import java.util.regex.Pattern;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Implicit typing for plain scalars in configuration files.
 *
 * <p>A plain scalar is typed only when its canonical Java text is the text written in the file:
 * {@code true}/{@code false} in the three YAML 1.2 spellings, null, and decimal integers without leading
 * zeros. Everything else stays a string, so {@code no}, {@code 1.10}, {@code 012}, {@code 0x1F} and dates
 * keep the exact characters the user wrote when the file is read and rewritten.</p>
 */
final class CanonicalScalarResolver extends Resolver {
  private static final Pattern CORE_BOOL = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");
  private static final Pattern CANONICAL_INT = Pattern.compile("^-?(?:0|[1-9][0-9]*)$");

  @Override
  protected void addImplicitResolvers() {
    addImplicitResolver(Tag.BOOL, CORE_BOOL, "tTfF");
    addImplicitResolver(Tag.INT, CANONICAL_INT, "-0123456789");
    addImplicitResolver(Tag.NULL, NULL, "~nN\0");
    addImplicitResolver(Tag.NULL, EMPTY, null);
  }
}
