package org.openchami.ochami.config;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.Map;
import org.openchami.ochami.config.tree.TreeValue;

/**
 * Renders configuration values for display.
 *
 * <p>Maps and lists are serialized as {@code yaml}, {@code json}, or {@code json-pretty}. Scalars print as
 * plain text in every format and an unset value prints as the empty string.</p>
 *
 * @since 0.1.0
 */
public final class ConfigValueFormatter {
  /** Default display format. */
  public static final String YAML = "yaml";
  /** Compact single-line JSON. */
  public static final String JSON = "json";
  /** Tab-indented JSON. */
  public static final String JSON_PRETTY = "json-pretty";

  private static final JsonFactory JSON_FACTORY = new JsonFactory();

  private ConfigValueFormatter() {
    // Utility
  }

  /**
   * Formats {@code value} in the requested format.
   *
   * @param value value to render; may be {@code null}
   * @param format one of {@code yaml}, {@code json}, {@code json-pretty}
   * @return rendered text without a trailing newline
   * @throws IllegalArgumentException when the format is unknown
   */
  public static String format(TreeValue value, String format) {
    if (!YAML.equals(format) && !JSON.equals(format) && !JSON_PRETTY.equals(format)) {
      throw new IllegalArgumentException("unknown format: " + format);
    }
    if (value == null) {
      return "";
    }
    if (value instanceof TreeValue.Scalar scalar) {
      return scalar.isNull() ? "" : scalar.asText();
    }
    if (YAML.equals(format)) {
      return stripTrailingNewline(YamlConfigWriter.newYaml().dump(value.toPlain()));
    }
    return toJson(value, JSON_PRETTY.equals(format));
  }

  private static String toJson(TreeValue value, boolean pretty) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = JSON_FACTORY.createGenerator(out)) {
      if (pretty) {
        DefaultIndenter indenter = new DefaultIndenter("\t", "\n");
        Separators separators = Separators.createDefaultInstance()
            .withObjectFieldValueSpacing(Separators.Spacing.AFTER);
        gen.setPrettyPrinter(new DefaultPrettyPrinter(separators)
            .withObjectIndenter(indenter)
            .withArrayIndenter(indenter));
      }
      writeValue(gen, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render value as JSON", ex);
    }
    return out.toString();
  }

  private static void writeValue(JsonGenerator gen, TreeValue value) throws IOException {
    if (value instanceof TreeValue.MapNode map) {
      gen.writeStartObject();
      for (Map.Entry<String, TreeValue> entry : map.entries().entrySet()) {
        gen.writeFieldName(entry.getKey());
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof TreeValue.ListNode list) {
      gen.writeStartArray();
      for (TreeValue item : list.items()) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      writeScalar(gen, ((TreeValue.Scalar) value).value());
    }
  }

  private static void writeScalar(JsonGenerator gen, Object payload) throws IOException {
    if (payload == null) {
      gen.writeNull();
    } else if (payload instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (payload instanceof Long number) {
      gen.writeNumber(number);
    } else if (payload instanceof BigInteger number) {
      gen.writeNumber(number);
    } else if (payload instanceof Double number) {
      gen.writeNumber(number);
    } else {
      gen.writeString(String.valueOf(payload));
    }
  }

  private static String stripTrailingNewline(String text) {
    return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
  }
}
