package org.openchami.ochami.config.tree;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts command-line text into the most specific scalar it represents.
 *
 * <p>Recognized forms, in order: boolean ({@code true}/{@code false}/{@code t}/{@code f},
 * case-insensitive), integer, decimal floating point. Anything else stays a string.</p>
 *
 * @since 0.1.0
 */
public final class Scalars {
  private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
  private static final Pattern FLOAT = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private Scalars() {
    // Utility
  }

  /**
   * Parses {@code text} into a scalar tree value.
   *
   * @param text raw text; {@code null} becomes a null scalar
   * @return typed scalar
   */
  public static TreeValue.Scalar fromText(String text) {
    if (text == null) {
      return new TreeValue.Scalar(null);
    }
    switch (text.toLowerCase(Locale.ROOT)) {
      case "true", "t":
        return new TreeValue.Scalar(Boolean.TRUE);
      case "false", "f":
        return new TreeValue.Scalar(Boolean.FALSE);
      default:
        break;
    }
    if (INTEGER.matcher(text).matches()) {
      BigInteger value = new BigInteger(text);
      if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
        return new TreeValue.Scalar(value.longValue());
      }
      return new TreeValue.Scalar(value);
    }
    if (FLOAT.matcher(text).matches()) {
      return new TreeValue.Scalar(Double.parseDouble(text));
    }
    return new TreeValue.Scalar(text);
  }
}
