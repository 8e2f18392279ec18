package org.openchami.ochami.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats durations written the way the Go client wrote them ({@code 30s}, {@code 1m30s},
 * {@code 250ms}, {@code 1h}).
 *
 * <p>Supported units: {@code h}, {@code m}, {@code s}, {@code ms}, {@code us}, {@code ns}. Each component may
 * carry a decimal fraction. A bare non-negative integer is read as seconds.</p>
 *
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|ms|h|m|s)");
  private static final Pattern BARE_SECONDS = Pattern.compile("\\d+");

  private Durations() {
    // Utility
  }

  /**
   * Parses a duration string.
   *
   * @param text duration text such as {@code 1m30s}
   * @return parsed duration
   * @throws IllegalArgumentException when {@code text} is blank or malformed, or the total does not fit in a
   *     signed 64-bit count of nanoseconds
   */
  public static Duration parse(String text) {
    String trimmed = Strings.requireNonBlank("duration", text).toLowerCase(Locale.ROOT);
    if (BARE_SECONDS.matcher(trimmed).matches()) {
      return toDuration(new BigDecimal(trimmed).multiply(unitNanos("s")), text);
    }
    Matcher matcher = COMPONENT.matcher(trimmed);
    int position = 0;
    BigDecimal nanos = BigDecimal.ZERO;
    while (matcher.find()) {
      if (matcher.start() != position) {
        break;
      }
      nanos = nanos.add(new BigDecimal(matcher.group(1)).multiply(unitNanos(matcher.group(2))));
      position = matcher.end();
    }
    if (position == 0 || position != trimmed.length()) {
      throw new IllegalArgumentException("invalid duration: " + text);
    }
    return toDuration(nanos, text);
  }

  // Totals must fit in a signed 64-bit nanosecond count.
  private static Duration toDuration(BigDecimal nanos, String text) {
    try {
      return Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("invalid duration: " + text + " is out of range", ex);
    }
  }

  /**
   * Formats a duration in the compact form accepted by {@link #parse(String)}.
   *
   * @param duration duration to format; must not be negative
   * @return compact text such as {@code 1m30s} or {@code 1s500us}; every unit down to nanoseconds is kept
   */
  public static String format(Duration duration) {
    if (duration.isZero()) {
      return "0s";
    }
    StringBuilder out = new StringBuilder();
    long subSecond = duration.toNanosPart();
    appendPart(out, duration.toHours(), "h");
    appendPart(out, duration.toMinutesPart(), "m");
    appendPart(out, duration.toSecondsPart(), "s");
    appendPart(out, subSecond / 1_000_000, "ms");
    appendPart(out, subSecond / 1_000 % 1_000, "us");
    appendPart(out, subSecond % 1_000, "ns");
    return out.toString();
  }

  private static void appendPart(StringBuilder out, long amount, String unit) {
    if (amount > 0) {
      out.append(amount).append(unit);
    }
  }

  private static BigDecimal unitNanos(String unit) {
    switch (unit) {
      case "h":
        return BigDecimal.valueOf(3_600_000_000_000L);
      case "m":
        return BigDecimal.valueOf(60_000_000_000L);
      case "s":
        return BigDecimal.valueOf(1_000_000_000L);
      case "ms":
        return BigDecimal.valueOf(1_000_000L);
      case "us":
        return BigDecimal.valueOf(1_000L);
      default:
        return BigDecimal.ONE;
    }
  }
}
