package io.intellixity.discover.validate;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relative period expressions such as {@code 14d}, {@code 24h}, {@code 30m}, {@code 2w} or {@code 3600}
 * (no unit means seconds).
 */
public final class StatsPeriod {
  private StatsPeriod() {}

  private static final Pattern PERIOD = Pattern.compile("^(\\d+)([hdmsw]?)$");

  /** Returns the parsed duration, or null when the expression is malformed or out of range. */
  public static Duration parse(String period) {
    if (period == null) return null;
    Matcher m = PERIOD.matcher(period);
    if (!m.matches()) return null;
    try {
      long value = Long.parseLong(m.group(1));
      return switch (m.group(2)) {
        case "w" -> Duration.ofDays(Math.multiplyExact(value, 7L));
        case "d" -> Duration.ofDays(value);
        case "h" -> Duration.ofHours(value);
        case "m" -> Duration.ofMinutes(value);
        default -> Duration.ofSeconds(value);
      };
    } catch (ArithmeticException | NumberFormatException e) {
      return null;
    }
  }
}
