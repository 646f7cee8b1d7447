package org.hypertrace.core.query.frontend.matchers;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses durations in the query language form, such as {@code 5m}, {@code 1h30m} or {@code 2d}. */
public class PromDurations {
  private static final Pattern DURATION_PATTERN =
      Pattern.compile("^(-?)((\\d+(ms|s|m|h|d|w|y))+)$");
  private static final Pattern UNIT_PATTERN = Pattern.compile("(\\d+)(ms|s|m|h|d|w|y)");
  private static final Map<String, Duration> UNITS =
      Map.of(
          "ms", Duration.ofMillis(1),
          "s", Duration.ofSeconds(1),
          "m", Duration.ofMinutes(1),
          "h", Duration.ofHours(1),
          "d", Duration.ofDays(1),
          "w", Duration.ofDays(7),
          "y", Duration.ofDays(365));

  public static Duration parse(String text) {
    Matcher matcher = DURATION_PATTERN.matcher(text.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid duration: " + text);
    }
    Duration total = Duration.ZERO;
    Matcher unitMatcher = UNIT_PATTERN.matcher(matcher.group(2));
    try {
      while (unitMatcher.find()) {
        Duration unit = UNITS.get(unitMatcher.group(2));
        total = total.plus(unit.multipliedBy(Long.parseLong(unitMatcher.group(1))));
      }
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Duration out of range: " + text, e);
    }
    return matcher.group(1).isEmpty() ? total : total.negated();
  }

  private PromDurations() {}
}
