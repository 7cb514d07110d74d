package org.hypertrace.core.select.service.params;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.hypertrace.core.select.service.RequestValidationException;

/**
 * Parses durations such as {@code 500ms}, {@code 1h30m}, {@code -5m} or {@code 2i} into
 * milliseconds. A bare number is read as seconds; the {@code i} unit is a multiple of the query
 * step.
 */
public class DurationParser {
  private static final Pattern NUMBER =
      Pattern.compile("[0-9]+(\\.[0-9]*)?([eE][-+]?[0-9]+)?|\\.[0-9]+([eE][-+]?[0-9]+)?");
  private static final Pattern PART =
      Pattern.compile("([0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(ms|s|m|h|d|w|y|i)");

  private static final long MINUTE = 60 * 1000L;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;

  private DurationParser() {}

  /** Parses a possibly negative duration; an empty string is a zero duration. */
  public static long parse(String s, long step) {
    if (s.isEmpty()) {
      return 0;
    }
    if (s.startsWith("-")) {
      return -parseUnsigned(s.substring(1), step, s);
    }
    return parseUnsigned(s, step, s);
  }

  /** Same as {@link #parse} but rejects negative durations. */
  public static long parsePositive(String s, long step) {
    long d = parse(s, step);
    if (d < 0) {
      throw new RequestValidationException(
          String.format("duration cannot be negative; got %s", s));
    }
    return d;
  }

  static boolean isNumber(String s) {
    return NUMBER.matcher(s).matches();
  }

  private static long parseUnsigned(String s, long step, String input) {
    if (s.isEmpty()) {
      throw invalid(input);
    }
    if (isNumber(s)) {
      return Math.round(Double.parseDouble(s) * 1000);
    }
    Matcher matcher = PART.matcher(s);
    double total = 0;
    int pos = 0;
    while (pos < s.length()) {
      matcher.region(pos, s.length());
      if (!matcher.lookingAt()) {
        throw invalid(input);
      }
      total += Double.parseDouble(matcher.group(1)) * unitMillis(matcher.group(2), step);
      pos = matcher.end();
    }
    return Math.round(total);
  }

  private static double unitMillis(String unit, long step) {
    switch (unit) {
      case "ms":
        return 1;
      case "s":
        return 1000;
      case "m":
        return MINUTE;
      case "h":
        return HOUR;
      case "d":
        return DAY;
      case "w":
        return 7 * DAY;
      case "y":
        return 365 * DAY;
      case "i":
        return step;
      default:
        throw new IllegalStateException("unexpected duration unit " + unit);
    }
  }

  private static RequestValidationException invalid(String s) {
    return new RequestValidationException(String.format("cannot parse duration %s", s));
  }
}
