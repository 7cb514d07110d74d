package org.hypertrace.core.select.service.params;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.Deadline;
import org.hypertrace.core.select.service.api.SelectRequest;

/** Typed accessors for request arguments. Missing or empty arguments yield the default. */
public class RequestParams {
  public static final String ARG_MATCH = "match[]";
  public static final String ARG_MATCH_LEGACY = "match";

  static final long MIN_TIME_MILLIS = 0;
  // the largest timestamp that still fits into int64 nanoseconds
  static final long MAX_TIME_MILLIS = Long.MAX_VALUE / 1_000_000;
  static final long MAX_DURATION_MILLIS = 100L * 365 * 24 * 3600 * 1000;

  private RequestParams() {}

  /** Reads unix seconds (possibly fractional) or an RFC3339 time and returns milliseconds. */
  public static long getTime(SelectRequest request, String argKey, long defaultMillis) {
    String value = request.getFormValue(argKey);
    if (value.isEmpty()) {
      return defaultMillis;
    }
    double secs;
    if (DurationParser.isNumber(value) || isSignedNumber(value)) {
      secs = Double.parseDouble(value);
    } else {
      try {
        Instant instant = OffsetDateTime.parse(value).toInstant();
        secs = instant.getEpochSecond() + instant.getNano() / 1e9;
      } catch (DateTimeParseException e) {
        throw new RequestValidationException(
            String.format("cannot parse %s=%s: %s", argKey, value, e.getMessage()), e);
      }
    }
    double millis = secs * 1000;
    if (millis < MIN_TIME_MILLIS) {
      return MIN_TIME_MILLIS;
    }
    if (millis > MAX_TIME_MILLIS) {
      return MAX_TIME_MILLIS;
    }
    return (long) millis;
  }

  /** Reads seconds or a duration string; the result must be in {@code (0, 100y]}. */
  public static long getDuration(SelectRequest request, String argKey, long defaultMillis) {
    String value = request.getFormValue(argKey);
    if (value.isEmpty()) {
      return defaultMillis;
    }
    long millis;
    try {
      millis = DurationParser.parse(value, 0);
    } catch (RequestValidationException e) {
      throw new RequestValidationException(
          String.format("cannot parse %s=%s: %s", argKey, value, e.getMessage()), e);
    }
    if (millis <= 0 || millis > MAX_DURATION_MILLIS) {
      throw new RequestValidationException(
          String.format(
              "%s=%dms is out of allowed range [%d ... %d]",
              argKey, millis, 0, MAX_DURATION_MILLIS));
    }
    return millis;
  }

  public static long getInt64(SelectRequest request, String argKey, long defaultValue) {
    String value = request.getFormValue(argKey);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new RequestValidationException(
          String.format("cannot parse %s=%s: %s", argKey, value, e.getMessage()), e);
    }
  }

  /** Empty, {@code 0}, {@code f}, {@code false} and {@code no} are false; anything else is true. */
  public static boolean getBool(SelectRequest request, String argKey) {
    switch (request.getFormValue(argKey).toLowerCase(Locale.ROOT)) {
      case "":
      case "0":
      case "f":
      case "false":
      case "no":
        return false;
      default:
        return true;
    }
  }

  public static String getString(SelectRequest request, String argKey, String defaultValue) {
    return StringUtils.defaultIfEmpty(request.getFormValue(argKey), defaultValue);
  }

  public static String getRequiredString(SelectRequest request, String argKey) {
    String value = request.getFormValue(argKey);
    if (value.isEmpty()) {
      throw new RequestValidationException(String.format("missing `%s` arg", argKey));
    }
    return value;
  }

  /**
   * Returns the {@code match[]} values. When {@code acceptLegacyMatch} is set a single {@code
   * match} argument is accepted as well.
   */
  public static List<String> getMatches(SelectRequest request, boolean acceptLegacyMatch) {
    List<String> matches = request.getFormValues(ARG_MATCH);
    if (!matches.isEmpty()) {
      return matches;
    }
    if (acceptLegacyMatch) {
      String match = request.getFormValue(ARG_MATCH_LEGACY);
      if (!match.isEmpty()) {
        return List.of(match);
      }
    }
    throw new RequestValidationException(String.format("missing `%s` arg", ARG_MATCH));
  }

  /**
   * Deadline from the {@code timeout} argument, capped by the configured maximum.
   *
   * @param flagHint name of the setting holding {@code maxTimeout}
   */
  public static Deadline getDeadline(
      SelectRequest request, Instant startTime, Duration maxTimeout, String flagHint) {
    long maxMillis = maxTimeout.toMillis();
    long timeout = getDuration(request, "timeout", 0);
    long millis = timeout > 0 && timeout < maxMillis ? timeout : maxMillis;
    return Deadline.after(startTime, Duration.ofMillis(millis), flagHint);
  }

  private static boolean isSignedNumber(String value) {
    return (value.startsWith("-") || value.startsWith("+"))
        && DurationParser.isNumber(value.substring(1));
  }
}
