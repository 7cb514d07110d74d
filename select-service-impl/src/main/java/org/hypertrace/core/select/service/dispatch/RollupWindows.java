package org.hypertrace.core.select.service.dispatch;

import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.params.DurationParser;

/** Parsing of the parts of a {@link RollupSugar}. */
final class RollupWindows {

  private RollupWindows() {}

  static long parseWindow(String window, long step) {
    long millis = parse("window", window, step, true);
    if (millis <= 0) {
      throw new RequestValidationException(
          String.format("cannot parse window: window must be positive; got %s", window));
    }
    return millis;
  }

  /** An empty step keeps the query step. */
  static long parseStep(String step, long defaultStep) {
    long millis = parse("step", step, defaultStep, true);
    return millis > 0 ? millis : defaultStep;
  }

  static long parseOffset(String offset, long step) {
    return parse("offset", offset, step, false);
  }

  private static long parse(String name, String value, long step, boolean positive) {
    try {
      return positive
          ? DurationParser.parsePositive(value, step)
          : DurationParser.parse(value, step);
    } catch (RequestValidationException e) {
      throw new RequestValidationException(
          String.format("cannot parse %s: %s", name, e.getMessage()), e);
    }
  }
}
