package org.hypertrace.core.select.service.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.hypertrace.core.select.service.RequestValidationException;
import org.junit.jupiter.api.Test;

class RollupWindowsTest {
  private static final long STEP = 60_000;

  @Test
  void parsesWindowInStepUnits() {
    assertEquals(300_000, RollupWindows.parseWindow("5m", STEP));
    assertEquals(180_000, RollupWindows.parseWindow("3i", STEP));
  }

  @Test
  void rejectsEmptyAndNegativeWindows() {
    RequestValidationException empty =
        assertThrows(RequestValidationException.class, () -> RollupWindows.parseWindow("", STEP));
    assertEquals("cannot parse window: window must be positive; got ", empty.getMessage());

    RequestValidationException negative =
        assertThrows(
            RequestValidationException.class, () -> RollupWindows.parseWindow("-5m", STEP));
    assertEquals(
        "cannot parse window: duration cannot be negative; got -5m", negative.getMessage());
  }

  @Test
  void keepsQueryStepForEmptyOrZeroStep() {
    assertEquals(STEP, RollupWindows.parseStep("", STEP));
    assertEquals(STEP, RollupWindows.parseStep("0", STEP));
    assertEquals(30_000, RollupWindows.parseStep("30s", STEP));
  }

  @Test
  void allowsNegativeOffsets() {
    assertEquals(0, RollupWindows.parseOffset("", STEP));
    assertEquals(-3_600_000, RollupWindows.parseOffset("-1h", STEP));
    assertThrows(RequestValidationException.class, () -> RollupWindows.parseOffset("1x", STEP));
  }
}
