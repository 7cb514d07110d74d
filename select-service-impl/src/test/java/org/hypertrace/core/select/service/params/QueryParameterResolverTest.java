package org.hypertrace.core.select.service.params;

import static org.hypertrace.core.select.service.SelectServiceTestUtils.buildConfig;
import static org.hypertrace.core.select.service.SelectServiceTestUtils.request;
import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.QueryTooLongException;
import org.junit.jupiter.api.Test;

class QueryParameterResolverTest {
  private final QueryParameterResolver resolver = new QueryParameterResolver(buildConfig());

  @Test
  void emptyOrInvertedRangeIsWidenedByDefaultStep() {
    long[][] ranges = {{1000, 1000}, {5000, 1000}, {0, 0}, {123_456, 7}};
    for (long[] range : ranges) {
      TimeWindow window = resolver.resolveRange(range[0], range[1], 1000, false);
      assertEquals(range[0], window.getStart());
      assertEquals(range[0] + DEFAULT_STEP_MILLIS, window.getEnd());
    }
  }

  @Test
  void tooManyPoints() {
    assertThrows(
        QueryExecutionException.class, () -> resolver.resolveRange(0, 30_001_000, 1000, false));
  }

  @Test
  void adjustStartEndAlignsLongRanges() {
    TimeWindow window = QueryParameterResolver.adjustStartEnd(1_010, 100_020, 1000);
    assertEquals(1_000, window.getStart());
    assertEquals(100_000, window.getEnd());
    assertTrue(window.getPoints() <= (100_020 - 1_010) / 1000 + 1);

    TimeWindow shortWindow = QueryParameterResolver.adjustStartEnd(1_010, 5_020, 1000);
    assertEquals(new TimeWindow(1_010, 5_020, 1000), shortWindow);
  }

  @Test
  void lookbackFallsBackToStalenessInterval() {
    QueryParameterResolver withStaleness =
        new QueryParameterResolver(buildConfig("search.maxStalenessInterval = 2m"));
    assertEquals(120_000, withStaleness.getLookbackDelta(request()));
    assertEquals(60_000, withStaleness.getLookbackDelta(request("max_lookback", "1m")));
    assertEquals(0, resolver.getLookbackDelta(request()));

    QueryParameterResolver withLookback =
        new QueryParameterResolver(
            buildConfig("search { maxLookback = 3m, maxStalenessInterval = 2m }"));
    assertEquals(180_000, withLookback.getLookbackDelta(request()));
  }

  @Test
  void queryOffsetHasOneSecondMinimum() {
    assertEquals(30_000, resolver.getQueryOffset());
    QueryParameterResolver shortOffset =
        new QueryParameterResolver(buildConfig("search.latencyOffset = 10ms"));
    assertEquals(1000, shortOffset.getQueryOffset());
  }

  @Test
  void tooLongQuery() {
    resolver.checkQueryLength(StringUtils.repeat('a', 16 * 1024));
    QueryTooLongException e =
        assertThrows(
            QueryTooLongException.class,
            () -> resolver.checkQueryLength(StringUtils.repeat('a', 16 * 1024 + 1)));
    assertEquals(16 * 1024, e.getLimit());
    assertTrue(e.getMessage().contains("16384"));
  }

  @Test
  void instantQueryNearNowIsShifted() {
    long ct = 1_000_000;
    InstantTime shifted = resolver.resolveInstant(ct - 1000, ct, true);
    assertEquals(ct - 30_000, shifted.getEvalTime());
    assertEquals(29_000, shifted.getShift());

    assertEquals(new InstantTime(ct - 1000, 0), resolver.resolveInstant(ct - 1000, ct, false));
    assertEquals(new InstantTime(ct - 60_000, 0), resolver.resolveInstant(ct - 60_000, ct, true));
  }

  @Test
  void denyPartialResponse() {
    assertFalse(resolver.isDenyPartialResponse(request()));
    assertTrue(resolver.isDenyPartialResponse(request("deny_partial_response", "1")));
    assertTrue(
        new QueryParameterResolver(buildConfig("search.denyPartialResponse = true"))
            .isDenyPartialResponse(request()));
  }
}
