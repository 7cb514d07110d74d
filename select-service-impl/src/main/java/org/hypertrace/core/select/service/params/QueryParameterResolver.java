package org.hypertrace.core.select.service.params;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.QueryTooLongException;
import org.hypertrace.core.select.service.SelectServiceConfig;
import org.hypertrace.core.select.service.SelectServiceConfig.SearchConfig;
import org.hypertrace.core.select.service.api.Deadline;
import org.hypertrace.core.select.service.api.SelectRequest;

/**
 * Derives effective time ranges, lookback, offsets and deadlines from request arguments and the
 * configured search limits.
 */
@Singleton
public class QueryParameterResolver {
  public static final long DEFAULT_STEP_MILLIS = 5 * 60 * 1000;
  public static final long DEFAULT_LIMIT = 1000;

  static final long MIN_QUERY_OFFSET_MILLIS = 1000;
  static final long MIN_POINTS_FOR_TIME_ROUNDING = 50;

  private static final String FLAG_MAX_QUERY_DURATION = "search.maxQueryDuration";
  private static final String FLAG_MAX_EXPORT_DURATION = "search.maxExportDuration";

  private final SearchConfig config;

  @Inject
  public QueryParameterResolver(SelectServiceConfig selectServiceConfig) {
    this.config = selectServiceConfig.getSearchConfig();
  }

  /**
   * Per-request {@code max_lookback}, else the configured max lookback, else the max staleness
   * interval. Zero means the caller picks its own window.
   */
  public long getLookbackDelta(SelectRequest request) {
    long d = config.getMaxLookback().toMillis();
    if (d == 0) {
      d = config.getMaxStalenessInterval().toMillis();
    }
    return RequestParams.getDuration(request, "max_lookback", d);
  }

  /** How long freshly ingested points may take to become visible to queries. */
  public long getQueryOffset() {
    return Math.max(MIN_QUERY_OFFSET_MILLIS, config.getLatencyOffset().toMillis());
  }

  public void checkQueryLength(String query) {
    int length = query.getBytes(StandardCharsets.UTF_8).length;
    if (length > config.getMaxQueryLen()) {
      throw new QueryTooLongException(length, config.getMaxQueryLen());
    }
  }

  /**
   * Resolves the range of a range query. An empty or inverted range is widened to one default
   * step; when caching is allowed the range is aligned to the step.
   */
  public TimeWindow resolveRange(long start, long end, long step, boolean mayCache) {
    if (start >= end) {
      end = start + DEFAULT_STEP_MILLIS;
    }
    validateMaxPointsPerTimeseries(start, end, step);
    if (mayCache) {
      return adjustStartEnd(start, end, step);
    }
    return new TimeWindow(start, end, step);
  }

  public void validateMaxPointsPerTimeseries(long start, long end, long step) {
    long points = (end - start) / step + 1;
    if (points > config.getMaxPointsPerTimeseries()) {
      throw new QueryExecutionException(
          String.format(
              "too many points for the given step=%d, start=%d and end=%d: %d; "
                  + "cannot exceed `search.maxPointsPerTimeseries=%d`",
              step, start, end, points, config.getMaxPointsPerTimeseries()));
    }
  }

  /**
   * Rounds start down and end up to multiples of step so results may be cached, without
   * increasing the number of points. Short ranges are left untouched.
   */
  public static TimeWindow adjustStartEnd(long start, long end, long step) {
    long points = (end - start) / step + 1;
    if (points < MIN_POINTS_FOR_TIME_ROUNDING) {
      return new TimeWindow(start, end, step);
    }
    start -= start % step;
    long adjust = end % step;
    if (adjust > 0) {
      end += step - adjust;
    }
    long newPoints = (end - start) / step + 1;
    while (newPoints > points) {
      end -= step;
      newPoints--;
    }
    return new TimeWindow(start, end, step);
  }

  /**
   * Moves an instant query that is too close to {@code ct} back to {@code ct - queryOffset}, so
   * points that may still be incomplete are not returned.
   */
  public InstantTime resolveInstant(long time, long ct, boolean mayCache) {
    long queryOffset = getQueryOffset();
    if (mayCache && ct - time < queryOffset && time - ct < queryOffset) {
      long evalTime = ct - queryOffset;
      return new InstantTime(evalTime, time - evalTime);
    }
    return new InstantTime(time, 0);
  }

  public Deadline getDeadlineForQuery(SelectRequest request, Instant startTime) {
    return RequestParams.getDeadline(
        request, startTime, config.getMaxQueryDuration(), FLAG_MAX_QUERY_DURATION);
  }

  public Deadline getDeadlineForExport(SelectRequest request, Instant startTime) {
    return RequestParams.getDeadline(
        request, startTime, config.getMaxExportDuration(), FLAG_MAX_EXPORT_DURATION);
  }

  public boolean isDenyPartialResponse(SelectRequest request) {
    return config.isDenyPartialResponse()
        || RequestParams.getBool(request, "deny_partial_response");
  }

  public boolean isMayCache(SelectRequest request) {
    return !RequestParams.getBool(request, "nocache");
  }
}
