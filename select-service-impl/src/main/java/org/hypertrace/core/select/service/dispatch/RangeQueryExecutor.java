package org.hypertrace.core.select.service.dispatch;

import java.io.IOException;
import java.util.List;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.alignment.PointAlignment;
import org.hypertrace.core.select.service.alignment.TailCursorTable;
import org.hypertrace.core.select.service.api.EvalConfig;
import org.hypertrace.core.select.service.api.EvaluationResult;
import org.hypertrace.core.select.service.api.ExpressionKind;
import org.hypertrace.core.select.service.api.QueryEvaluator;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.format.QueryResponseWriter;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.TimeWindow;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a range query and writes the aligned result. Shared by {@code /api/v1/query_range},
 * rollup shaped instant queries and every poll of a live tail.
 */
@Singleton
public class RangeQueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(RangeQueryExecutor.class);

  private final QueryEvaluator queryEvaluator;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  public RangeQueryExecutor(
      QueryEvaluator queryEvaluator,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy) {
    this.queryEvaluator = queryEvaluator;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  /**
   * @param filter cursors of a live tail; points at or before them are not written again
   * @return the written series
   */
  public List<Series> execute(
      RangeQuery rangeQuery, BufferedResponseWriter writer, @Nullable TailCursorTable filter)
      throws IOException {
    resolver.checkQueryLength(rangeQuery.getQuery());
    TimeWindow window =
        resolver.resolveRange(
            rangeQuery.getStart(),
            rangeQuery.getEnd(),
            rangeQuery.getStep(),
            rangeQuery.isMayCache());

    EvalConfig evalConfig =
        EvalConfig.builder()
            .authToken(rangeQuery.getAuthToken())
            .start(window.getStart())
            .end(window.getEnd())
            .step(window.getStep())
            .limit(rangeQuery.getLimit())
            .forward(rangeQuery.isForward())
            .deadline(rangeQuery.getDeadline())
            .mayCache(rangeQuery.isMayCache())
            .lookbackDelta(rangeQuery.getLookbackDelta())
            .denyPartialResponse(rangeQuery.isDenyPartialResponse())
            .build();
    EvaluationResult result;
    try {
      result = queryEvaluator.evaluate(evalConfig, rangeQuery.getQuery(), false);
    } catch (StorageException e) {
      throw new QueryExecutionException("cannot execute query: " + e.getMessage(), e);
    }
    partialResponsePolicy.check(result.isPartial(), rangeQuery.isDenyPartialResponse(), () -> {});

    List<Series> series = result.getSeries();
    if (result.getKind() == ExpressionKind.STREAMS) {
      series = PointAlignment.removeFilteredValuesAndTimeseries(series, filter);
      if (!rangeQuery.isTail()) {
        QueryResponseWriter.writeStreams(writer, series, result.isPartial());
      } else if (!series.isEmpty()) {
        QueryResponseWriter.writeTail(writer, series);
      }
    } else {
      long ct = rangeQuery.getCt();
      long queryOffset = resolver.getQueryOffset();
      if (ct - queryOffset < window.getEnd()) {
        series = PointAlignment.adjustLastPoints(series, ct - queryOffset, ct + window.getStep());
      }
      series = PointAlignment.removeFilteredValuesAndTimeseries(series, filter);
      QueryResponseWriter.writeMatrix(writer, series, result.isPartial());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "Range query {} on [{}, {}] step {} returned {} series",
          rangeQuery.getQuery(),
          window.getStart(),
          window.getEnd(),
          window.getStep(),
          series.size());
    }
    writer.flush();
    return series;
  }
}
