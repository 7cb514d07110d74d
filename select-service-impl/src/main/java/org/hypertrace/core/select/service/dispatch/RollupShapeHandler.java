package org.hypertrace.core.select.service.dispatch;

import java.io.IOException;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;

/**
 * Serves {@code expr[window:step] offset off} as a range query of {@code expr} over the window
 * ending at the shifted evaluation time. A step in the brackets replaces the query step.
 */
class RollupShapeHandler implements QueryShapeHandler {
  private static final QueryCost COST = new QueryCost(0.5);

  private final RangeQueryExecutor rangeQueryExecutor;

  @Inject
  RollupShapeHandler(RangeQueryExecutor rangeQueryExecutor) {
    this.rangeQueryExecutor = rangeQueryExecutor;
  }

  @Override
  public String getName() {
    return "rollup";
  }

  @Override
  public QueryCost canHandle(InstantQuery query) {
    return query
        .getRollupSugar()
        .filter(RollupSugar::hasStep)
        .filter(
            sugar ->
                MetricSelectorParser.isSelector(sugar.getChildQuery())
                    || QueryShapeParser.isFunctionCall(sugar.getChildQuery()))
        .map(sugar -> COST)
        .orElse(QueryCost.UNSUPPORTED);
  }

  @Override
  public void handle(InstantQuery query, ResponseSink sink) throws IOException {
    RollupSugar sugar = query.getRollupSugar().orElseThrow();
    long step = RollupWindows.parseStep(sugar.getStep().orElse(""), query.getStep());
    long window = RollupWindows.parseWindow(sugar.getWindow(), step);
    long offset = RollupWindows.parseOffset(sugar.getOffset(), step);
    long end = query.getTime() - offset;
    long start = end - window;

    RangeQuery rangeQuery =
        RangeQuery.builder()
            .authToken(query.getContext().getAuthToken())
            .query(sugar.getChildQuery())
            .start(start)
            .end(end)
            .step(step)
            .limit(query.getLimit())
            .forward(query.isForward())
            .ct(query.getContext().getCurrentTimeMillis())
            .deadline(query.getDeadline())
            .mayCache(query.isMayCache())
            .lookbackDelta(query.getLookbackDelta())
            .denyPartialResponse(query.isDenyPartialResponse())
            .build();
    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    rangeQueryExecutor.execute(rangeQuery, writer, null);
  }
}
