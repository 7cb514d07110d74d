package org.hypertrace.core.select.service.dispatch;

import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.api.EvalConfig;
import org.hypertrace.core.select.service.api.EvaluationResult;
import org.hypertrace.core.select.service.api.ExpressionKind;
import org.hypertrace.core.select.service.api.QueryEvaluator;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.format.QueryResponseWriter;
import org.hypertrace.core.select.service.params.InstantTime;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;

/** Hands the query unchanged to the expression evaluator. Supports every query. */
class EvaluatorShapeHandler implements QueryShapeHandler {
  private static final QueryCost COST = new QueryCost(1.0);

  private final QueryEvaluator queryEvaluator;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  EvaluatorShapeHandler(
      QueryEvaluator queryEvaluator,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy) {
    this.queryEvaluator = queryEvaluator;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  @Override
  public String getName() {
    return "evaluator";
  }

  @Override
  public QueryCost canHandle(InstantQuery query) {
    return COST;
  }

  @Override
  public void handle(InstantQuery query, ResponseSink sink) throws IOException {
    InstantTime instantTime =
        resolver.resolveInstant(
            query.getTime(), query.getContext().getCurrentTimeMillis(), query.isMayCache());
    EvalConfig evalConfig =
        EvalConfig.builder()
            .authToken(query.getContext().getAuthToken())
            .start(instantTime.getEvalTime())
            .end(instantTime.getEvalTime())
            .step(query.getStep())
            .limit(query.getLimit())
            .forward(query.isForward())
            .deadline(query.getDeadline())
            .lookbackDelta(query.getLookbackDelta())
            .denyPartialResponse(query.isDenyPartialResponse())
            .build();
    EvaluationResult result;
    try {
      result = queryEvaluator.evaluate(evalConfig, query.getQuery(), true);
    } catch (StorageException e) {
      throw new QueryExecutionException(
          String.format(
              "error when executing query=%s for (time=%d, step=%d): %s",
              query.getQuery(), instantTime.getEvalTime(), query.getStep(), e.getMessage()),
          e);
    }
    partialResponsePolicy.check(result.isPartial(), query.isDenyPartialResponse(), () -> {});
    shiftTimestamps(result.getSeries(), instantTime.getShift());

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    if (result.getKind() == ExpressionKind.STREAMS) {
      QueryResponseWriter.writeStreams(writer, result.getSeries(), result.isPartial());
    } else {
      QueryResponseWriter.writeVector(writer, result.getSeries(), result.isPartial());
    }
    writer.flush();
  }

  private static void shiftTimestamps(List<Series> series, long shift) {
    if (shift == 0) {
      return;
    }
    for (Series s : series) {
      long[] timestamps = s.getTimestamps();
      for (int i = 0; i < timestamps.length; i++) {
        timestamps[i] += shift;
      }
    }
  }
}
