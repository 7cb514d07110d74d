package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_LIMIT;
import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import java.io.IOException;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.dispatch.RangeQuery;
import org.hypertrace.core.select.service.dispatch.RangeQueryExecutor;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;

class QueryRangeHandler implements EndpointHandler {
  private final RangeQueryExecutor rangeQueryExecutor;
  private final QueryParameterResolver resolver;

  @Inject
  QueryRangeHandler(RangeQueryExecutor rangeQueryExecutor, QueryParameterResolver resolver) {
    this.rangeQueryExecutor = rangeQueryExecutor;
    this.resolver = resolver;
  }

  @Override
  public String getPath() {
    return "/api/v1/query_range";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    long ct = context.getCurrentTimeMillis();
    String query = RequestParams.getRequiredString(request, "query");
    long start = RequestParams.getTime(request, "start", ct - DEFAULT_STEP_MILLIS);
    long end = RequestParams.getTime(request, "end", ct);
    long step = RequestParams.getDuration(request, "step", DEFAULT_STEP_MILLIS);
    long limit = RequestParams.getInt64(request, "limit", DEFAULT_LIMIT);
    boolean forward = "forward".equals(RequestParams.getString(request, "direction", "backward"));

    RangeQuery rangeQuery =
        RangeQuery.builder()
            .authToken(context.getAuthToken())
            .query(query)
            .start(start)
            .end(end)
            .step(step)
            .limit(limit)
            .forward(forward)
            .ct(ct)
            .deadline(resolver.getDeadlineForQuery(request, context.getStartTime()))
            .mayCache(resolver.isMayCache(request))
            .lookbackDelta(resolver.getLookbackDelta(request))
            .denyPartialResponse(resolver.isDenyPartialResponse(request))
            .build();
    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    rangeQueryExecutor.execute(rangeQuery, writer, null);
  }
}
