package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_LIMIT;
import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import java.io.IOException;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.dispatch.InstantQuery;
import org.hypertrace.core.select.service.dispatch.QueryDispatcher;
import org.hypertrace.core.select.service.dispatch.QueryShapeParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;

class QueryHandler implements EndpointHandler {
  private final QueryDispatcher queryDispatcher;
  private final QueryParameterResolver resolver;

  @Inject
  QueryHandler(QueryDispatcher queryDispatcher, QueryParameterResolver resolver) {
    this.queryDispatcher = queryDispatcher;
    this.resolver = resolver;
  }

  @Override
  public String getPath() {
    return "/api/v1/query";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    String query = RequestParams.getRequiredString(request, "query");
    long time = RequestParams.getTime(request, "time", context.getCurrentTimeMillis());
    long lookbackDelta = resolver.getLookbackDelta(request);
    long step = RequestParams.getDuration(request, "step", lookbackDelta);
    if (step <= 0) {
      step = DEFAULT_STEP_MILLIS;
    }
    long limit = RequestParams.getInt64(request, "limit", DEFAULT_LIMIT);
    boolean forward = "forward".equals(RequestParams.getString(request, "direction", "backward"));
    resolver.checkQueryLength(query);

    InstantQuery instantQuery =
        InstantQuery.builder()
            .request(request)
            .context(context)
            .query(query)
            .time(time)
            .step(step)
            .limit(limit)
            .forward(forward)
            .lookbackDelta(lookbackDelta)
            .deadline(resolver.getDeadlineForQuery(request, context.getStartTime()))
            .mayCache(resolver.isMayCache(request))
            .denyPartialResponse(resolver.isDenyPartialResponse(request))
            .rollupSugar(QueryShapeParser.parse(query).orElse(null))
            .build();
    queryDispatcher.dispatch(instantQuery, sink);
  }
}
