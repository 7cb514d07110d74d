package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_LIMIT;
import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import io.reactivex.rxjava3.core.Scheduler;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Named;
import org.hypertrace.core.select.service.SelectServiceConfig;
import org.hypertrace.core.select.service.SelectServiceConfig.TailConfig;
import org.hypertrace.core.select.service.alignment.TailSession;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.dispatch.RangeQuery;
import org.hypertrace.core.select.service.dispatch.RangeQueryExecutor;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live tail of a log query. Every poll writes one message with the entries that appeared since
 * the previous poll; the response ends once {@code limit} entries were written.
 */
class TailHandler implements EndpointHandler {
  private static final Logger LOG = LoggerFactory.getLogger(TailHandler.class);

  private final RangeQueryExecutor rangeQueryExecutor;
  private final QueryParameterResolver resolver;
  private final TailConfig tailConfig;
  private final Scheduler scheduler;
  private final Clock clock;

  @Inject
  TailHandler(
      RangeQueryExecutor rangeQueryExecutor,
      QueryParameterResolver resolver,
      SelectServiceConfig selectServiceConfig,
      @Named(EndpointHandlerModule.TAIL_SCHEDULER) Scheduler scheduler,
      Clock clock) {
    this.rangeQueryExecutor = rangeQueryExecutor;
    this.resolver = resolver;
    this.tailConfig = selectServiceConfig.getTailConfig();
    this.scheduler = scheduler;
    this.clock = clock;
  }

  @Override
  public String getPath() {
    return "/api/v1/tail";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    String query = RequestParams.getRequiredString(request, "query");
    long ct = context.getCurrentTimeMillis();
    long start = RequestParams.getTime(request, "start", ct - DEFAULT_STEP_MILLIS);
    long limit = RequestParams.getInt64(request, "limit", DEFAULT_LIMIT);

    RangeQuery template =
        RangeQuery.builder()
            .authToken(context.getAuthToken())
            .query(query)
            .step(tailConfig.getStep().toMillis())
            .deadline(resolver.getDeadlineForQuery(request, context.getStartTime()))
            .mayCache(resolver.isMayCache(request))
            .lookbackDelta(resolver.getLookbackDelta(request))
            .denyPartialResponse(resolver.isDenyPartialResponse(request))
            .tail(true)
            .build();

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    TailSession session =
        new TailSession(
            start,
            limit,
            (pollStart, pollEnd, pollLimit, filter) -> {
              RangeQuery rangeQuery =
                  template.toBuilder()
                      .start(pollStart)
                      .end(pollEnd)
                      .limit(pollLimit)
                      .ct(pollEnd)
                      .deadline(
                          resolver.getDeadlineForQuery(request, Instant.ofEpochMilli(pollEnd)))
                      .build();
              LOG.debug(
                  "Tail poll of query={} on the time range (start={}, end={}, limit={})",
                  query,
                  pollStart,
                  pollEnd,
                  pollLimit);
              return rangeQueryExecutor.execute(rangeQuery, writer, filter);
            });
    session.run(tailConfig.getPollInterval(), scheduler, clock::millis);
  }
}
