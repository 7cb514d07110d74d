package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.SearchResults;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.format.PrometheusTextWriter;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;
import org.hypertrace.core.select.service.pipeline.ResultBuffer;
import org.hypertrace.core.select.service.pipeline.ResultBufferPool;

/** Latest sample of every matching series in the Prometheus text format. */
class FederateHandler implements EndpointHandler {
  private final SeriesSearch seriesSearch;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;
  private final ResultBufferPool bufferPool;

  @Inject
  FederateHandler(
      SeriesSearch seriesSearch,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy,
      ResultBufferPool bufferPool) {
    this.seriesSearch = seriesSearch;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
    this.bufferPool = bufferPool;
  }

  @Override
  public String getPath() {
    return "/federate";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    long ct = context.getCurrentTimeMillis();
    List<String> matches = RequestParams.getMatches(request, false);
    long lookbackDelta = resolver.getLookbackDelta(request);
    if (lookbackDelta <= 0) {
      lookbackDelta = DEFAULT_STEP_MILLIS;
    }
    long start = RequestParams.getTime(request, "start", ct - lookbackDelta);
    long end = RequestParams.getTime(request, "end", ct);
    if (start >= end) {
      start = end - DEFAULT_STEP_MILLIS;
    }
    SearchQuery searchQuery =
        SearchQuery.of(
            context.getAuthToken(), start, end, MetricSelectorParser.parseMatches(matches));
    SearchResults results =
        seriesSearch.search(
            context.getAuthToken(),
            searchQuery,
            true,
            resolver.getDeadlineForQuery(request, context.getStartTime()));
    partialResponsePolicy.check(
        results.isPartial(), resolver.isDenyPartialResponse(request), results::cancel);

    sink.setContentType(PrometheusTextWriter.CONTENT_TYPE);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    try {
      results.runParallel(
          (series, workerId) -> {
            writer.checkError();
            ResultBuffer buffer = bufferPool.claim();
            try {
              PrometheusTextWriter.writeFederate(buffer, series);
              writer.write(buffer);
            } finally {
              bufferPool.release(buffer);
            }
          });
    } catch (StorageException e) {
      throw new QueryExecutionException("error during data fetching: " + e.getMessage(), e);
    }
    writer.flush();
  }
}
