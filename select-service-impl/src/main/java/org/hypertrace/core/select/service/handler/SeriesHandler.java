package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.SearchResults;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.export.ResponseFramers;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;
import org.hypertrace.core.select.service.pipeline.ResultBuffer;
import org.hypertrace.core.select.service.pipeline.StreamingResultPipeline;

/**
 * Streams the names of the series matching {@code match[]}. The range defaults to the last
 * default step before {@code end} rather than all the data, which would scan the whole storage.
 */
class SeriesHandler implements EndpointHandler {
  private final SeriesSearch seriesSearch;
  private final StreamingResultPipeline pipeline;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  SeriesHandler(
      SeriesSearch seriesSearch,
      StreamingResultPipeline pipeline,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy) {
    this.seriesSearch = seriesSearch;
    this.pipeline = pipeline;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  @Override
  public String getPath() {
    return "/api/v1/series";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    List<String> matches = RequestParams.getMatches(request, false);
    long end = RequestParams.getTime(request, "end", context.getCurrentTimeMillis());
    long start = RequestParams.getTime(request, "start", end - DEFAULT_STEP_MILLIS);
    if (start >= end) {
      end = start + DEFAULT_STEP_MILLIS;
    }
    SearchQuery searchQuery =
        SearchQuery.of(
            context.getAuthToken(), start, end, MetricSelectorParser.parseMatches(matches));
    SearchResults results =
        seriesSearch.search(
            context.getAuthToken(),
            searchQuery,
            false,
            resolver.getDeadlineForQuery(request, context.getStartTime()));
    partialResponsePolicy.check(
        results.isPartial(), resolver.isDenyPartialResponse(request), results::cancel);

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    pipeline.stream(
        writer,
        emitter ->
            results.runParallel(
                (series, workerId) -> {
                  emitter.checkWriter();
                  ResultBuffer buffer = emitter.claim();
                  try (JsonGenerator generator = JsonFormats.newGenerator(buffer)) {
                    JsonFormats.writeMetricName(generator, series.getMetricName());
                  }
                  emitter.emit(buffer);
                }),
        ResponseFramers.seriesList(results.isPartial()));
  }
}
