package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.api.Deadline;
import org.hypertrace.core.select.service.api.PartialResult;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.format.AdminResponseWriter;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;

class LabelsHandler implements EndpointHandler {
  private static final String ANY_METRIC_MATCH = "{__name__!=''}";

  private final StorageClient storageClient;
  private final SeriesSearch seriesSearch;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  LabelsHandler(
      StorageClient storageClient,
      SeriesSearch seriesSearch,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy) {
    this.storageClient = storageClient;
    this.seriesSearch = seriesSearch;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  @Override
  public String getPath() {
    return "/api/v1/labels";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    Deadline deadline = resolver.getDeadlineForQuery(request, context.getStartTime());
    PartialResult<List<String>> labels;
    if (!request.hasFormValue(RequestParams.ARG_MATCH)
        && !request.hasFormValue("start")
        && !request.hasFormValue("end")) {
      try {
        labels = storageClient.getLabels(context.getAuthToken(), deadline);
      } catch (StorageException e) {
        throw new QueryExecutionException("cannot obtain labels: " + e.getMessage(), e);
      }
    } else {
      List<String> matches = request.getFormValues(RequestParams.ARG_MATCH);
      if (matches.isEmpty()) {
        matches = List.of(ANY_METRIC_MATCH);
      }
      long end = RequestParams.getTime(request, "end", context.getCurrentTimeMillis());
      long start = RequestParams.getTime(request, "start", end - DEFAULT_STEP_MILLIS);
      if (start >= end) {
        end = start + DEFAULT_STEP_MILLIS;
      }
      SearchQuery searchQuery =
          SearchQuery.of(
              context.getAuthToken(), start, end, MetricSelectorParser.parseMatches(matches));
      labels = seriesSearch.collectLabels(context.getAuthToken(), searchQuery, deadline);
    }
    partialResponsePolicy.check(
        labels.isPartial(), resolver.isDenyPartialResponse(request), () -> {});

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    AdminResponseWriter.writeStrings(writer, labels.getValue(), labels.isPartial());
    writer.flush();
  }
}
