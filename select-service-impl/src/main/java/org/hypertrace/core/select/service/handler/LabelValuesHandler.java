package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.Deadline;
import org.hypertrace.core.select.service.api.PartialResult;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.api.TagFilter;
import org.hypertrace.core.select.service.format.AdminResponseWriter;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;
import org.hypertrace.core.select.service.util.SearchQueryUtil;

/**
 * Values of a label. With {@code match[]}, {@code start} or {@code end} only the series matching
 * the selectors on the time range are considered, as Grafana's {@code label_values} does.
 */
class LabelValuesHandler implements EndpointHandler {
  static final String LABEL_NAME_PARAM = "name";

  private final StorageClient storageClient;
  private final SeriesSearch seriesSearch;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  LabelValuesHandler(
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
    return "/api/v1/label/{" + LABEL_NAME_PARAM + "}/values";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    String labelName =
        request
            .getPathParam(LABEL_NAME_PARAM)
            .orElseThrow(() -> new RequestValidationException("missing label name"));
    Deadline deadline = resolver.getDeadlineForQuery(request, context.getStartTime());
    PartialResult<List<String>> labelValues;
    if (!request.hasFormValue(RequestParams.ARG_MATCH)
        && !request.hasFormValue("start")
        && !request.hasFormValue("end")) {
      try {
        labelValues = storageClient.getLabelValues(context.getAuthToken(), labelName, deadline);
      } catch (StorageException e) {
        throw new QueryExecutionException(
            String.format("cannot obtain label values for %s: %s", labelName, e.getMessage()), e);
      }
    } else {
      List<String> matches = request.getFormValues(RequestParams.ARG_MATCH);
      if (matches.isEmpty()) {
        matches = List.of(String.format("{%s!=''}", labelName));
      }
      long end = RequestParams.getTime(request, "end", context.getCurrentTimeMillis());
      long start = RequestParams.getTime(request, "start", end - DEFAULT_STEP_MILLIS);
      if (start >= end) {
        end = start + DEFAULT_STEP_MILLIS;
      }
      List<List<TagFilter>> tagFilterss =
          SearchQueryUtil.addNonEmptyLabelFilter(
              MetricSelectorParser.parseMatches(matches), labelName);
      SearchQuery searchQuery = SearchQuery.of(context.getAuthToken(), start, end, tagFilterss);
      labelValues =
          seriesSearch.collectLabelValues(
              context.getAuthToken(), searchQuery, labelName, deadline);
    }
    partialResponsePolicy.check(
        labelValues.isPartial(), resolver.isDenyPartialResponse(request), () -> {});

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    AdminResponseWriter.writeStrings(writer, labelValues.getValue(), labelValues.isPartial());
    writer.flush();
  }
}
