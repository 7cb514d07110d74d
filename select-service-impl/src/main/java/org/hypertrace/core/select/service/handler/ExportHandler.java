package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.params.QueryParameterResolver.DEFAULT_STEP_MILLIS;

import com.google.common.primitives.Ints;
import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.export.ExportFormat;
import org.hypertrace.core.select.service.export.ExportRequest;
import org.hypertrace.core.select.service.export.SeriesExporter;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;

class ExportHandler implements EndpointHandler {
  private final SeriesExporter seriesExporter;
  private final QueryParameterResolver resolver;

  @Inject
  ExportHandler(SeriesExporter seriesExporter, QueryParameterResolver resolver) {
    this.seriesExporter = seriesExporter;
    this.resolver = resolver;
  }

  @Override
  public String getPath() {
    return "/api/v1/export";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    long ct = context.getCurrentTimeMillis();
    List<String> matches = RequestParams.getMatches(request, true);
    long start = RequestParams.getTime(request, "start", 0);
    long end = RequestParams.getTime(request, "end", ct);
    if (start >= end) {
      end = start + DEFAULT_STEP_MILLIS;
    }
    ExportRequest exportRequest =
        ExportRequest.builder()
            .authToken(context.getAuthToken())
            .tagFilterss(MetricSelectorParser.parseMatches(matches))
            .start(start)
            .end(end)
            .format(ExportFormat.fromArg(request.getFormValue("format")))
            .maxRowsPerLine(
                Ints.saturatedCast(RequestParams.getInt64(request, "max_rows_per_line", 0)))
            .reduceMemUsage(RequestParams.getBool(request, "reduce_mem_usage"))
            .deadline(resolver.getDeadlineForExport(request, context.getStartTime()))
            .denyPartialResponse(resolver.isDenyPartialResponse(request))
            .build();
    seriesExporter.export(exportRequest, sink);
  }
}
