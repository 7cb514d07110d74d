package org.hypertrace.core.select.service.handler;

import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.export.ExportRequest;
import org.hypertrace.core.select.service.export.SeriesExporter;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;

class ExportNativeHandler implements EndpointHandler {
  private final SeriesExporter seriesExporter;
  private final QueryParameterResolver resolver;

  @Inject
  ExportNativeHandler(SeriesExporter seriesExporter, QueryParameterResolver resolver) {
    this.seriesExporter = seriesExporter;
    this.resolver = resolver;
  }

  @Override
  public String getPath() {
    return "/api/v1/export/native";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    List<String> matches = RequestParams.getMatches(request, true);
    ExportRequest exportRequest =
        ExportRequest.builder()
            .authToken(context.getAuthToken())
            .tagFilterss(MetricSelectorParser.parseMatches(matches))
            .start(RequestParams.getTime(request, "start", 0))
            .end(RequestParams.getTime(request, "end", context.getCurrentTimeMillis()))
            .deadline(resolver.getDeadlineForExport(request, context.getStartTime()))
            .denyPartialResponse(resolver.isDenyPartialResponse(request))
            .build();
    seriesExporter.exportNative(exportRequest, sink);
  }
}
