package org.hypertrace.core.select.service.handler;

import java.io.IOException;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.api.LabelEntry;
import org.hypertrace.core.select.service.api.PartialResult;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.format.AdminResponseWriter;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;

class LabelsCountHandler implements EndpointHandler {
  private final StorageClient storageClient;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  LabelsCountHandler(
      StorageClient storageClient,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy) {
    this.storageClient = storageClient;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  @Override
  public String getPath() {
    return "/api/v1/labels/count";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    PartialResult<List<LabelEntry>> labelEntries;
    try {
      labelEntries =
          storageClient.getLabelEntries(
              context.getAuthToken(),
              resolver.getDeadlineForQuery(request, context.getStartTime()));
    } catch (StorageException e) {
      throw new QueryExecutionException("cannot obtain label entries: " + e.getMessage(), e);
    }
    partialResponsePolicy.check(
        labelEntries.isPartial(), resolver.isDenyPartialResponse(request), () -> {});

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    AdminResponseWriter.writeLabelsCount(
        writer, labelEntries.getValue(), labelEntries.isPartial());
    writer.flush();
  }
}
