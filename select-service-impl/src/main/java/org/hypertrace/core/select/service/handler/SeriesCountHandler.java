package org.hypertrace.core.select.service.handler;

import java.io.IOException;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
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

class SeriesCountHandler implements EndpointHandler {
  private final StorageClient storageClient;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  SeriesCountHandler(
      StorageClient storageClient,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy) {
    this.storageClient = storageClient;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  @Override
  public String getPath() {
    return "/api/v1/series/count";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    PartialResult<Long> count;
    try {
      count =
          storageClient.getSeriesCount(
              context.getAuthToken(),
              resolver.getDeadlineForQuery(request, context.getStartTime()));
    } catch (StorageException e) {
      throw new QueryExecutionException("cannot obtain series count: " + e.getMessage(), e);
    }
    partialResponsePolicy.check(
        count.isPartial(), resolver.isDenyPartialResponse(request), () -> {});

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    AdminResponseWriter.writeSeriesCount(writer, count.getValue(), count.isPartial());
    writer.flush();
  }
}
