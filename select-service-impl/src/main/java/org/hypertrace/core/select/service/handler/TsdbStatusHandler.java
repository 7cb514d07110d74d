package org.hypertrace.core.select.service.handler;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.PartialResult;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.api.TsdbStatus;
import org.hypertrace.core.select.service.format.AdminResponseWriter;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;

/** Cardinality statistics of a day, {@code date=YYYY-MM-DD} defaulting to the current day. */
class TsdbStatusHandler implements EndpointHandler {
  static final int DEFAULT_TOP_N = 10;
  static final int MAX_TOP_N = 1000;

  private final StorageClient storageClient;
  private final QueryParameterResolver resolver;
  private final PartialResponsePolicy partialResponsePolicy;

  @Inject
  TsdbStatusHandler(
      StorageClient storageClient,
      QueryParameterResolver resolver,
      PartialResponsePolicy partialResponsePolicy) {
    this.storageClient = storageClient;
    this.resolver = resolver;
    this.partialResponsePolicy = partialResponsePolicy;
  }

  @Override
  public String getPath() {
    return "/api/v1/status/tsdb";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException {
    long date = getDate(request, context.getCurrentTimeMillis());
    int topN = getTopN(request);
    PartialResult<TsdbStatus> status;
    try {
      status =
          storageClient.getTsdbStatusForDate(
              context.getAuthToken(),
              resolver.getDeadlineForQuery(request, context.getStartTime()),
              date,
              topN);
    } catch (StorageException e) {
      throw new QueryExecutionException(
          String.format(
              "cannot obtain tsdb status for date=%d, topN=%d: %s", date, topN, e.getMessage()),
          e);
    }
    partialResponsePolicy.check(
        status.isPartial(), resolver.isDenyPartialResponse(request), () -> {});

    sink.setContentType(JsonFormats.CONTENT_TYPE_JSON);
    BufferedResponseWriter writer = new BufferedResponseWriter(sink.getOutputStream());
    AdminResponseWriter.writeTsdbStatus(writer, status.getValue(), status.isPartial());
    writer.flush();
  }

  /** Days since the unix epoch. */
  static long getDate(SelectRequest request, long ct) {
    String date = request.getFormValue("date");
    if (date.isEmpty()) {
      return TimeUnit.MILLISECONDS.toDays(ct);
    }
    try {
      return LocalDate.parse(date).toEpochDay();
    } catch (DateTimeParseException e) {
      throw new RequestValidationException(
          String.format("cannot parse `date` arg %s: %s", date, e.getMessage()), e);
    }
  }

  static int getTopN(SelectRequest request) {
    String topN = request.getFormValue("topN");
    if (topN.isEmpty()) {
      return DEFAULT_TOP_N;
    }
    int n;
    try {
      n = Integer.parseInt(topN);
    } catch (NumberFormatException e) {
      throw new RequestValidationException(
          String.format("cannot parse `topN` arg %s: %s", topN, e.getMessage()), e);
    }
    return Math.min(Math.max(n, 1), MAX_TOP_N);
  }
}
