package org.hypertrace.core.select.service.dispatch;

import static org.hypertrace.core.select.service.dispatch.DispatchTestUtils.instantQuery;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.hypertrace.core.select.service.ByteArrayResponseSink;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.export.ExportFormat;
import org.hypertrace.core.select.service.export.ExportRequest;
import org.hypertrace.core.select.service.export.SeriesExporter;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.pipeline.BufferedResponseWriter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class QueryShapeHandlersTest {
  private static final long TIME = 100_000_000;

  private final SeriesExporter seriesExporter = mock(SeriesExporter.class);
  private final RangeQueryExecutor rangeQueryExecutor = mock(RangeQueryExecutor.class);
  private final RawExportShapeHandler rawExport = new RawExportShapeHandler(seriesExporter);
  private final RollupShapeHandler rollup = new RollupShapeHandler(rangeQueryExecutor);
  private final EvaluatorShapeHandler evaluator = new EvaluatorShapeHandler(null, null, null);

  @Test
  void rawExportServesSelectorWithWindowOnly() {
    assertEquals(0.1, cost(rawExport, "up{job=\"a\"}[5m]"));
    assertEquals(-1, cost(rawExport, "up{job=\"a\"}[5m:1m]"));
    assertEquals(-1, cost(rawExport, "rate(up[1m])[5m]"));
    assertEquals(-1, cost(rawExport, "up{job=\"a\"}"));
  }

  @Test
  void rollupServesSelectorOrFunctionCallWithStep() {
    assertEquals(0.5, cost(rollup, "up[1h:5m]"));
    assertEquals(0.5, cost(rollup, "rate(up[1m])[1h:]"));
    assertEquals(-1, cost(rollup, "rate(up[1m])[1h]"));
    assertEquals(-1, cost(rollup, "sum(a) + sum(b)[1h:5m]"));
  }

  @Test
  void evaluatorServesEveryQuery() {
    assertEquals(1.0, cost(evaluator, "up"));
    assertEquals(1.0, cost(evaluator, "sum(a) + sum(b)[1h:5m]"));
  }

  @Test
  void rawExportExportsShiftedWindow() throws Exception {
    ByteArrayResponseSink sink = new ByteArrayResponseSink();

    rawExport.handle(instantQuery("up{job=\"a\"}[5m] offset 1h", TIME, TIME).build(), sink);

    ArgumentCaptor<ExportRequest> captor = ArgumentCaptor.forClass(ExportRequest.class);
    verify(seriesExporter).export(captor.capture(), any());
    ExportRequest request = captor.getValue();
    assertEquals(TIME - 3_600_000, request.getEnd());
    assertEquals(TIME - 3_600_000 - 300_000, request.getStart());
    assertEquals(ExportFormat.PROMAPI, request.getFormat());
    assertEquals(1, request.getTagFilterss().size());
  }

  @Test
  void rawExportRejectsNegativeWindow() {
    InstantQuery query = instantQuery("up[-5m]", TIME, TIME).build();

    assertThrows(
        RequestValidationException.class,
        () -> rawExport.handle(query, new ByteArrayResponseSink()));
    verifyNoInteractions(seriesExporter);
  }

  @Test
  void rollupRunsChildAsRangeQuery() throws Exception {
    ByteArrayResponseSink sink = new ByteArrayResponseSink();
    InstantQuery query =
        instantQuery("rate(foo[1m])[1h:5m] offset 1d", TIME, TIME + 1)
            .step(60_000)
            .mayCache(true)
            .build();

    rollup.handle(query, sink);

    ArgumentCaptor<RangeQuery> captor = ArgumentCaptor.forClass(RangeQuery.class);
    verify(rangeQueryExecutor)
        .execute(captor.capture(), any(BufferedResponseWriter.class), isNull());
    RangeQuery rangeQuery = captor.getValue();
    assertEquals("rate(foo[1m])", rangeQuery.getQuery());
    assertEquals(TIME - 86_400_000, rangeQuery.getEnd());
    assertEquals(TIME - 86_400_000 - 3_600_000, rangeQuery.getStart());
    assertEquals(300_000, rangeQuery.getStep());
    assertEquals(TIME + 1, rangeQuery.getCt());
    assertFalse(rangeQuery.isTail());
    assertEquals(JsonFormats.CONTENT_TYPE_JSON, sink.getContentType());
  }

  private static double cost(QueryShapeHandler handler, String query) {
    return handler.canHandle(instantQuery(query, TIME, TIME).build()).getCost();
  }
}
