package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.SelectServiceTestUtils.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.hypertrace.core.select.service.ByteArrayResponseSink;
import org.hypertrace.core.select.service.FakeSearchResults;
import org.hypertrace.core.select.service.SelectServiceTestUtils;
import org.hypertrace.core.select.service.api.AuthToken;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.export.SeriesExporter;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.ResultBufferPool;
import org.hypertrace.core.select.service.pipeline.StreamingResultPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExportHandlerTest {
  private static final AuthToken AUTH_TOKEN = AuthToken.of(3, 0);
  private static final long CT = 1_700_000_000_000L;

  private ExecutorService executor;
  private StorageClient storageClient;
  private ExportHandler handler;
  private final RequestContext context = new RequestContext(AUTH_TOKEN, Instant.ofEpochMilli(CT));
  private final ByteArrayResponseSink sink = new ByteArrayResponseSink();

  @BeforeEach
  void setup() throws Exception {
    executor = Executors.newCachedThreadPool();
    storageClient = mock(StorageClient.class);
    handler =
        new ExportHandler(
            new SeriesExporter(
                storageClient,
                new StreamingResultPipeline(executor, new ResultBufferPool()),
                new PartialResponsePolicy()),
            new QueryParameterResolver(SelectServiceTestUtils.buildConfig()));
    when(storageClient.processSearchQuery(eq(AUTH_TOKEN), any(), anyBoolean(), any()))
        .thenReturn(
            new FakeSearchResults(
                List.of(
                    Series.of(
                        MetricName.of("up"),
                        new long[] {1000, 2000, 3000, 4000, 5000},
                        new double[] {1, 2, 3, 4, 5})),
                false));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void splitsSeriesIntoLinesOfMaxRows() throws Exception {
    handler.handle(context, request("match[]", "up", "max_rows_per_line", "2"), sink);

    assertEquals(3, lines().length);
  }

  @Test
  void maxRowsAboveIntRangeKeepsSeriesOnOneLine() throws Exception {
    handler.handle(context, request("match[]", "up", "max_rows_per_line", "4294967298"), sink);

    String[] lines = lines();
    assertEquals(1, lines.length);
    assertEquals(
        "{\"metric\":{\"__name__\":\"up\"},\"values\":[1,2,3,4,5],"
            + "\"timestamps\":[1000,2000,3000,4000,5000]}",
        lines[0]);
  }

  private String[] lines() {
    return sink.getBody().split("\n");
  }
}
