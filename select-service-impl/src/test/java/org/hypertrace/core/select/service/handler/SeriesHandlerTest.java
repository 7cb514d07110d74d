package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.SelectServiceTestUtils.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.hypertrace.core.select.service.ByteArrayResponseSink;
import org.hypertrace.core.select.service.ClusterIncompleteException;
import org.hypertrace.core.select.service.FakeSearchResults;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.SelectServiceTestUtils;
import org.hypertrace.core.select.service.api.AuthToken;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.MetricName.Tag;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.hypertrace.core.select.service.pipeline.ResultBufferPool;
import org.hypertrace.core.select.service.pipeline.StreamingResultPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SeriesHandlerTest {
  private static final AuthToken AUTH_TOKEN = AuthToken.of(3, 0);
  private static final long CT = 1_700_000_000_000L;

  private ExecutorService executor;
  private StorageClient storageClient;
  private SeriesHandler handler;
  private final RequestContext context = new RequestContext(AUTH_TOKEN, Instant.ofEpochMilli(CT));
  private final ByteArrayResponseSink sink = new ByteArrayResponseSink();

  @BeforeEach
  void setup() {
    executor = Executors.newCachedThreadPool();
    storageClient = mock(StorageClient.class);
    handler =
        new SeriesHandler(
            new SeriesSearch(storageClient),
            new StreamingResultPipeline(executor, new ResultBufferPool()),
            new QueryParameterResolver(SelectServiceTestUtils.buildConfig()),
            new PartialResponsePolicy());
  }

  @AfterEach
  void teardown() {
    executor.shutdownNow();
  }

  @Test
  void streamsMetricNamesOfMatchingSeries() throws Exception {
    searchReturns(
        new FakeSearchResults(
            List.of(
                series(MetricName.of("up", List.of(Tag.of("job", "a")))),
                series(MetricName.of("down"))),
            false));

    handler.handle(context, request("match[]", "up", "match[]", "down"), sink);

    assertEquals(
        "{\"status\":\"success\",\"isPartial\":false,"
            + "\"data\":[{\"__name__\":\"up\",\"job\":\"a\"},{\"__name__\":\"down\"}]}",
        sink.getBody());
    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(storageClient).processSearchQuery(eq(AUTH_TOKEN), captor.capture(), eq(false), any());
    assertEquals(2, captor.getValue().getTagFilterss().size());
    assertEquals(CT - 300_000, captor.getValue().getMinTimestamp());
    assertEquals(CT, captor.getValue().getMaxTimestamp());
  }

  @Test
  void widensInvertedRange() throws Exception {
    searchReturns(new FakeSearchResults(List.of(), false));

    handler.handle(context, request("match[]", "up", "start", "2000", "end", "1000"), sink);

    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(storageClient).processSearchQuery(eq(AUTH_TOKEN), captor.capture(), eq(false), any());
    assertEquals(2_000_000, captor.getValue().getMinTimestamp());
    assertEquals(2_300_000, captor.getValue().getMaxTimestamp());
    assertEquals("{\"status\":\"success\",\"isPartial\":false,\"data\":[]}", sink.getBody());
  }

  @Test
  void requiresMatch() {
    assertThrows(RequestValidationException.class, () -> handler.handle(context, request(), sink));
    verifyNoInteractions(storageClient);
  }

  @Test
  void cancelsDeniedPartialSearch() {
    FakeSearchResults results =
        new FakeSearchResults(List.of(series(MetricName.of("up"))), true);
    searchReturns(results);

    assertThrows(
        ClusterIncompleteException.class,
        () ->
            handler.handle(
                context, request("match[]", "up", "deny_partial_response", "true"), sink));
    assertTrue(results.isCancelled());
    assertNull(sink.getContentType());
  }

  private void searchReturns(FakeSearchResults results) {
    when(storageClient.processSearchQuery(eq(AUTH_TOKEN), any(), anyBoolean(), any()))
        .thenReturn(results);
  }

  private static Series series(MetricName metricName) {
    return Series.of(metricName, new long[0], new double[0]);
  }
}
