package org.hypertrace.core.select.service.handler;

import static org.hypertrace.core.select.service.SelectServiceTestUtils.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.hypertrace.core.select.service.ByteArrayResponseSink;
import org.hypertrace.core.select.service.ClusterIncompleteException;
import org.hypertrace.core.select.service.FakeSearchResults;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.SelectServiceTestUtils;
import org.hypertrace.core.select.service.api.AuthToken;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.MetricName.Tag;
import org.hypertrace.core.select.service.api.PartialResult;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.partial.PartialResponsePolicy;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LabelsHandlerTest {
  private static final AuthToken AUTH_TOKEN = AuthToken.of(3, 0);
  private static final long CT = 1_700_000_000_000L;

  private final StorageClient storageClient = mock(StorageClient.class);
  private final LabelsHandler handler =
      new LabelsHandler(
          storageClient,
          new SeriesSearch(storageClient),
          new QueryParameterResolver(SelectServiceTestUtils.buildConfig()),
          new PartialResponsePolicy());
  private final RequestContext context = new RequestContext(AUTH_TOKEN, Instant.ofEpochMilli(CT));
  private final ByteArrayResponseSink sink = new ByteArrayResponseSink();

  @Test
  void readsLabelsFromIndexWithoutFilters() throws Exception {
    when(storageClient.getLabels(eq(AUTH_TOKEN), any()))
        .thenReturn(PartialResult.of(List.of("__name__", "job"), false));

    handler.handle(context, request(), sink);

    assertEquals(
        "{\"status\":\"success\",\"isPartial\":false,\"data\":[\"__name__\",\"job\"]}",
        sink.getBody());
  }

  @Test
  void collectsLabelsOfMatchingSeries() throws Exception {
    when(storageClient.processSearchQuery(eq(AUTH_TOKEN), any(), anyBoolean(), any()))
        .thenReturn(
            new FakeSearchResults(
                List.of(
                    series(MetricName.of("up", List.of(Tag.of("job", "a")))),
                    series(MetricName.of("down", List.of(Tag.of("instance", "h1"))))),
                true));

    handler.handle(context, request("match[]", "{job=~\".+\"}", "start", "1699999000"), sink);

    assertEquals(
        "{\"status\":\"success\",\"isPartial\":true,"
            + "\"data\":[\"__name__\",\"instance\",\"job\"]}",
        sink.getBody());
    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(storageClient).processSearchQuery(eq(AUTH_TOKEN), captor.capture(), eq(false), any());
    assertEquals(1_699_999_000_000L, captor.getValue().getMinTimestamp());
    assertEquals(CT, captor.getValue().getMaxTimestamp());
  }

  @Test
  void rejectsDeniedPartialLabels() {
    when(storageClient.getLabels(eq(AUTH_TOKEN), any()))
        .thenReturn(PartialResult.of(List.of("job"), true));

    assertThrows(
        ClusterIncompleteException.class,
        () -> handler.handle(context, request("deny_partial_response", "1"), sink));
    assertEquals("", sink.getBody());
  }

  @Test
  void wrapsStorageErrors() {
    when(storageClient.getLabels(eq(AUTH_TOKEN), any()))
        .thenThrow(new StorageException("node unavailable"));

    QueryExecutionException e =
        assertThrows(
            QueryExecutionException.class, () -> handler.handle(context, request(), sink));
    assertEquals("cannot obtain labels: node unavailable", e.getMessage());
  }

  private static Series series(MetricName metricName) {
    return Series.of(metricName, new long[0], new double[0]);
  }
}
