package org.hypertrace.core.select.service.handler;

import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.params.MetricSelectorParser;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.hypertrace.core.select.service.params.RequestParams;
import org.hypertrace.core.select.service.partial.CacheResetBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes every series matching {@code match[]}. Deletion is not bounded in time. Rollup result
 * caches of the select nodes are reset in the background once something was deleted.
 */
class DeleteSeriesHandler implements EndpointHandler {
  private static final Logger LOG = LoggerFactory.getLogger(DeleteSeriesHandler.class);

  private final StorageClient storageClient;
  private final QueryParameterResolver resolver;
  private final CacheResetBroadcaster cacheResetBroadcaster;

  @Inject
  DeleteSeriesHandler(
      StorageClient storageClient,
      QueryParameterResolver resolver,
      CacheResetBroadcaster cacheResetBroadcaster) {
    this.storageClient = storageClient;
    this.resolver = resolver;
    this.cacheResetBroadcaster = cacheResetBroadcaster;
  }

  @Override
  public String getPath() {
    return "/api/v1/admin/tsdb/delete_series";
  }

  @Override
  public void handle(RequestContext context, SelectRequest request, ResponseSink sink) {
    if (request.hasFormValue("start") || request.hasFormValue("end")) {
      throw new RequestValidationException(
          "start and end aren't supported. "
              + "Remove these args from the query in order to delete all the matching metrics");
    }
    List<String> matches = RequestParams.getMatches(request, false);
    SearchQuery searchQuery =
        SearchQuery.forDelete(context.getAuthToken(), MetricSelectorParser.parseMatches(matches));
    int deletedCount;
    try {
      deletedCount =
          storageClient.deleteSeries(
              context.getAuthToken(),
              searchQuery,
              resolver.getDeadlineForQuery(request, context.getStartTime()));
    } catch (StorageException e) {
      throw new QueryExecutionException(
          String.format("cannot delete time series matching %s: %s", matches, e.getMessage()), e);
    }
    LOG.info("Deleted {} series matching {}", deletedCount, matches);
    if (deletedCount > 0) {
      cacheResetBroadcaster.resetRollupResultCaches();
    }
  }
}
