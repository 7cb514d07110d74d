package org.hypertrace.core.select.service.handler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.api.AuthToken;
import org.hypertrace.core.select.service.api.Deadline;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.PartialResult;
import org.hypertrace.core.select.service.api.SearchQuery;
import org.hypertrace.core.select.service.api.SearchResults;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.api.StorageException;
import org.hypertrace.core.select.service.api.TagFilter;

/** Searches of the matching series shared by the label and series endpoints. */
@Singleton
public class SeriesSearch {
  private final StorageClient storageClient;

  @Inject
  public SeriesSearch(StorageClient storageClient) {
    this.storageClient = storageClient;
  }

  public SearchResults search(
      AuthToken authToken, SearchQuery searchQuery, boolean fetchData, Deadline deadline) {
    try {
      return storageClient.processSearchQuery(authToken, searchQuery, fetchData, deadline);
    } catch (StorageException e) {
      throw new QueryExecutionException(
          String.format("cannot fetch data for %s: %s", searchQuery, e.getMessage()), e);
    }
  }

  /** Distinct non-empty values of the label over the matching series, sorted. */
  public PartialResult<List<String>> collectLabelValues(
      AuthToken authToken, SearchQuery searchQuery, String labelName, Deadline deadline)
      throws IOException {
    SearchResults results = search(authToken, searchQuery, false, deadline);
    Set<String> values = ConcurrentHashMap.newKeySet();
    runParallel(
        results,
        metricName ->
            metricName.getTagValue(labelName).filter(v -> !v.isEmpty()).ifPresent(values::add));
    return PartialResult.of(sorted(values), results.isPartial());
  }

  /** Label names of the matching series plus {@code __name__}, sorted. */
  public PartialResult<List<String>> collectLabels(
      AuthToken authToken, SearchQuery searchQuery, Deadline deadline) throws IOException {
    SearchResults results = search(authToken, searchQuery, false, deadline);
    Set<String> labels = ConcurrentHashMap.newKeySet();
    runParallel(
        results,
        metricName -> {
          metricName.getTags().forEach(tag -> labels.add(tag.getKey()));
          labels.add(TagFilter.METRIC_NAME_LABEL);
        });
    return PartialResult.of(sorted(labels), results.isPartial());
  }

  private static void runParallel(SearchResults results, Consumer<MetricName> consumer)
      throws IOException {
    try {
      results.runParallel((series, workerId) -> consumer.accept(series.getMetricName()));
    } catch (StorageException e) {
      throw new QueryExecutionException("error when data fetching: " + e.getMessage(), e);
    }
  }

  private static List<String> sorted(Set<String> values) {
    List<String> list = new ArrayList<>(values);
    list.sort(null);
    return list;
  }
}
