package org.hypertrace.core.select.service.api;

import java.io.IOException;
import java.util.List;

/**
 * Fan-out client for the storage nodes. Every call contacts all the nodes and merges the answers;
 * nodes that fail to answer before the deadline mark the result as partial instead of failing the
 * call, unless none of them answered.
 */
public interface StorageClient {

  /**
   * @param fetchData false when only the metric names of the matching series are needed
   */
  SearchResults processSearchQuery(
      AuthToken authToken, SearchQuery searchQuery, boolean fetchData, Deadline deadline);

  /**
   * Streams raw blocks to the visitor from several workers.
   *
   * @return true when the result is partial
   */
  boolean exportBlocks(
      AuthToken authToken, SearchQuery searchQuery, Deadline deadline, BlockVisitor visitor)
      throws IOException;

  /** @return the number of deleted series */
  int deleteSeries(AuthToken authToken, SearchQuery searchQuery, Deadline deadline);

  PartialResult<List<String>> getLabelValues(
      AuthToken authToken, String labelName, Deadline deadline);

  PartialResult<List<String>> getLabels(AuthToken authToken, Deadline deadline);

  PartialResult<List<LabelEntry>> getLabelEntries(AuthToken authToken, Deadline deadline);

  /** @param date days since the unix epoch */
  PartialResult<TsdbStatus> getTsdbStatusForDate(
      AuthToken authToken, Deadline deadline, long date, int topN);

  PartialResult<Long> getSeriesCount(AuthToken authToken, Deadline deadline);
}
