package org.hypertrace.core.select.service.api;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * What to fetch from the storage nodes. {@code tagFilterss} is a disjunction of filter sets: a
 * series is selected when it matches all the filters of at least one set.
 */
@Value
public class SearchQuery {
  int accountId;
  int projectId;
  long minTimestamp;
  long maxTimestamp;
  List<List<TagFilter>> tagFilterss;

  private SearchQuery(
      int accountId,
      int projectId,
      long minTimestamp,
      long maxTimestamp,
      List<List<TagFilter>> tagFilterss) {
    this.accountId = accountId;
    this.projectId = projectId;
    this.minTimestamp = minTimestamp;
    this.maxTimestamp = maxTimestamp;
    this.tagFilterss =
        tagFilterss.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
  }

  /** Builds a query over a time range; at least one filter set is required. */
  public static SearchQuery of(
      AuthToken authToken, long minTimestamp, long maxTimestamp, List<List<TagFilter>> filterss) {
    Preconditions.checkArgument(
        !filterss.isEmpty(), "search query requires at least one match expression");
    return new SearchQuery(
        authToken.getAccountId(), authToken.getProjectId(), minTimestamp, maxTimestamp, filterss);
  }

  /** Builds a delete query, which is not bounded in time. */
  public static SearchQuery forDelete(AuthToken authToken, List<List<TagFilter>> filterss) {
    return new SearchQuery(authToken.getAccountId(), authToken.getProjectId(), 0, 0, filterss);
  }

  public TimeRange getTimeRange() {
    return new TimeRange(minTimestamp, maxTimestamp);
  }

  @Override
  public String toString() {
    return String.format(
        "accountID=%d, projectID=%d, filters=%s, timeRange=[%d..%d]",
        accountId, projectId, tagFilterss, minTimestamp, maxTimestamp);
  }
}
