package org.hypertrace.core.select.service.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Cardinality statistics for a single day. */
@Value
@Builder
public class TsdbStatus {
  @Singular("metricNameEntry")
  List<TopEntry> seriesCountByMetricName;

  @Singular("labelNameEntry")
  List<TopEntry> labelValueCountByLabelName;

  @Singular("labelValuePairEntry")
  List<TopEntry> seriesCountByLabelValuePair;

  @Value(staticConstructor = "of")
  public static class TopEntry {
    @NonNull String name;
    long count;
  }
}
