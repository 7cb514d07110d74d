package org.hypertrace.core.select.service.util;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.core.select.service.api.TagFilter;

/** Utility methods to easily create tag filters and filter sets for a search query. */
public class SearchQueryUtil {

  public static TagFilter createEqualsFilter(String key, String value) {
    return new TagFilter(normalizeKey(key), value, false, false);
  }

  public static TagFilter createNotEqualsFilter(String key, String value) {
    return new TagFilter(normalizeKey(key), value, true, false);
  }

  public static TagFilter createRegexpFilter(String key, String value) {
    return new TagFilter(normalizeKey(key), value, false, true);
  }

  public static TagFilter createNotRegexpFilter(String key, String value) {
    return new TagFilter(normalizeKey(key), value, true, true);
  }

  /** Filter set selecting every series that has a metric name. */
  public static List<List<TagFilter>> createAnyMetricNameFilterss() {
    return List.of(List.of(createNotEqualsFilter(TagFilter.METRIC_NAME_LABEL, "")));
  }

  /**
   * Adds {@code key!=""} to every filter set so only series carrying the label are selected. The
   * metric name is present on every series, so nothing is added for it.
   */
  public static List<List<TagFilter>> addNonEmptyLabelFilter(
      List<List<TagFilter>> filterss, String key) {
    if (TagFilter.METRIC_NAME_LABEL.equals(key)) {
      return filterss;
    }
    TagFilter nonEmpty = createNotEqualsFilter(key, "");
    return filterss.stream()
        .map(
            filters -> {
              List<TagFilter> copy = new ArrayList<>(filters.size() + 1);
              copy.addAll(filters);
              copy.add(nonEmpty);
              return copy;
            })
        .collect(Collectors.toList());
  }

  private static String normalizeKey(String key) {
    return TagFilter.METRIC_NAME_LABEL.equals(key) ? "" : key;
  }
}
