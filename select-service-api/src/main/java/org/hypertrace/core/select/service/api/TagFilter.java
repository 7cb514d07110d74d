package org.hypertrace.core.select.service.api;

import lombok.NonNull;
import lombok.Value;

/**
 * A single label matcher. An empty key addresses the metric name. Negative filters select series
 * that do not match; regexp filters match the value as an anchored regular expression.
 */
@Value
public class TagFilter {
  public static final String METRIC_NAME_LABEL = "__name__";

  @NonNull String key;
  @NonNull String value;
  boolean negative;
  boolean regexp;

  @Override
  public String toString() {
    String op;
    if (regexp) {
      op = negative ? "!~" : "=~";
    } else {
      op = negative ? "!=" : "=";
    }
    String printedKey = key.isEmpty() ? METRIC_NAME_LABEL : key;
    return printedKey + op + "\"" + value + "\"";
  }
}
