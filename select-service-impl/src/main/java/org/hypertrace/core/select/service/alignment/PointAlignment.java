package org.hypertrace.core.select.service.alignment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;
import org.hypertrace.core.select.service.api.Series;

/** Point level corrections applied to evaluated series before they are written. */
public class PointAlignment {

  private PointAlignment() {}

  /**
   * Drops NaN samples and, when a tail filter is given, samples at or before the cursor of their
   * series. Series left without samples are removed from the result. Point arrays are compacted in
   * a single pass; series that need no change are passed through untouched.
   */
  public static List<Series> removeFilteredValuesAndTimeseries(
      List<Series> series, @Nullable TailCursorTable filter) {
    List<Series> dst = new ArrayList<>(series.size());
    for (Series s : series) {
      boolean filtered = filter != null && filter.contains(s.getMetricNameHash());
      if (!filtered && !containsNaN(s.getValues())) {
        if (!s.isEmpty()) {
          dst.add(s);
        }
        continue;
      }
      long lastTs = filtered ? filter.getLastTimestamp(s.getMetricNameHash()) : Long.MIN_VALUE;
      compact(s, lastTs);
      if (!s.isEmpty()) {
        dst.add(s);
      }
    }
    return dst;
  }

  /**
   * Replaces samples in {@code (boundary, upperBound]} with the last value before the boundary, or
   * NaN when there is none, since such points may still be incomplete. A series whose last
   * timestamp is beyond {@code upperBound} is left as is: an {@code offset} moved it out of the
   * window and it is unclear which of its points are stale.
   */
  public static List<Series> adjustLastPoints(
      List<Series> series, long boundary, long upperBound) {
    for (Series s : series) {
      long[] timestamps = s.getTimestamps();
      double[] values = s.getValues();
      int j = timestamps.length - 1;
      if (j >= 0 && timestamps[j] > upperBound) {
        continue;
      }
      while (j >= 0 && timestamps[j] > boundary) {
        j--;
      }
      j++;
      double lastValue = j > 0 ? values[j - 1] : Double.NaN;
      while (j < timestamps.length && timestamps[j] <= upperBound) {
        values[j] = lastValue;
        j++;
      }
    }
    return series;
  }

  private static void compact(Series s, long lastTs) {
    long[] timestamps = s.getTimestamps();
    double[] values = s.getValues();
    byte[][] payloads = s.getPayloads();
    int n = 0;
    for (int j = 0; j < values.length; j++) {
      if (Double.isNaN(values[j]) || timestamps[j] <= lastTs) {
        continue;
      }
      timestamps[n] = timestamps[j];
      values[n] = values[j];
      if (payloads != null) {
        payloads[n] = payloads[j];
      }
      n++;
    }
    if (n == values.length) {
      return;
    }
    s.replacePoints(
        Arrays.copyOf(timestamps, n),
        Arrays.copyOf(values, n),
        payloads == null ? null : Arrays.copyOf(payloads, n));
  }

  private static boolean containsNaN(double[] values) {
    for (double v : values) {
      if (Double.isNaN(v)) {
        return true;
      }
    }
    return false;
  }
}
