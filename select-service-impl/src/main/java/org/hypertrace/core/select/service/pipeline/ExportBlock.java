package org.hypertrace.core.select.service.pipeline;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import javax.annotation.Nullable;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.api.StorageBlock;
import org.hypertrace.core.select.service.api.TimeRange;

/**
 * One series worth of rows to export: the metric identity plus a window {@code [from, to)} into
 * timestamp, value and payload arrays. The arrays are either borrowed from a {@link Series} or
 * owned scratch space filled from a decoded {@link StorageBlock}. Borrowed arrays are never
 * retained past {@link #reset()}.
 */
public class ExportBlock implements Poolable {
  /** Value given to every sample of a block exported in reduced memory mode. */
  public static final double PLACEHOLDER_VALUE = 1.0;

  private MetricName metricName;
  private long[] timestamps;
  private double[] values;
  @Nullable private byte[][] payloads;
  private int from;
  private int to;

  private long[] scratchTimestamps = new long[0];
  private double[] scratchValues = new double[0];
  private byte[][] scratchPayloads = new byte[0][];

  /** Borrows the point arrays of the series. */
  public void wrap(Series series) {
    this.metricName = series.getMetricName();
    this.timestamps = series.getTimestamps();
    this.values = series.getValues();
    this.payloads = series.getPayloads();
    this.from = 0;
    this.to = series.size();
  }

  /** Copies the rows of a decoded block falling into the time range into scratch arrays. */
  public void fill(MetricName metricName, StorageBlock block, TimeRange timeRange) {
    this.metricName = metricName;
    int[] n = new int[1];
    block.forEachRow(
        timeRange,
        (timestamp, payload) -> {
          int i = n[0];
          ensureScratchCapacity(i + 1);
          scratchTimestamps[i] = timestamp;
          scratchValues[i] = PLACEHOLDER_VALUE;
          scratchPayloads[i] = payload;
          n[0] = i + 1;
        });
    this.timestamps = scratchTimestamps;
    this.values = scratchValues;
    this.payloads = scratchPayloads;
    this.from = 0;
    this.to = n[0];
  }

  private void ensureScratchCapacity(int size) {
    if (scratchTimestamps.length >= size) {
      return;
    }
    int capacity = Math.max(size, 2 * scratchTimestamps.length);
    scratchTimestamps = Arrays.copyOf(scratchTimestamps, capacity);
    scratchValues = Arrays.copyOf(scratchValues, capacity);
    scratchPayloads = Arrays.copyOf(scratchPayloads, capacity);
  }

  public MetricName getMetricName() {
    return metricName;
  }

  /** Restricts the rows to {@code [from, to)} relative to the whole block. */
  void setWindow(int from, int to) {
    Preconditions.checkArgument(0 <= from && from <= to && to <= timestamps.length);
    this.from = from;
    this.to = to;
  }

  int getFrom() {
    return from;
  }

  int getTo() {
    return to;
  }

  /** Number of rows in the current window. */
  public int size() {
    return to - from;
  }

  public boolean isEmpty() {
    return to == from;
  }

  public long getTimestamp(int i) {
    return timestamps[from + i];
  }

  public double getValue(int i) {
    return values[from + i];
  }

  public boolean hasPayloads() {
    return payloads != null;
  }

  public byte[] getPayload(int i) {
    return payloads[from + i];
  }

  @Override
  public void reset() {
    metricName = null;
    timestamps = null;
    values = null;
    payloads = null;
    from = 0;
    to = 0;
    Arrays.fill(scratchPayloads, null);
  }
}
