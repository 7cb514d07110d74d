package org.hypertrace.core.select.service.api;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import javax.annotation.Nullable;

/**
 * One time series returned by the storage nodes or the evaluator.
 *
 * <p>The point arrays are owned by the series and may be compacted in place by the alignment
 * stage. Timestamps are milliseconds and never decrease. Payloads hold the raw log line of every
 * sample and are either absent or exactly as long as the timestamps.
 */
public class Series {
  private final MetricName metricName;
  private final long metricNameHash;
  private long[] timestamps;
  private double[] values;
  @Nullable private byte[][] payloads;

  public Series(
      MetricName metricName,
      long metricNameHash,
      long[] timestamps,
      double[] values,
      @Nullable byte[][] payloads) {
    this.metricName = metricName;
    this.metricNameHash = metricNameHash;
    replacePoints(timestamps, values, payloads);
  }

  public static Series of(MetricName metricName, long[] timestamps, double[] values) {
    return new Series(metricName, hashOf(metricName), timestamps, values, null);
  }

  public static Series withPayloads(
      MetricName metricName, long[] timestamps, double[] values, byte[][] payloads) {
    return new Series(metricName, hashOf(metricName), timestamps, values, payloads);
  }

  /** Stable hash of the metric identity; used to key tail cursors and deduplication. */
  public static long hashOf(MetricName metricName) {
    return Hashing.murmur3_128().hashBytes(metricName.marshalWithoutTenant()).asLong();
  }

  public MetricName getMetricName() {
    return metricName;
  }

  public long getMetricNameHash() {
    return metricNameHash;
  }

  public long[] getTimestamps() {
    return timestamps;
  }

  public double[] getValues() {
    return values;
  }

  @Nullable
  public byte[][] getPayloads() {
    return payloads;
  }

  public boolean hasPayloads() {
    return payloads != null;
  }

  public int size() {
    return timestamps.length;
  }

  public boolean isEmpty() {
    return timestamps.length == 0;
  }

  public long getLastTimestamp() {
    Preconditions.checkState(!isEmpty(), "series %s has no points", metricName);
    return timestamps[timestamps.length - 1];
  }

  public final void replacePoints(
      long[] timestamps, double[] values, @Nullable byte[][] payloads) {
    Preconditions.checkArgument(
        timestamps.length == values.length,
        "timestamps and values length mismatch: %s vs %s",
        timestamps.length,
        values.length);
    Preconditions.checkArgument(
        payloads == null || payloads.length == timestamps.length,
        "timestamps and payloads length mismatch");
    this.timestamps = timestamps;
    this.values = values;
    this.payloads = payloads;
  }

  @Override
  public String toString() {
    return "Series{" + metricName + ", points=" + timestamps.length + "}";
  }
}
